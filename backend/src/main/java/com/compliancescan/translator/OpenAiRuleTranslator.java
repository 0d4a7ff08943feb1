package com.compliancescan.translator;

import com.compliancescan.model.ColumnInfo;
import com.compliancescan.model.SchemaSnapshot;
import com.compliancescan.model.TableInfo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 基于 OpenAI 兼容 chat completions 接口的规则翻译服务，同时负责生成违规说明与整改建议
 */
public class OpenAiRuleTranslator implements RuleTranslator, ViolationExplainer {

    private static final Logger log = LoggerFactory.getLogger(OpenAiRuleTranslator.class);

    private static final String PROMPT_TEMPLATE = """
            Given the following compliance rule and database schema, generate a SQL query
            that identifies records violating this rule.

            Rule: %s
            Evaluation Criteria: %s
            %s
            Database Schema:
            %s

            Return only a single read-only SELECT statement that selects violating records.
            Include the primary key and relevant columns in the SELECT.
            The query should return records that VIOLATE the rule (non-compliant records).

            Return ONLY the SQL query, no additional text or explanation.
            """;

    private static final String JUSTIFICATION_PROMPT = """
            Explain why the following database record violates the compliance rule.
            Be specific and reference the actual field values.

            Rule: %s
            Evaluation Criteria: %s

            Record Data:
            %s

            Provide a clear, concise explanation suitable for a compliance review.
            State which field(s) are non-compliant, what the expected condition is,
            and the actual values found in the record.

            Return ONLY the explanation text, no additional formatting.
            """;

    private static final String REMEDIATION_PROMPT = """
            Suggest remediation steps for the following compliance violation.

            Rule: %s
            Violation: %s
            Record Data: %s

            Provide specific, actionable steps to resolve this violation, based on the actual data values.

            Return ONLY the remediation steps, no additional formatting.
            """;

    private static final String TRANSLATOR_ROLE = "You translate compliance rules into SQL.";
    private static final String REVIEWER_ROLE = "You are a compliance reviewer explaining rule violations.";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;
    private final String model;

    public OpenAiRuleTranslator(RestTemplate restTemplate, ObjectMapper objectMapper,
                                String baseUrl, String apiKey, String model) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.model = model;
    }

    @Override
    public TranslationResult translate(TranslationRequest request, SchemaSnapshot snapshot) {
        String prompt;
        try {
            prompt = buildPrompt(request, snapshot);
        } catch (JsonProcessingException e) {
            return TranslationResult.failure("无法序列化结构快照: " + e.getOriginalMessage());
        }

        String content;
        try {
            content = complete(TRANSLATOR_ROLE, prompt);
        } catch (RestClientException e) {
            log.warn("规则 {} 调用翻译服务失败: {}", request.ruleCode(), e.getMessage());
            return TranslationResult.failure("翻译服务调用失败: " + e.getMessage());
        }

        String sql = stripCodeFence(content);
        if (sql == null || sql.isBlank()) {
            return TranslationResult.failure("翻译服务返回为空");
        }
        log.debug("规则 {} 翻译结果: {}", request.ruleCode(), sql);
        return TranslationResult.ok(sql);
    }

    @Override
    public Optional<String> explainViolation(TranslationRequest rule, Map<String, Object> record) {
        try {
            String prompt = JUSTIFICATION_PROMPT.formatted(rule.description(), rule.evaluationCriteria(),
                    toJson(record));
            return nonBlank(complete(REVIEWER_ROLE, prompt));
        } catch (JsonProcessingException | RestClientException e) {
            log.warn("规则 {} 生成违规说明失败: {}", rule.ruleCode(), e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<String> suggestRemediation(TranslationRequest rule, String justification,
                                               Map<String, Object> record) {
        try {
            String prompt = REMEDIATION_PROMPT.formatted(rule.description(), justification, toJson(record));
            return nonBlank(complete(REVIEWER_ROLE, prompt));
        } catch (JsonProcessingException | RestClientException e) {
            log.warn("规则 {} 生成整改建议失败: {}", rule.ruleCode(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * 发送一次对话请求，返回模型回答；没有回答时返回 null
     */
    private String complete(String systemPrompt, String prompt) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("temperature", 0);
        body.put("messages", List.of(
                Map.of("role", "system", "content", systemPrompt),
                Map.of("role", "user", "content", prompt)));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(apiKey);

        JsonNode response = restTemplate.postForObject(baseUrl + "/chat/completions",
                new HttpEntity<>(body, headers), JsonNode.class);
        return response == null ? null
                : response.path("choices").path(0).path("message").path("content").asText(null);
    }

    private String toJson(Map<String, Object> record) throws JsonProcessingException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(record == null ? Map.of() : record);
    }

    private static Optional<String> nonBlank(String text) {
        return text == null || text.isBlank() ? Optional.empty() : Optional.of(text.strip());
    }

    String buildPrompt(TranslationRequest request, SchemaSnapshot snapshot) throws JsonProcessingException {
        String hint = request.targetTableHint() == null || request.targetTableHint().isBlank()
                ? ""
                : "Target Table: " + request.targetTableHint() + "\n";
        String schemaJson = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(describe(snapshot));
        return PROMPT_TEMPLATE.formatted(request.description(), request.evaluationCriteria(), hint, schemaJson);
    }

    private Map<String, Object> describe(SchemaSnapshot snapshot) {
        Map<String, Object> tables = new LinkedHashMap<>();
        for (TableInfo table : snapshot.getTables()) {
            List<Map<String, Object>> columns = new ArrayList<>();
            for (ColumnInfo column : table.columns()) {
                Map<String, Object> c = new LinkedHashMap<>();
                c.put("name", column.name());
                c.put("type", column.dataType());
                c.put("nullable", column.nullable());
                c.put("primary_key", column.primaryKey());
                columns.add(c);
            }
            tables.put(table.qualifiedName(), Map.of("columns", columns));
        }
        return Map.of("database", String.valueOf(snapshot.getDatabaseProduct()), "tables", tables);
    }

    /**
     * 去掉模型输出外层的 Markdown 代码块标记
     */
    static String stripCodeFence(String text) {
        if (text == null) {
            return null;
        }
        String cleaned = text.strip();
        if (cleaned.startsWith("```sql")) {
            cleaned = cleaned.substring(6);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.strip();
    }
}
