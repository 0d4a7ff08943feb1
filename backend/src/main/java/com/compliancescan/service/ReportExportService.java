package com.compliancescan.service;

import com.compliancescan.model.RuleOutcome;
import com.compliancescan.model.ScanRun;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * 扫描记录导出服务
 */
@Service
public class ReportExportService {

    private static final DateTimeFormatter FILE_TS = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss")
            .withZone(ZoneOffset.UTC);

    private final ObjectMapper objectMapper;

    public ReportExportService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ExportPayload exportMarkdown(ScanRun run) {
        byte[] content = buildMarkdown(run).getBytes(StandardCharsets.UTF_8);
        return new ExportPayload(
                "compliance-scan-" + formatFileTs(run.getStartedAt()) + ".md",
                "text/markdown;charset=UTF-8",
                content);
    }

    public ExportPayload exportJson(ScanRun run) {
        try {
            byte[] content = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(run);
            return new ExportPayload(
                    "compliance-scan-" + formatFileTs(run.getStartedAt()) + ".json",
                    "application/json;charset=UTF-8",
                    content);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON 导出失败: " + e.getOriginalMessage(), e);
        }
    }

    private String buildMarkdown(ScanRun run) {
        StringBuilder md = new StringBuilder();
        md.append("# 合规扫描报告\n\n");
        md.append("**扫描 ID:** `").append(escapeInlineCode(run.getId())).append("`\n");
        md.append("**触发方式:** ").append(run.getTrigger()).append("\n");
        md.append("**开始时间:** ").append(run.getStartedAt()).append("\n");
        md.append("**结束时间:** ").append(run.getCompletedAt() != null ? run.getCompletedAt() : "进行中").append("\n");
        md.append("**状态:** ").append(run.getStatus()).append("\n");
        if (notBlank(run.getSchemaVersion())) {
            md.append("**结构版本:** `").append(run.getSchemaVersion()).append("`\n");
        }
        md.append("\n");

        if (notBlank(run.getErrorMessage())) {
            md.append("> **扫描失败:** ").append(run.getErrorMessage().replace("\n", " ")).append("\n\n");
        }

        List<RuleOutcome> outcomes = run.getOutcomes() != null ? run.getOutcomes() : List.of();
        md.append("## 统计摘要\n");
        md.append("- **规则总数:** ").append(outcomes.size()).append("\n");
        md.append("- **成功执行:** ").append(outcomes.stream().filter(RuleOutcome::isEvaluated).count()).append("\n");
        md.append("- **新增违规:** ").append(run.getNewCount()).append("\n");
        md.append("- **持续违规:** ").append(run.getPersistingCount()).append("\n");
        md.append("- **已解除:** ").append(run.getResolvedCount()).append("\n\n");

        if (outcomes.isEmpty()) {
            md.append("本次扫描没有执行任何规则。\n");
            return md.toString();
        }

        md.append("## 规则执行结果\n\n");
        md.append("| 规则 | 结果 | 命中行数 | 耗时 (ms) | 说明 |\n");
        md.append("|------|------|----------|-----------|------|\n");
        for (RuleOutcome outcome : outcomes) {
            md.append("| ").append(escapeCell(outcome.ruleCode()))
                    .append(" | ").append(outcome.kind())
                    .append(" | ").append(outcome.isEvaluated() ? outcome.rowCount() + (outcome.truncated() ? "+" : "") : "-")
                    .append(" | ").append(outcome.durationMillis())
                    .append(" | ").append(escapeCell(outcome.reason()))
                    .append(" |\n");
        }
        return md.toString();
    }

    private String escapeInlineCode(String text) {
        return orEmpty(text).replace("`", "\\`");
    }

    private String escapeCell(String text) {
        return orEmpty(text).replace("|", "\\|").replace("\n", " ");
    }

    private String orEmpty(String text) {
        return text == null ? "" : text;
    }

    private boolean notBlank(String text) {
        return text != null && !text.isBlank();
    }

    private String formatFileTs(Instant time) {
        return FILE_TS.format(time != null ? time : Instant.now());
    }

    public record ExportPayload(String filename, String contentType, byte[] content) {
    }
}
