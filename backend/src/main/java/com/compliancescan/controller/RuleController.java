package com.compliancescan.controller;

import com.compliancescan.exception.ResourceNotFoundException;
import com.compliancescan.model.ComplianceRule;
import com.compliancescan.model.ComplianceRule.Severity;
import com.compliancescan.model.ReviewItem;
import com.compliancescan.service.RuleService;
import com.compliancescan.service.RuleService.ImportResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 合规规则管理
 */
@RestController
@RequestMapping("/api/rules")
@CrossOrigin(origins = "*")
public class RuleController {

    private static final Logger log = LoggerFactory.getLogger(RuleController.class);

    private final RuleService ruleService;

    public RuleController(RuleService ruleService) {
        this.ruleService = ruleService;
    }

    @GetMapping
    public ResponseEntity<List<ComplianceRule>> listRules() {
        return ResponseEntity.ok(ruleService.listRules());
    }

    /**
     * 注册单条规则
     */
    @PostMapping
    public ResponseEntity<?> createRule(@RequestBody ComplianceRule rule) {
        if (rule.getDescription() == null || rule.getDescription().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "请提供规则描述 (description)"));
        }
        try {
            ImportResult result = ruleService.registerAll(List.of(rule));
            if (result.imported().isEmpty()) {
                return ResponseEntity.status(HttpStatus.CONFLICT)
                        .body(Map.of("error", "规则编号已存在: " + rule.getRuleCode()));
            }
            return ResponseEntity.status(HttpStatus.CREATED).body(result.imported().get(0));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("注册规则失败", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "注册规则失败: " + e.getMessage()));
        }
    }

    /**
     * 上传 Word 规则表
     */
    @PostMapping("/upload")
    public ResponseEntity<?> uploadRules(@RequestParam("file") MultipartFile file) {
        if (file.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "请上传文件"));
        }

        String filename = file.getOriginalFilename();
        if (filename == null || !filename.toLowerCase(Locale.ROOT).endsWith(".docx")) {
            return ResponseEntity.badRequest().body(Map.of("error", "请上传 .docx 格式的 Word 文档"));
        }

        try {
            ImportResult result = ruleService.importRules(file.getInputStream());
            return ResponseEntity.ok(Map.of(
                    "message", "成功导入 " + result.imported().size() + " 条规则",
                    "rules", result.imported(),
                    "skipped", result.skipped()));
        } catch (Exception e) {
            log.error("上传规则文件失败", e);
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "解析文件失败: " + e.getMessage()));
        }
    }

    /**
     * 修改启用状态或严重等级，请求体 {"active": false} 或 {"severity": "HIGH"}
     */
    @PatchMapping("/{id}")
    public ResponseEntity<?> updateRule(@PathVariable String id, @RequestBody Map<String, Object> request) {
        try {
            Object active = request.get("active");
            if (active != null && !(active instanceof Boolean)) {
                return ResponseEntity.badRequest().body(Map.of("error", "active 必须为 true 或 false"));
            }
            Object severity = request.get("severity");
            Severity parsed = severity == null ? null
                    : Severity.valueOf(severity.toString().trim().toUpperCase(Locale.ROOT));
            return ResponseEntity.ok(ruleService.updateRule(id, (Boolean) active, parsed));
        } catch (ResourceNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * 待人工处理的规则：无法翻译或生成的查询未通过校验
     */
    @GetMapping("/review-queue")
    public ResponseEntity<List<ReviewItem>> reviewQueue() {
        return ResponseEntity.ok(ruleService.reviewQueue());
    }
}
