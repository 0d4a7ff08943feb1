package com.compliancescan.controller;

import com.compliancescan.model.Violation;
import com.compliancescan.model.ViolationDetail;
import com.compliancescan.store.RuleCatalog;
import com.compliancescan.store.ViolationStore;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 违规记录查询
 */
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class ViolationController {

    private final ViolationStore violationStore;
    private final RuleCatalog ruleCatalog;

    public ViolationController(ViolationStore violationStore, RuleCatalog ruleCatalog) {
        this.violationStore = violationStore;
        this.ruleCatalog = ruleCatalog;
    }

    /**
     * 按状态与规则过滤违规记录，参数均可省略
     */
    @GetMapping("/violations")
    public ResponseEntity<?> listViolations(@RequestParam(required = false) String status,
                                            @RequestParam(required = false) String ruleId) {
        Violation.Status filter = null;
        if (status != null && !status.isBlank()) {
            try {
                filter = Violation.Status.valueOf(status.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return ResponseEntity.badRequest().body(Map.of("error", "未知的违规状态: " + status));
            }
        }
        return ResponseEntity.ok(violationStore.find(filter, blankToNull(ruleId)));
    }

    /**
     * 单条违规记录，附带其规则
     */
    @GetMapping("/violations/{id}")
    public ResponseEntity<?> getViolation(@PathVariable String id) {
        Optional<Violation> violation = violationStore.findById(id);
        if (violation.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "违规记录不存在: " + id));
        }
        return ResponseEntity.ok(new ViolationDetail(violation.get(),
                ruleCatalog.findById(violation.get().getRuleId()).orElse(null)));
    }

    private static String blankToNull(String text) {
        return text == null || text.isBlank() ? null : text;
    }
}
