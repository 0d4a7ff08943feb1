package com.compliancescan.service;

import com.compliancescan.model.ComplianceRule;
import com.compliancescan.model.ComplianceRule.Severity;
import com.compliancescan.model.ReviewItem;
import com.compliancescan.parser.WordRuleParser;
import com.compliancescan.store.ReviewQueue;
import com.compliancescan.store.RuleCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 规则管理服务
 */
@Service
public class RuleService {

    private static final Logger log = LoggerFactory.getLogger(RuleService.class);

    private final RuleCatalog ruleCatalog;
    private final WordRuleParser wordRuleParser;
    private final ReviewQueue reviewQueue;

    public RuleService(RuleCatalog ruleCatalog, WordRuleParser wordRuleParser, ReviewQueue reviewQueue) {
        this.ruleCatalog = ruleCatalog;
        this.wordRuleParser = wordRuleParser;
        this.reviewQueue = reviewQueue;
    }

    /**
     * 导入结果
     *
     * @param imported 新注册的规则
     * @param skipped  编号已存在而跳过的规则编号
     */
    public record ImportResult(List<ComplianceRule> imported, List<String> skipped) {
    }

    public List<ComplianceRule> listRules() {
        return ruleCatalog.findAll();
    }

    /**
     * 从 Word 规则表导入规则，编号重复的规则跳过
     */
    public ImportResult importRules(InputStream inputStream) {
        return registerAll(wordRuleParser.parse(inputStream));
    }

    public ImportResult registerAll(List<ComplianceRule> rules) {
        List<ComplianceRule> imported = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (ComplianceRule rule : rules) {
            Optional<ComplianceRule> registered = ruleCatalog.register(rule);
            if (registered.isPresent()) {
                imported.add(registered.get());
            } else {
                skipped.add(rule.getRuleCode());
            }
        }
        log.info("导入规则完成: 新增 {} 条, 跳过 {} 条", imported.size(), skipped.size());
        return new ImportResult(imported, skipped);
    }

    /**
     * 运维人员修正：只允许修改启用状态与严重等级，参数为空表示不修改
     */
    public ComplianceRule updateRule(String id, Boolean active, Severity severity) {
        if (active == null && severity == null) {
            throw new IllegalArgumentException("请提供 active 或 severity");
        }
        ComplianceRule updated = null;
        if (active != null) {
            updated = ruleCatalog.updateActive(id, active);
        }
        if (severity != null) {
            updated = ruleCatalog.updateSeverity(id, severity);
        }
        log.info("规则 {} 已更新: active={}, severity={}", updated.getRuleCode(), updated.isActive(),
                updated.getSeverity());
        return updated;
    }

    public List<ReviewItem> reviewQueue() {
        return reviewQueue.list();
    }
}
