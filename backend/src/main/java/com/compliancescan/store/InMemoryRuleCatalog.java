package com.compliancescan.store;

import com.compliancescan.exception.ResourceNotFoundException;
import com.compliancescan.model.ComplianceRule;
import com.compliancescan.model.ComplianceRule.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * 内存规则目录，按注册顺序保存
 */
@Component
public class InMemoryRuleCatalog implements RuleCatalog {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRuleCatalog.class);

    private final Map<String, ComplianceRule> rules = new LinkedHashMap<>();

    @Override
    public synchronized List<ComplianceRule> findAll() {
        return rules.values().stream().map(r -> r.toBuilder().build()).toList();
    }

    @Override
    public synchronized List<ComplianceRule> activeRules() {
        return rules.values().stream()
                .filter(ComplianceRule::isActive)
                .map(r -> r.toBuilder().build())
                .toList();
    }

    @Override
    public synchronized Optional<ComplianceRule> findById(String id) {
        return Optional.ofNullable(rules.get(id)).map(r -> r.toBuilder().build());
    }

    @Override
    public synchronized Optional<ComplianceRule> register(ComplianceRule rule) {
        if (rule.getRuleCode() == null || rule.getRuleCode().isBlank()) {
            throw new IllegalArgumentException("规则编号不能为空");
        }
        boolean duplicate = rules.values().stream()
                .anyMatch(existing -> existing.getRuleCode().equalsIgnoreCase(rule.getRuleCode()));
        if (duplicate) {
            log.warn("规则编号 {} 已存在，跳过", rule.getRuleCode());
            return Optional.empty();
        }
        ComplianceRule stored = rule.toBuilder()
                .id(rule.getId() != null ? rule.getId() : UUID.randomUUID().toString())
                .severity(rule.getSeverity() != null ? rule.getSeverity() : Severity.MEDIUM)
                .build();
        rules.put(stored.getId(), stored);
        log.info("注册规则 {} ({})", stored.getRuleCode(), stored.getSeverity());
        return Optional.of(stored.toBuilder().build());
    }

    @Override
    public synchronized ComplianceRule updateActive(String id, boolean active) {
        ComplianceRule rule = require(id);
        rule.setActive(active);
        return rule.toBuilder().build();
    }

    @Override
    public synchronized ComplianceRule updateSeverity(String id, Severity severity) {
        if (severity == null) {
            throw new IllegalArgumentException("严重等级不能为空");
        }
        ComplianceRule rule = require(id);
        rule.setSeverity(severity);
        return rule.toBuilder().build();
    }

    private ComplianceRule require(String id) {
        ComplianceRule rule = rules.get(id);
        if (rule == null) {
            throw new ResourceNotFoundException("规则不存在: " + id);
        }
        return rule;
    }
}
