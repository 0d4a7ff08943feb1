package com.compliancescan.store;

import com.compliancescan.model.ComplianceRule;
import com.compliancescan.model.ComplianceRule.Severity;

import java.util.List;
import java.util.Optional;

/**
 * 规则目录
 */
public interface RuleCatalog {

    List<ComplianceRule> findAll();

    /**
     * 当前启用规则的副本，扫描开始时调用一次
     */
    List<ComplianceRule> activeRules();

    Optional<ComplianceRule> findById(String id);

    /**
     * 注册规则；规则编号已存在时返回空
     */
    Optional<ComplianceRule> register(ComplianceRule rule);

    ComplianceRule updateActive(String id, boolean active);

    ComplianceRule updateSeverity(String id, Severity severity);
}
