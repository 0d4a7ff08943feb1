package com.compliancescan.model;

import com.compliancescan.model.ComplianceRule.Severity;

import java.util.Map;

/**
 * 本次扫描中检出的一条违规候选
 */
public record Detection(ViolationKey key,
                        String ruleCode,
                        Severity severity,
                        Map<String, Object> recordData,
                        String justification,
                        String remediation) {
}
