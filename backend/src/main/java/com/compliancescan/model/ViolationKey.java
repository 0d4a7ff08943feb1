package com.compliancescan.model;

/**
 * 违规记录的复合标识：(规则, 记录标识)
 */
public record ViolationKey(String ruleId, String recordIdentifier) {
}
