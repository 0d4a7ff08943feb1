package com.compliancescan.model;

/**
 * 单条违规记录及其规则，找不到规则时为空
 */
public record ViolationDetail(Violation violation, ComplianceRule rule) {
}
