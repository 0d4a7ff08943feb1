package com.compliancescan.model;

import java.time.Instant;

/**
 * 待人工复核的规则
 */
public record ReviewItem(String ruleId, String ruleCode, RuleOutcome.Kind kind, String reason, Instant flaggedAt) {
}
