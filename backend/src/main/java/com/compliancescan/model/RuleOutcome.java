package com.compliancescan.model;

/**
 * 单条规则在一次扫描中的执行结果
 *
 * @param ruleId         规则 ID
 * @param ruleCode       规则编号
 * @param kind           结果类型
 * @param rowCount       命中行数（仅 SUCCESS）
 * @param truncated      结果是否达到行数上限
 * @param reason         跳过、拒绝或出错的原因
 * @param durationMillis 耗时
 */
public record RuleOutcome(String ruleId,
                          String ruleCode,
                          Kind kind,
                          int rowCount,
                          boolean truncated,
                          String reason,
                          long durationMillis) {

    public enum Kind {
        SUCCESS, SKIPPED, REJECTED, UNTRANSLATABLE, ERROR
    }

    public static RuleOutcome success(ComplianceRule rule, int rowCount, boolean truncated, long durationMillis) {
        return new RuleOutcome(rule.getId(), rule.getRuleCode(), Kind.SUCCESS, rowCount, truncated, null, durationMillis);
    }

    public static RuleOutcome skipped(ComplianceRule rule, String reason) {
        return new RuleOutcome(rule.getId(), rule.getRuleCode(), Kind.SKIPPED, 0, false, reason, 0);
    }

    public static RuleOutcome rejected(ComplianceRule rule, String reason, long durationMillis) {
        return new RuleOutcome(rule.getId(), rule.getRuleCode(), Kind.REJECTED, 0, false, reason, durationMillis);
    }

    public static RuleOutcome untranslatable(ComplianceRule rule, String reason, long durationMillis) {
        return new RuleOutcome(rule.getId(), rule.getRuleCode(), Kind.UNTRANSLATABLE, 0, false, reason, durationMillis);
    }

    public static RuleOutcome error(ComplianceRule rule, String reason, long durationMillis) {
        return new RuleOutcome(rule.getId(), rule.getRuleCode(), Kind.ERROR, 0, false, reason, durationMillis);
    }

    /** 规则是否在本次扫描中被成功求值 */
    public boolean isEvaluated() {
        return kind == Kind.SUCCESS;
    }
}
