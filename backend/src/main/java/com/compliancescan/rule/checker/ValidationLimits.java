package com.compliancescan.rule.checker;

/**
 * 校验阈值
 *
 * @param maxSubqueryDepth 子查询最大嵌套深度
 * @param maxJoins         最大连接次数
 * @param maxTokens        最大词法单元数
 * @param maxRows          单条规则返回的最大行数
 */
public record ValidationLimits(int maxSubqueryDepth, int maxJoins, int maxTokens, int maxRows) {

    public static final ValidationLimits DEFAULTS = new ValidationLimits(3, 8, 2000, 1000);

    public ValidationLimits {
        if (maxSubqueryDepth < 0 || maxJoins < 0 || maxTokens <= 0 || maxRows <= 0) {
            throw new IllegalArgumentException("校验阈值必须为正数");
        }
    }
}
