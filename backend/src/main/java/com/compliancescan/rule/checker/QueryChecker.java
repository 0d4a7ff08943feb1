package com.compliancescan.rule.checker;

/**
 * 候选查询检查器接口
 * <p>
 * 检查器按 {@link org.springframework.core.annotation.Order} 顺序执行，遇到第一个拒绝即停止。
 */
public interface QueryChecker {

    /**
     * 检查器名称，出现在拒绝原因中
     */
    String name();

    /**
     * 检查候选查询；通过时可以向上下文写入后续步骤需要的信息
     */
    CheckResult check(ValidationContext context);

    record CheckResult(boolean passed, String reason, String offendingText) {
        public static CheckResult pass() {
            return new CheckResult(true, null, null);
        }

        public static CheckResult reject(String reason, String offendingText) {
            return new CheckResult(false, reason, offendingText);
        }

        public static CheckResult reject(String reason) {
            return new CheckResult(false, reason, null);
        }
    }
}
