package com.compliancescan.model;

/**
 * 目标库连接检测结果
 *
 * @param reachable       是否成功建立连接
 * @param failure         失败类别，成功时为空
 * @param message         面向运维人员的说明
 * @param detail          驱动返回的原始错误信息
 * @param databaseProduct 数据库产品名
 * @param databaseVersion 数据库版本
 * @param latencyMillis   建立连接耗时
 */
public record ConnectionCheck(boolean reachable,
                              FailureKind failure,
                              String message,
                              String detail,
                              String databaseProduct,
                              String databaseVersion,
                              long latencyMillis) {

    public enum FailureKind {
        AUTHENTICATION("认证失败，请检查用户名和密码"),
        DATABASE_NOT_FOUND("目标库中不存在指定的数据库"),
        SSL("安全连接失败，请检查 SSL 配置"),
        HOST_UNREACHABLE("无法连接数据库主机，请检查主机名与端口"),
        TIMEOUT("连接超时，请稍后重试"),
        OTHER("连接目标库失败");

        private final String description;

        FailureKind(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    public static ConnectionCheck ok(String product, String version, long latencyMillis) {
        return new ConnectionCheck(true, null, "连接成功", null, product, version, latencyMillis);
    }

    public static ConnectionCheck failed(FailureKind failure, String detail, long latencyMillis) {
        return new ConnectionCheck(false, failure, failure.getDescription(), detail, null, null, latencyMillis);
    }
}
