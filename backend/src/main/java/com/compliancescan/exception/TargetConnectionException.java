package com.compliancescan.exception;

/**
 * 无法连接目标数据库（主机不可达、认证失败、连接池超时），本次扫描终止
 */
public class TargetConnectionException extends RuntimeException {

    public TargetConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
