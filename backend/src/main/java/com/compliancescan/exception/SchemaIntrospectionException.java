package com.compliancescan.exception;

/**
 * 读取目标库元数据失败，本次扫描终止
 */
public class SchemaIntrospectionException extends RuntimeException {

    public SchemaIntrospectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
