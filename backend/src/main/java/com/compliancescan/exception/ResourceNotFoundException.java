package com.compliancescan.exception;

/**
 * 请求的规则、扫描记录等不存在
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
