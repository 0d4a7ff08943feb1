package com.compliancescan.parser;

/**
 * 函数调用，name 含 schema 前缀时保留原样
 */
public record FunctionCall(String name, int position) {
}
