package com.compliancescan.parser;

/**
 * SQL 无法被解析为受支持的查询结构
 */
public class SqlParseException extends RuntimeException {

    private final int position;

    public SqlParseException(String message, int position) {
        super(position >= 0 ? message + " (位置 " + position + ")" : message);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
