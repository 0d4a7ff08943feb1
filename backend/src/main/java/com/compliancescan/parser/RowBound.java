package com.compliancescan.parser;

/**
 * 行数限制子句
 *
 * @param style      LIMIT 或 FETCH FIRST
 * @param value      限制值，LIMIT ALL 时为空
 * @param valueStart 限制值在原 SQL 中的起始偏移，未显式给出数值时为 -1
 * @param valueEnd   限制值在原 SQL 中的结束偏移
 */
public record RowBound(Style style, Long value, int valueStart, int valueEnd) {

    public enum Style {
        LIMIT, FETCH
    }

    public boolean isUnbounded() {
        return value == null;
    }
}
