package com.compliancescan.parser;

import java.util.List;

/**
 * WITH 子句中定义的公共表表达式
 */
public record CommonTableExpression(String name, List<String> columnNames, SelectQuery query) {

    public CommonTableExpression {
        columnNames = List.copyOf(columnNames);
    }
}
