package com.compliancescan.parser;

import java.util.List;

/**
 * 表达式的引用视图：只保留校验关心的列引用、函数调用与子查询
 *
 * @param columns    列引用
 * @param functions  函数调用
 * @param subqueries 嵌套子查询
 * @param soleColumn 表达式恰好是单个列引用时的该列，否则为空
 */
public record Expression(List<ColumnRef> columns,
                         List<FunctionCall> functions,
                         List<SelectQuery> subqueries,
                         ColumnRef soleColumn) {

    public Expression {
        columns = List.copyOf(columns);
        functions = List.copyOf(functions);
        subqueries = List.copyOf(subqueries);
    }
}
