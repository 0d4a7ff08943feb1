package com.compliancescan.parser;

import java.util.List;

/**
 * 解析后的查询：WITH 定义、集合运算分支、排序与行数限制
 */
public record SelectQuery(List<CommonTableExpression> ctes,
                          List<QueryBlock> blocks,
                          List<Expression> orderBy,
                          RowBound rowBound) {

    public SelectQuery {
        ctes = List.copyOf(ctes);
        blocks = List.copyOf(blocks);
        orderBy = List.copyOf(orderBy);
    }

    public QueryBlock firstBlock() {
        return blocks.get(0);
    }
}
