package com.compliancescan.parser;

import java.util.List;

/**
 * 单个 SELECT 块（集合运算的一个分支）
 * <p>
 * 分支本身是括号包裹的完整查询时，只有 {@code parenthesized} 非空。
 */
public record QueryBlock(List<SelectItem> items,
                         List<FromItem> from,
                         List<Expression> joinConditions,
                         List<String> usingColumns,
                         Expression where,
                         List<Expression> groupBy,
                         Expression having,
                         List<Expression> distinctOn,
                         SelectQuery parenthesized) {

    public QueryBlock {
        items = List.copyOf(items);
        from = List.copyOf(from);
        joinConditions = List.copyOf(joinConditions);
        usingColumns = List.copyOf(usingColumns);
        groupBy = List.copyOf(groupBy);
        distinctOn = List.copyOf(distinctOn);
    }

    public static QueryBlock wrapping(SelectQuery query) {
        return new QueryBlock(List.of(), List.of(), List.of(), List.of(), null, List.of(), null, List.of(), query);
    }
}
