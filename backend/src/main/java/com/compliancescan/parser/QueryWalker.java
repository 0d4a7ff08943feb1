package com.compliancescan.parser;

import com.compliancescan.parser.FromItem.DerivedTable;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * 查询树遍历工具
 */
public final class QueryWalker {

    private QueryWalker() {
    }

    /**
     * 遍历单个块中的所有表达式（不进入子查询）
     */
    public static void forEachExpression(QueryBlock block, Consumer<Expression> action) {
        for (SelectItem item : block.items()) {
            if (item.expression() != null) {
                action.accept(item.expression());
            }
        }
        block.joinConditions().forEach(action);
        if (block.where() != null) {
            action.accept(block.where());
        }
        block.groupBy().forEach(action);
        if (block.having() != null) {
            action.accept(block.having());
        }
        block.distinctOn().forEach(action);
    }

    /**
     * 直接嵌套在查询中的子查询：WITH 定义、派生表、表达式子查询与括号分支
     */
    public static List<SelectQuery> children(SelectQuery query) {
        List<SelectQuery> children = new ArrayList<>();
        for (CommonTableExpression cte : query.ctes()) {
            children.add(cte.query());
        }
        for (QueryBlock block : query.blocks()) {
            if (block.parenthesized() != null) {
                children.add(block.parenthesized());
                continue;
            }
            for (FromItem item : block.from()) {
                if (item instanceof DerivedTable derived) {
                    children.add(derived.query());
                }
            }
            forEachExpression(block, e -> children.addAll(e.subqueries()));
        }
        query.orderBy().forEach(e -> children.addAll(e.subqueries()));
        return children;
    }

    /** 查询中出现的全部函数调用 */
    public static List<FunctionCall> functions(SelectQuery query) {
        List<FunctionCall> result = new ArrayList<>();
        collectFunctions(query, result);
        return result;
    }

    private static void collectFunctions(SelectQuery query, List<FunctionCall> result) {
        for (QueryBlock block : query.blocks()) {
            forEachExpression(block, e -> result.addAll(e.functions()));
        }
        query.orderBy().forEach(e -> result.addAll(e.functions()));
        for (SelectQuery child : children(query)) {
            collectFunctions(child, result);
        }
    }

    /**
     * 子查询最大嵌套深度，最外层查询为 0。括号包裹的集合分支不计入深度。
     */
    public static int subqueryDepth(SelectQuery query) {
        int deepest = 0;
        for (QueryBlock block : query.blocks()) {
            if (block.parenthesized() != null) {
                deepest = Math.max(deepest, subqueryDepth(block.parenthesized()));
            }
        }
        for (SelectQuery child : children(query)) {
            if (isParenthesizedBranch(query, child)) {
                continue;
            }
            deepest = Math.max(deepest, 1 + subqueryDepth(child));
        }
        return deepest;
    }

    private static boolean isParenthesizedBranch(SelectQuery parent, SelectQuery child) {
        for (QueryBlock block : parent.blocks()) {
            if (block.parenthesized() == child) {
                return true;
            }
        }
        return false;
    }

    /**
     * 整条语句中的连接次数：每个 SELECT 块的来源数减一，累加所有块与子查询
     */
    public static int joinCount(SelectQuery query) {
        int joins = 0;
        for (QueryBlock block : query.blocks()) {
            if (block.parenthesized() == null && !block.from().isEmpty()) {
                joins += block.from().size() - 1;
            }
        }
        for (SelectQuery child : children(query)) {
            joins += joinCount(child);
        }
        return joins;
    }
}
