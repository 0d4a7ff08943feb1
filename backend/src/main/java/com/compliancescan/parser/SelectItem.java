package com.compliancescan.parser;

/**
 * SELECT 列表项；星号项的 expression 为空
 */
public record SelectItem(Expression expression, String alias, boolean star, String starQualifier) {

    public static SelectItem star(String qualifier) {
        return new SelectItem(null, null, true, qualifier);
    }

    /** 输出列名：别名优先，其次是单列表达式的列名 */
    public String outputName() {
        if (alias != null) {
            return alias;
        }
        if (expression != null && expression.soleColumn() != null) {
            return expression.soleColumn().name();
        }
        return null;
    }
}
