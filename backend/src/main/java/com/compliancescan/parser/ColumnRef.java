package com.compliancescan.parser;

/**
 * 列引用，qualifier 为表名或别名，可为空
 */
public record ColumnRef(String qualifier, String name, int position) {

    public String display() {
        return qualifier == null ? name : qualifier + "." + name;
    }
}
