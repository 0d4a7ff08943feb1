package com.compliancescan.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 表元数据：所属 schema、表名以及按序排列的字段
 */
public record TableInfo(String schema, String name, List<ColumnInfo> columns) {

    public TableInfo {
        columns = List.copyOf(columns);
    }

    public String qualifiedName() {
        return schema == null || schema.isBlank() ? name : schema + "." + name;
    }

    public Optional<ColumnInfo> column(String columnName) {
        if (columnName == null) {
            return Optional.empty();
        }
        return columns.stream()
                .filter(c -> c.name().equalsIgnoreCase(columnName))
                .findFirst();
    }

    public boolean hasColumn(String columnName) {
        return column(columnName).isPresent();
    }

    public List<String> primaryKeyColumns() {
        return columns.stream()
                .filter(ColumnInfo::primaryKey)
                .map(ColumnInfo::name)
                .toList();
    }

    String lookupKey() {
        return qualifiedName().toLowerCase(Locale.ROOT);
    }
}
