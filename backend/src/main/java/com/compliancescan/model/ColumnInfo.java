package com.compliancescan.model;

/**
 * 表字段元数据
 */
public record ColumnInfo(String name, String dataType, boolean nullable, boolean primaryKey) {
}
