package com.compliancescan.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 目标库结构快照
 * <p>
 * 不可变；表与字段的查找均忽略大小写。表既可以按 {@code name} 也可以按 {@code schema.name} 查找，
 * 未限定 schema 的表名在多个 schema 中重名时视为不存在。
 */
public final class SchemaSnapshot {

    private final String databaseProduct;
    private final Map<String, TableInfo> tables;
    private final Instant capturedAt;
    private final String version;

    public SchemaSnapshot(String databaseProduct, List<TableInfo> tables, Instant capturedAt) {
        this.databaseProduct = databaseProduct;
        Map<String, TableInfo> ordered = new LinkedHashMap<>();
        for (TableInfo table : tables) {
            ordered.put(table.lookupKey(), table);
        }
        this.tables = Collections.unmodifiableMap(ordered);
        this.capturedAt = capturedAt;
        this.version = computeVersion(ordered.values());
    }

    public String getDatabaseProduct() {
        return databaseProduct;
    }

    public Collection<TableInfo> getTables() {
        return tables.values();
    }

    public Instant getCapturedAt() {
        return capturedAt;
    }

    /**
     * 由表结构内容计算出的版本号，结构不变时版本不变
     */
    public String getVersion() {
        return version;
    }

    public int tableCount() {
        return tables.size();
    }

    public Optional<TableInfo> findTable(String schema, String name) {
        if (name == null) {
            return Optional.empty();
        }
        if (schema != null && !schema.isBlank()) {
            return Optional.ofNullable(tables.get((schema + "." + name).toLowerCase(Locale.ROOT)));
        }
        TableInfo exact = tables.get(name.toLowerCase(Locale.ROOT));
        if (exact != null) {
            return Optional.of(exact);
        }
        List<TableInfo> matches = tables.values().stream()
                .filter(t -> t.name().equalsIgnoreCase(name))
                .toList();
        return matches.size() == 1 ? Optional.of(matches.get(0)) : Optional.empty();
    }

    public Optional<TableInfo> findTable(String name) {
        if (name != null && name.contains(".")) {
            int dot = name.lastIndexOf('.');
            return findTable(name.substring(0, dot), name.substring(dot + 1));
        }
        return findTable(null, name);
    }

    private static String computeVersion(Collection<TableInfo> tables) {
        StringBuilder canonical = new StringBuilder();
        for (TableInfo table : tables) {
            canonical.append(table.lookupKey()).append('{');
            for (ColumnInfo column : table.columns()) {
                canonical.append(column.name().toLowerCase(Locale.ROOT)).append(':')
                        .append(column.dataType()).append(':')
                        .append(column.nullable() ? 'N' : 'R')
                        .append(column.primaryKey() ? 'P' : '-')
                        .append(';');
            }
            canonical.append('}');
        }
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(canonical.toString().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest, 0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 不可用", e);
        }
    }
}
