package com.compliancescan.service;

import com.compliancescan.exception.SchemaIntrospectionException;
import com.compliancescan.exception.TargetConnectionException;
import com.compliancescan.model.ColumnInfo;
import com.compliancescan.model.SchemaSnapshot;
import com.compliancescan.model.TableInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 结构快照服务
 * <p>
 * 只读取 JDBC {@link DatabaseMetaData}，从不读取业务数据。快照缓存在内存中，
 * 超过最长缓存时间、显式刷新或执行中发现结构不一致时重新获取。
 */
public class SchemaSnapshotService {

    private static final Logger log = LoggerFactory.getLogger(SchemaSnapshotService.class);

    private static final Set<String> SYSTEM_SCHEMAS = Set.of(
            "information_schema", "pg_catalog", "pg_toast", "sys", "mysql", "performance_schema");

    private static final Set<String> TABLE_TYPES = Set.of("TABLE", "BASE TABLE");

    private final TargetDatabase targetDatabase;
    private final Clock clock;
    private final Duration maxAge;

    private volatile SchemaSnapshot cached;

    public SchemaSnapshotService(TargetDatabase targetDatabase, Clock clock, Duration maxAge) {
        this.targetDatabase = targetDatabase;
        this.clock = clock;
        this.maxAge = maxAge;
    }

    /**
     * 返回缓存的快照；没有缓存或已过期时重新获取
     */
    public synchronized SchemaSnapshot current() {
        SchemaSnapshot snapshot = cached;
        if (snapshot != null && !isExpired(snapshot)) {
            return snapshot;
        }
        return refresh();
    }

    /**
     * 扫描开始时使用：缓存有效时也先确认目标库可达，不可达的目标库让整次扫描失败
     *
     * @throws TargetConnectionException 目标库不可达
     */
    public synchronized SchemaSnapshot currentForScan() {
        SchemaSnapshot snapshot = cached;
        if (snapshot != null && !isExpired(snapshot)) {
            targetDatabase.ping();
            return snapshot;
        }
        return refresh();
    }

    public synchronized SchemaSnapshot refresh() {
        try (Connection connection = targetDatabase.openReadOnlyConnection()) {
            SchemaSnapshot snapshot = snapshot(connection);
            SchemaSnapshot previous = cached;
            cached = snapshot;
            if (previous == null || !previous.getVersion().equals(snapshot.getVersion())) {
                log.info("结构快照已更新: {} 张表, 版本 {}", snapshot.tableCount(), snapshot.getVersion());
            }
            return snapshot;
        } catch (SQLException e) {
            // close() 失败也按连接问题处理
            throw new TargetConnectionException("关闭目标库连接失败: " + e.getMessage(), e);
        }
    }

    /**
     * 丢弃缓存，下一次 {@link #current()} 会重新获取
     */
    public void invalidate() {
        if (cached != null) {
            log.info("结构快照已失效，版本 {}", cached.getVersion());
        }
        cached = null;
    }

    /**
     * 读取当前连接可见的全部用户表、字段与主键
     *
     * @throws TargetConnectionException   连接或认证错误
     * @throws SchemaIntrospectionException 元数据查询失败
     */
    public SchemaSnapshot snapshot(Connection connection) {
        try {
            DatabaseMetaData metaData = connection.getMetaData();
            List<TableInfo> tables = new ArrayList<>();
            for (String[] table : listTables(metaData)) {
                tables.add(describeTable(metaData, table[0], table[1], table[2]));
            }
            return new SchemaSnapshot(metaData.getDatabaseProductName(), tables, clock.instant());
        } catch (SQLException e) {
            if (TargetDatabase.isConnectionFailure(e)) {
                throw new TargetConnectionException("读取结构时与目标库的连接中断: " + e.getMessage(), e);
            }
            throw new SchemaIntrospectionException("读取目标库结构失败: " + e.getMessage(), e);
        }
    }

    private List<String[]> listTables(DatabaseMetaData metaData) throws SQLException {
        List<String[]> tables = new ArrayList<>();
        try (ResultSet rs = metaData.getTables(null, null, "%", null)) {
            while (rs.next()) {
                String type = rs.getString("TABLE_TYPE");
                String schema = rs.getString("TABLE_SCHEM");
                if (type == null || !TABLE_TYPES.contains(type.toUpperCase(Locale.ROOT))) {
                    continue;
                }
                if (schema != null && SYSTEM_SCHEMAS.contains(schema.toLowerCase(Locale.ROOT))) {
                    continue;
                }
                tables.add(new String[]{rs.getString("TABLE_CAT"), schema, rs.getString("TABLE_NAME")});
            }
        }
        return tables;
    }

    private TableInfo describeTable(DatabaseMetaData metaData, String catalog, String schema, String table)
            throws SQLException {
        Set<String> primaryKeys = new HashSet<>();
        try (ResultSet rs = metaData.getPrimaryKeys(catalog, schema, table)) {
            while (rs.next()) {
                primaryKeys.add(rs.getString("COLUMN_NAME"));
            }
        }

        List<OrdinalColumn> columns = new ArrayList<>();
        try (ResultSet rs = metaData.getColumns(catalog, schema, table, "%")) {
            while (rs.next()) {
                String name = rs.getString("COLUMN_NAME");
                ColumnInfo column = new ColumnInfo(
                        name,
                        rs.getString("TYPE_NAME"),
                        rs.getInt("NULLABLE") != DatabaseMetaData.columnNoNulls,
                        primaryKeys.contains(name));
                columns.add(new OrdinalColumn(rs.getInt("ORDINAL_POSITION"), column));
            }
        }
        columns.sort(Comparator.comparingInt(OrdinalColumn::position));
        return new TableInfo(schema, table, columns.stream().map(OrdinalColumn::column).toList());
    }

    private record OrdinalColumn(int position, ColumnInfo column) {
    }

    private boolean isExpired(SchemaSnapshot snapshot) {
        return maxAge != null && snapshot.getCapturedAt().plus(maxAge).isBefore(Instant.now(clock));
    }
}
