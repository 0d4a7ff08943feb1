package com.compliancescan.service;

import com.compliancescan.exception.TargetConnectionException;
import com.compliancescan.model.ConnectionCheck;
import com.compliancescan.model.ConnectionCheck.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import javax.sql.DataSource;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 被扫描的目标数据库
 * <p>
 * 所有连接均以只读方式打开，只有结构快照与规则执行会使用它。
 */
public class TargetDatabase {

    private static final Logger log = LoggerFactory.getLogger(TargetDatabase.class);

    private static final int PING_TIMEOUT_SECONDS = 5;

    /** PostgreSQL: invalid_catalog_name */
    private static final String DATABASE_NOT_FOUND_STATE = "3D000";

    private final DataSource dataSource;

    public TargetDatabase(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * 获取只读连接，调用方负责关闭
     *
     * @throws TargetConnectionException 无法获取连接
     */
    public Connection openReadOnlyConnection() {
        Connection connection;
        try {
            connection = dataSource.getConnection();
        } catch (SQLException e) {
            throw new TargetConnectionException("无法连接目标数据库: " + e.getMessage(), e);
        }
        try {
            connection.setReadOnly(true);
            return connection;
        } catch (SQLException e) {
            closeQuietly(connection, e);
            throw new TargetConnectionException("无法将连接设置为只读: " + e.getMessage(), e);
        }
    }

    /**
     * 确认目标库当前可达
     *
     * @throws TargetConnectionException 无法获取连接或连接校验失败
     */
    public void ping() {
        try (Connection connection = openReadOnlyConnection()) {
            if (!connection.isValid(PING_TIMEOUT_SECONDS)) {
                throw new TargetConnectionException("目标库连接校验失败", null);
            }
        } catch (SQLException e) {
            throw new TargetConnectionException("目标库连接校验失败: " + e.getMessage(), e);
        }
    }

    /**
     * 检测连接并对失败原因分类，不抛出异常
     */
    public ConnectionCheck check() {
        long start = System.nanoTime();
        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            return ConnectionCheck.ok(metaData.getDatabaseProductName(), metaData.getDatabaseProductVersion(),
                    elapsedMillis(start));
        } catch (SQLException | RuntimeException e) {
            FailureKind kind = classify(e);
            log.warn("目标库连接检测失败 ({}): {}", kind, e.getMessage());
            return ConnectionCheck.failed(kind, e.getMessage(), elapsedMillis(start));
        }
    }

    /**
     * 按 SQLState 与底层网络异常判断连接失败的类别
     */
    static FailureKind classify(Throwable failure) {
        List<Throwable> chain = causes(failure);
        if (chain.stream().anyMatch(t -> stateStartsWith(t, "28"))) {
            return FailureKind.AUTHENTICATION;
        }
        if (chain.stream().anyMatch(t -> stateStartsWith(t, DATABASE_NOT_FOUND_STATE))) {
            return FailureKind.DATABASE_NOT_FOUND;
        }
        if (chain.stream().anyMatch(t -> t instanceof SSLException || messageContains(t, "ssl"))) {
            return FailureKind.SSL;
        }
        if (chain.stream().anyMatch(t -> t instanceof ConnectException || t instanceof UnknownHostException
                || t instanceof NoRouteToHostException)) {
            return FailureKind.HOST_UNREACHABLE;
        }
        if (chain.stream().anyMatch(t -> t instanceof SocketTimeoutException || t instanceof SQLTimeoutException
                || messageContains(t, "timed out") || messageContains(t, "timeout"))) {
            return FailureKind.TIMEOUT;
        }
        if (chain.stream().anyMatch(t -> stateStartsWith(t, "08"))) {
            return FailureKind.HOST_UNREACHABLE;
        }
        return FailureKind.OTHER;
    }

    /**
     * 判断 SQL 异常是否属于连接或认证类错误（SQLState 08xxx / 28xxx）
     */
    public static boolean isConnectionFailure(SQLException e) {
        for (SQLException current = e; current != null; current = current.getNextException()) {
            String state = current.getSQLState();
            if (state != null && (state.startsWith("08") || state.startsWith("28"))) {
                return true;
            }
        }
        return false;
    }

    private static List<Throwable> causes(Throwable failure) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Throwable> chain = new ArrayList<>();
        List<Throwable> pending = new ArrayList<>(List.of(failure));
        while (!pending.isEmpty()) {
            Throwable current = pending.remove(0);
            if (current == null || !seen.add(current)) {
                continue;
            }
            chain.add(current);
            pending.add(current.getCause());
            if (current instanceof SQLException sql) {
                pending.add(sql.getNextException());
            }
        }
        return chain;
    }

    private static boolean stateStartsWith(Throwable t, String prefix) {
        return t instanceof SQLException sql && sql.getSQLState() != null && sql.getSQLState().startsWith(prefix);
    }

    private static boolean messageContains(Throwable t, String text) {
        return t.getMessage() != null && t.getMessage().toLowerCase(Locale.ROOT).contains(text);
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private static void closeQuietly(Connection connection, SQLException cause) {
        try {
            connection.close();
        } catch (SQLException closeFailure) {
            cause.addSuppressed(closeFailure);
        }
    }
}
