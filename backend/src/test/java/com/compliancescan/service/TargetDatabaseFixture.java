package com.compliancescan.service;

import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.UUID;

/**
 * 测试用的 H2 内存目标库
 */
final class TargetDatabaseFixture {

    private final JdbcDataSource dataSource = new JdbcDataSource();

    TargetDatabaseFixture() {
        dataSource.setURL("jdbc:h2:mem:target-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1;DATABASE_TO_LOWER=TRUE");
        dataSource.setUser("sa");
    }

    TargetDatabase targetDatabase() {
        return new TargetDatabase(dataSource);
    }

    DataSource dataSource() {
        return dataSource;
    }

    void execute(String... statements) throws SQLException {
        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement()) {
            for (String sql : statements) {
                statement.execute(sql);
            }
        }
    }

    /**
     * 10000 笔交易，其中 id 为 1000 的倍数的 10 笔为大额，id 为 2000 的倍数的 5 笔大额交易未核验
     */
    void createTransactions() throws SQLException {
        execute(
                "CREATE TABLE customers (id BIGINT PRIMARY KEY, name VARCHAR(100), kyc_level INT)",
                "CREATE TABLE transactions (id BIGINT PRIMARY KEY, customer_id BIGINT NOT NULL, "
                        + "amount DECIMAL(15, 2) NOT NULL, verified BOOLEAN NOT NULL, created_at TIMESTAMP)");

        try (Connection connection = dataSource.getConnection()) {
            try (PreparedStatement insert = connection.prepareStatement(
                    "INSERT INTO customers (id, name, kyc_level) VALUES (?, ?, ?)")) {
                for (long id = 1; id <= 50; id++) {
                    insert.setLong(1, id);
                    insert.setString(2, "customer-" + id);
                    insert.setInt(3, (int) (id % 3));
                    insert.addBatch();
                }
                insert.executeBatch();
            }
            try (PreparedStatement insert = connection.prepareStatement(
                    "INSERT INTO transactions (id, customer_id, amount, verified, created_at) VALUES (?, ?, ?, ?, ?)")) {
                Timestamp createdAt = Timestamp.valueOf("2026-01-01 00:00:00");
                for (long id = 1; id <= 10_000; id++) {
                    insert.setLong(1, id);
                    insert.setLong(2, id % 50 + 1);
                    insert.setBigDecimal(3, new BigDecimal(id % 1000 == 0 ? "25000.00" : "500.00"));
                    insert.setBoolean(4, id % 2000 != 0);
                    insert.setTimestamp(5, createdAt);
                    insert.addBatch();
                }
                insert.executeBatch();
            }
        }
    }
}
