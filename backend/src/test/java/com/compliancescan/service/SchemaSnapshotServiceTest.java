package com.compliancescan.service;

import com.compliancescan.exception.TargetConnectionException;
import com.compliancescan.model.ColumnInfo;
import com.compliancescan.model.SchemaSnapshot;
import com.compliancescan.model.TableInfo;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchemaSnapshotServiceTest {

    private TargetDatabaseFixture fixture;
    private SchemaSnapshotService service;

    @BeforeEach
    void setUp() throws Exception {
        fixture = new TargetDatabaseFixture();
        fixture.createTransactions();
        service = new SchemaSnapshotService(fixture.targetDatabase(), Clock.systemUTC(), Duration.ofHours(1));
    }

    @Test
    void shouldCaptureTablesColumnsAndPrimaryKeys() {
        SchemaSnapshot snapshot = service.current();

        assertEquals(2, snapshot.tableCount());
        TableInfo transactions = snapshot.findTable("transactions").orElseThrow();
        assertEquals("public.transactions", transactions.qualifiedName());
        assertEquals(List.of("id", "customer_id", "amount", "verified", "created_at"),
                transactions.columns().stream().map(ColumnInfo::name).toList());
        assertEquals(List.of("id"), transactions.primaryKeyColumns());
        assertFalse(transactions.column("customer_id").orElseThrow().nullable());
        assertTrue(transactions.column("created_at").orElseThrow().nullable());
        assertTrue(snapshot.findTable("information_schema", "tables").isEmpty());
    }

    @Test
    void shouldKeepVersionWhileStructureIsUnchanged() {
        String first = service.refresh().getVersion();
        String second = service.refresh().getVersion();

        assertEquals(first, second);
    }

    @Test
    void shouldServeCachedSnapshotUntilRefreshed() throws Exception {
        SchemaSnapshot before = service.current();
        fixture.execute("ALTER TABLE transactions ADD COLUMN reviewer VARCHAR(50)");

        assertSame(before, service.current());

        SchemaSnapshot after = service.refresh();
        assertNotEquals(before.getVersion(), after.getVersion());
        assertTrue(after.findTable("transactions").orElseThrow().hasColumn("reviewer"));
    }

    @Test
    void shouldReloadAfterInvalidate() throws Exception {
        SchemaSnapshot before = service.current();
        fixture.execute("CREATE TABLE audits (id BIGINT PRIMARY KEY)");

        service.invalidate();

        SchemaSnapshot after = service.current();
        assertEquals(3, after.tableCount());
        assertNotEquals(before.getVersion(), after.getVersion());
    }

    @Test
    void shouldReportUnreachableTarget() {
        JdbcDataSource unreachable = new JdbcDataSource();
        unreachable.setURL("jdbc:h2:tcp://localhost:1/nothing");
        SchemaSnapshotService broken = new SchemaSnapshotService(
                new TargetDatabase(unreachable), Clock.systemUTC(), Duration.ofHours(1));

        assertThrows(TargetConnectionException.class, broken::current);
    }
}
