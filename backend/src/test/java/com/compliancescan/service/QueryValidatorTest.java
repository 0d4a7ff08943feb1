package com.compliancescan.service;

import com.compliancescan.model.CandidateQuery;
import com.compliancescan.model.ColumnInfo;
import com.compliancescan.model.SchemaSnapshot;
import com.compliancescan.model.TableInfo;
import com.compliancescan.model.ValidatedQuery;
import com.compliancescan.rule.checker.ComplexityChecker;
import com.compliancescan.rule.checker.ReadOnlyChecker;
import com.compliancescan.rule.checker.SchemaReferenceChecker;
import com.compliancescan.rule.checker.SingleStatementChecker;
import com.compliancescan.rule.checker.ValidationLimits;
import com.compliancescan.service.QueryValidator.Accepted;
import com.compliancescan.service.QueryValidator.Rejected;
import com.compliancescan.service.QueryValidator.Validation;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QueryValidatorTest {

    private final SchemaSnapshot snapshot = new SchemaSnapshot("PostgreSQL", List.of(
            new TableInfo("public", "transactions", List.of(
                    new ColumnInfo("id", "bigint", false, true),
                    new ColumnInfo("customer_id", "bigint", false, false),
                    new ColumnInfo("amount", "numeric", false, false),
                    new ColumnInfo("verified", "boolean", false, false))),
            new TableInfo("public", "customers", List.of(
                    new ColumnInfo("id", "bigint", false, true),
                    new ColumnInfo("name", "varchar", true, false)))),
            Instant.parse("2026-01-01T00:00:00Z"));

    private final QueryValidator validator = validator(ValidationLimits.DEFAULTS);

    private static QueryValidator validator(ValidationLimits limits) {
        return new QueryValidator(List.of(
                new SingleStatementChecker(),
                new ReadOnlyChecker(),
                new SchemaReferenceChecker(),
                new ComplexityChecker()), limits);
    }

    private CandidateQuery candidate(String sql) {
        return new CandidateQuery("rule-1", sql, snapshot.getVersion(), CandidateQuery.Source.TRANSLATOR);
    }

    private ValidatedQuery accepted(Validation validation) {
        if (validation instanceof Rejected rejected) {
            fail("查询被拒绝: " + rejected.describe());
        }
        return ((Accepted) validation).query();
    }

    private Rejected rejected(Validation validation) {
        return assertInstanceOf(Rejected.class, validation);
    }

    @Test
    void shouldAcceptReadOnlyQueryAndAppendRowLimit() {
        ValidatedQuery query = accepted(validator.validate(
                candidate("SELECT id, amount FROM transactions WHERE amount > 10000 AND verified = false"),
                snapshot));

        assertEquals("SELECT id, amount FROM transactions WHERE amount > 10000 AND verified = false LIMIT 1000",
                query.sql());
        assertEquals(1000, query.rowLimit());
        assertEquals(List.of("public.transactions"), query.referencedTables());
        assertEquals(List.of("id"), query.identifierColumns());
        assertEquals(snapshot.getVersion(), query.snapshotVersion());
    }

    @Test
    void shouldDropTrailingSemicolonBeforeAppendingLimit() {
        ValidatedQuery query = accepted(validator.validate(candidate("SELECT id FROM transactions;"), snapshot));

        assertEquals("SELECT id FROM transactions LIMIT 1000", query.sql());
    }

    @Test
    void shouldLowerExcessiveLimit() {
        ValidatedQuery query = accepted(validator.validate(
                candidate("SELECT id FROM transactions ORDER BY id LIMIT 5000"), snapshot));

        assertEquals("SELECT id FROM transactions ORDER BY id LIMIT 1000", query.sql());
        assertEquals(1000, query.rowLimit());
    }

    @Test
    void shouldKeepSmallerLimit() {
        ValidatedQuery query = accepted(validator.validate(
                candidate("SELECT id FROM transactions LIMIT 10"), snapshot));

        assertEquals("SELECT id FROM transactions LIMIT 10", query.sql());
        assertEquals(10, query.rowLimit());
    }

    @Test
    void shouldReplaceLimitAll() {
        ValidatedQuery query = accepted(validator.validate(
                candidate("SELECT id FROM transactions LIMIT ALL"), snapshot));

        assertEquals("SELECT id FROM transactions LIMIT 1000", query.sql());
    }

    @Test
    void shouldRejectNonexistentColumn() {
        Rejected rejected = rejected(validator.validate(
                candidate("SELECT id FROM transactions WHERE risk_score > 5"), snapshot));

        assertEquals("SCHEMA_REFERENCE", rejected.checker());
        assertTrue(rejected.reason().contains("risk_score"));
    }

    @Test
    void shouldRejectDataModification() {
        Rejected rejected = rejected(validator.validate(
                candidate("DELETE FROM transactions WHERE verified = false"), snapshot));

        assertEquals("READ_ONLY", rejected.checker());
    }

    @Test
    void shouldRejectModificationHiddenInCte() {
        Rejected rejected = rejected(validator.validate(
                candidate("WITH gone AS (DELETE FROM transactions RETURNING id) SELECT id FROM gone"), snapshot));

        assertEquals("READ_ONLY", rejected.checker());
        assertEquals("查询中包含禁止的关键字 DELETE", rejected.reason());
    }

    @Test
    void shouldRejectChainedStatements() {
        Rejected rejected = rejected(validator.validate(
                candidate("SELECT id FROM transactions; DROP TABLE transactions"), snapshot));

        assertEquals("SINGLE_STATEMENT", rejected.checker());
    }

    @Test
    void shouldRejectFunctionOutsideAllowList() {
        Rejected rejected = rejected(validator.validate(
                candidate("SELECT id FROM transactions WHERE pg_sleep(10) IS NOT NULL"), snapshot));

        assertEquals("READ_ONLY", rejected.checker());
        assertTrue(rejected.reason().contains("pg_sleep"));
    }

    @Test
    void shouldRejectLockingClause() {
        Rejected rejected = rejected(validator.validate(
                candidate("SELECT id FROM transactions FOR UPDATE"), snapshot));

        assertEquals("READ_ONLY", rejected.checker());
    }

    @Test
    void shouldRejectUntokenizableSql() {
        Rejected rejected = rejected(validator.validate(candidate("SELECT 'unterminated"), snapshot));

        assertEquals("SYNTAX", rejected.checker());
    }

    @Test
    void shouldRejectQueryAgainstStaleSchema() {
        CandidateQuery stale = new CandidateQuery("rule-1", "SELECT id FROM transactions", "outdated",
                CandidateQuery.Source.TRANSLATOR);

        Rejected rejected = rejected(validator.validate(stale, snapshot));

        assertEquals("STALE_SCHEMA", rejected.checker());
    }

    @Test
    void shouldRejectTooManyJoins() {
        QueryValidator strict = validator(new ValidationLimits(3, 0, 2000, 1000));

        Rejected rejected = rejected(strict.validate(candidate(
                "SELECT t.id FROM transactions t JOIN customers c ON c.id = t.customer_id"), snapshot));

        assertEquals("COMPLEXITY", rejected.checker());
    }

    @Test
    void shouldRejectDeepNesting() {
        QueryValidator strict = validator(new ValidationLimits(1, 8, 2000, 1000));

        Rejected rejected = rejected(strict.validate(candidate("""
                SELECT id FROM transactions WHERE customer_id IN (
                    SELECT id FROM customers WHERE id IN (SELECT customer_id FROM transactions))
                """), snapshot));

        assertEquals("COMPLEXITY", rejected.checker());
    }
}
