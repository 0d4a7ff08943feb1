package com.compliancescan.service;

import com.compliancescan.exception.TargetConnectionException;
import com.compliancescan.model.ComplianceRule;
import com.compliancescan.model.Detection;
import com.compliancescan.model.ReviewItem;
import com.compliancescan.model.RuleOutcome;
import com.compliancescan.model.SchemaSnapshot;
import com.compliancescan.model.ValidatedQuery;
import com.compliancescan.service.QuerySynthesizer.Candidate;
import com.compliancescan.service.QuerySynthesizer.Synthesis;
import com.compliancescan.service.QuerySynthesizer.Untranslatable;
import com.compliancescan.service.QueryValidator.Accepted;
import com.compliancescan.service.QueryValidator.Rejected;
import com.compliancescan.service.QueryValidator.Validation;
import com.compliancescan.store.ReviewQueue;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * 规则执行器
 * <p>
 * 每条规则独立执行：生成候选查询、校验、在只读连接上带超时与行数上限执行，再转换为违规候选。
 * 单条规则的失败只记录在其结果中；目标库连接中断例外，会让整次扫描失败。
 * 已到扫描截止时间但尚未开始的规则记为跳过，已开始的规则不会被中断。
 * 通过校验的查询按 (规则, 结构版本, 判定条件, 预置查询) 缓存，重复扫描不会再次调用翻译服务；
 * 结构版本变化后旧版本的缓存项随即清除。
 */
public class ScanExecutor {

    private static final Logger log = LoggerFactory.getLogger(ScanExecutor.class);

    static final String RUN_TIMEOUT = "run-timeout";

    /** 表或列不存在 */
    private static final Set<String> SCHEMA_MISMATCH_STATES = Set.of("42P01", "42703", "42S02", "42S22");

    private static final String QUERY_CANCELED_STATE = "57014";

    private final TargetDatabase targetDatabase;
    private final SchemaSnapshotService snapshotService;
    private final QuerySynthesizer synthesizer;
    private final QueryValidator validator;
    private final ViolationMaterializer materializer;
    private final ReviewQueue reviewQueue;
    private final ExecutorService workers;
    private final Duration queryTimeout;
    private final Clock clock;

    private final Cache<CacheKey, ValidatedQuery> validatedQueries;

    public ScanExecutor(TargetDatabase targetDatabase, SchemaSnapshotService snapshotService,
                        QuerySynthesizer synthesizer, QueryValidator validator, ViolationMaterializer materializer,
                        ReviewQueue reviewQueue, ExecutorService workers, Duration queryTimeout,
                        long maxCachedQueries, Clock clock) {
        this.targetDatabase = targetDatabase;
        this.snapshotService = snapshotService;
        this.synthesizer = synthesizer;
        this.validator = validator;
        this.materializer = materializer;
        this.reviewQueue = reviewQueue;
        this.workers = workers;
        this.queryTimeout = queryTimeout;
        this.clock = clock;
        this.validatedQueries = Caffeine.newBuilder()
                .maximumSize(maxCachedQueries)
                .build();
    }

    /**
     * 单条规则的求值结果
     */
    public record RuleEvaluation(ComplianceRule rule, RuleOutcome outcome, List<Detection> detections) {
    }

    private record CacheKey(String ruleId, String schemaVersion, String criteria, String presetQuery) {
        static CacheKey of(ComplianceRule rule, SchemaSnapshot snapshot) {
            return new CacheKey(rule.getId(), snapshot.getVersion(), rule.getEvaluationCriteria(),
                    rule.getPresetQuery());
        }
    }

    /**
     * 执行全部规则，按输入顺序返回结果
     *
     * @throws TargetConnectionException 执行过程中目标库连接中断
     */
    public List<RuleEvaluation> execute(List<ComplianceRule> rules, SchemaSnapshot snapshot, Instant deadline) {
        evictStaleQueries(snapshot.getVersion());
        List<Future<RuleEvaluation>> futures = new ArrayList<>();
        for (ComplianceRule rule : rules) {
            futures.add(workers.submit(() -> evaluate(rule, snapshot, deadline)));
        }

        List<RuleEvaluation> evaluations = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            ComplianceRule rule = rules.get(i);
            try {
                evaluations.add(futures.get(i).get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof TargetConnectionException connectionFailure) {
                    futures.subList(i + 1, futures.size()).forEach(f -> f.cancel(true));
                    throw connectionFailure;
                }
                log.error("规则 {} 执行出现未预期的异常", rule.getRuleCode(), cause);
                evaluations.add(failed(rule, RuleOutcome.error(rule, "内部错误: " + cause.getMessage(), 0)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                for (int j = i; j < futures.size(); j++) {
                    futures.get(j).cancel(false);
                    evaluations.add(failed(rules.get(j), RuleOutcome.skipped(rules.get(j), "interrupted")));
                }
                break;
            }
        }
        return evaluations;
    }

    RuleEvaluation evaluate(ComplianceRule rule, SchemaSnapshot snapshot, Instant deadline) {
        if (!clock.instant().isBefore(deadline)) {
            log.warn("规则 {} 未在扫描截止时间前开始，已跳过", rule.getRuleCode());
            return failed(rule, RuleOutcome.skipped(rule, RUN_TIMEOUT));
        }
        long start = clock.millis();

        CacheKey cacheKey = CacheKey.of(rule, snapshot);
        ValidatedQuery query = validatedQueries.getIfPresent(cacheKey);
        if (query == null) {
            Synthesis synthesis = synthesizer.synthesize(rule, snapshot);
            if (synthesis instanceof Untranslatable untranslatable) {
                return failed(rule, RuleOutcome.untranslatable(rule, untranslatable.reason(), elapsed(start)));
            }
            Validation validation = validator.validate(((Candidate) synthesis).query(), snapshot);
            if (validation instanceof Rejected rejected) {
                reviewQueue.flag(new ReviewItem(rule.getId(), rule.getRuleCode(), RuleOutcome.Kind.REJECTED,
                        rejected.describe(), clock.instant()));
                return failed(rule, RuleOutcome.rejected(rule, rejected.describe(), elapsed(start)));
            }
            query = ((Accepted) validation).query();
            validatedQueries.put(cacheKey, query);
        }

        List<Map<String, Object>> rows;
        try {
            rows = runQuery(query);
        } catch (SQLException e) {
            if (TargetDatabase.isConnectionFailure(e)) {
                log.warn("规则 {} 执行时目标库连接中断: {}", rule.getRuleCode(), e.getMessage());
                throw new TargetConnectionException("执行规则 " + rule.getRuleCode() + " 时目标库连接中断: "
                        + e.getMessage(), e);
            }
            return failed(rule, RuleOutcome.error(rule, describeFailure(rule, cacheKey, e), elapsed(start)));
        }

        List<Detection> detections = materializer.materialize(rule, query.identifierColumns(), rows);
        boolean truncated = query.rowLimit() > 0 && rows.size() >= query.rowLimit();
        if (truncated) {
            log.warn("规则 {} 的结果达到行数上限 {}，本次不解除该规则的违规", rule.getRuleCode(), query.rowLimit());
        }
        reviewQueue.clear(rule.getId());
        log.info("规则 {} 执行完成，命中 {} 行", rule.getRuleCode(), rows.size());
        return new RuleEvaluation(rule, RuleOutcome.success(rule, rows.size(), truncated, elapsed(start)), detections);
    }

    private List<Map<String, Object>> runQuery(ValidatedQuery query) throws SQLException {
        List<Map<String, Object>> rows = new ArrayList<>();
        try (Connection connection = targetDatabase.openReadOnlyConnection();
             Statement statement = connection.createStatement()) {
            statement.setQueryTimeout((int) Math.max(1, queryTimeout.toSeconds()));
            statement.setMaxRows(query.rowLimit());
            try (ResultSet rs = statement.executeQuery(query.sql())) {
                while (rs.next() && rows.size() < query.rowLimit()) {
                    rows.add(materializer.readRow(rs));
                }
            }
        }
        return rows;
    }

    private String describeFailure(ComplianceRule rule, CacheKey cacheKey, SQLException e) {
        String state = e.getSQLState();
        if (e instanceof SQLTimeoutException || Objects.equals(QUERY_CANCELED_STATE, state)) {
            log.warn("规则 {} 查询超时", rule.getRuleCode());
            return "query-timeout";
        }
        if (state != null && SCHEMA_MISMATCH_STATES.contains(state)) {
            log.warn("规则 {} 执行时发现结构不一致，结构快照将被刷新: {}", rule.getRuleCode(), e.getMessage());
            snapshotService.invalidate();
            validatedQueries.invalidate(cacheKey);
            return "schema-mismatch: " + e.getMessage();
        }
        log.warn("规则 {} 执行失败: {}", rule.getRuleCode(), e.getMessage());
        return "sql-error: " + e.getMessage();
    }

    private void evictStaleQueries(String schemaVersion) {
        validatedQueries.asMap().keySet().removeIf(key -> !key.schemaVersion().equals(schemaVersion));
    }

    long cachedQueryCount() {
        validatedQueries.cleanUp();
        return validatedQueries.estimatedSize();
    }

    private long elapsed(long start) {
        return Math.max(0, clock.millis() - start);
    }

    private static RuleEvaluation failed(ComplianceRule rule, RuleOutcome outcome) {
        return new RuleEvaluation(rule, outcome, List.of());
    }
}
