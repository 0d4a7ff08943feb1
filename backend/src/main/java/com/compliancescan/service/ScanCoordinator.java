package com.compliancescan.service;

import com.compliancescan.exception.ResourceNotFoundException;
import com.compliancescan.exception.ScanAlreadyRunningException;
import com.compliancescan.model.ComplianceRule;
import com.compliancescan.model.Detection;
import com.compliancescan.model.RuleOutcome;
import com.compliancescan.model.ScanRun;
import com.compliancescan.model.ScheduleConfig;
import com.compliancescan.model.SchemaSnapshot;
import com.compliancescan.model.Violation;
import com.compliancescan.scheduler.ScanEvent;
import com.compliancescan.scheduler.ScanState.Running;
import com.compliancescan.scheduler.ScanStateMachine;
import com.compliancescan.scheduler.SchedulerStatus;
import com.compliancescan.service.ScanExecutor.RuleEvaluation;
import com.compliancescan.service.ViolationDiffEngine.DiffResult;
import com.compliancescan.store.RuleCatalog;
import com.compliancescan.store.ScanRunStore;
import com.compliancescan.store.ViolationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 扫描协调服务
 * <p>
 * 每次扫描的流程：
 * <ol>
 *   <li>写入 RUNNING 状态的扫描记录</li>
 *   <li>确认目标库可达并获取结构快照（失败则整次扫描失败，交给状态机退避重试）</li>
 *   <li>复制当前启用的规则并逐条执行</li>
 *   <li>计算违规差异，为新增违规生成说明，写回存储</li>
 *   <li>完成扫描记录并通知状态机</li>
 * </ol>
 */
public class ScanCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ScanCoordinator.class);

    private final ScanStateMachine stateMachine;
    private final SchemaSnapshotService snapshotService;
    private final RuleCatalog ruleCatalog;
    private final ScanExecutor executor;
    private final ViolationDiffEngine diffEngine;
    private final ViolationExplanationService explanationService;
    private final ViolationStore violationStore;
    private final ScanRunStore runStore;
    private final Clock clock;
    private final Duration runTimeout;

    public ScanCoordinator(ScanStateMachine stateMachine, SchemaSnapshotService snapshotService,
                           RuleCatalog ruleCatalog, ScanExecutor executor, ViolationDiffEngine diffEngine,
                           ViolationExplanationService explanationService, ViolationStore violationStore,
                           ScanRunStore runStore, Clock clock, Duration runTimeout) {
        this.stateMachine = stateMachine;
        this.snapshotService = snapshotService;
        this.ruleCatalog = ruleCatalog;
        this.executor = executor;
        this.diffEngine = diffEngine;
        this.explanationService = explanationService;
        this.violationStore = violationStore;
        this.runStore = runStore;
        this.clock = clock;
        this.runTimeout = runTimeout;
    }

    /**
     * 手动触发一次扫描并等待其结束
     *
     * @throws ScanAlreadyRunningException 已有扫描在进行
     */
    public ScanRun triggerScan() {
        Running running = stateMachine.fire(new ScanEvent.ManualTrigger()).startedRun()
                .orElseThrow(() -> new IllegalStateException("手动触发未能开始扫描"));
        return executeRun(running);
    }

    /**
     * 后台定时检查：到达下次执行时间或重试时间时开始扫描
     */
    public void onTimerTick() {
        stateMachine.fire(new ScanEvent.TimerFired(clock.instant()))
                .startedRun()
                .ifPresent(this::executeRun);
    }

    public ScheduleConfig configureSchedule(int intervalMinutes, boolean enabled) {
        return stateMachine.configure(intervalMinutes, enabled);
    }

    public SchedulerStatus status() {
        return stateMachine.status();
    }

    public List<ScanRun> history() {
        return runStore.findAll();
    }

    public ScanRun findRun(String id) {
        return runStore.findById(id).orElseThrow(() -> new ResourceNotFoundException("扫描记录不存在: " + id));
    }

    ScanRun executeRun(Running running) {
        Instant startedAt = clock.instant();
        ScanRun run = ScanRun.builder()
                .id(running.runId())
                .trigger(running.trigger())
                .startedAt(startedAt)
                .status(ScanRun.Status.RUNNING)
                .build();
        runStore.insert(run);
        log.info("开始扫描 {} (触发方式: {})", run.getId(), run.getTrigger());

        try {
            SchemaSnapshot snapshot = snapshotService.currentForScan();
            List<ComplianceRule> rules = ruleCatalog.activeRules();
            log.info("扫描 {} 使用结构版本 {}，共 {} 条启用规则", run.getId(), snapshot.getVersion(), rules.size());

            List<RuleEvaluation> evaluations = executor.execute(rules, snapshot, startedAt.plus(runTimeout));

            List<RuleOutcome> outcomes = new ArrayList<>();
            List<Detection> detections = new ArrayList<>();
            Set<String> evaluated = new HashSet<>();
            Set<String> partiallyEvaluated = new HashSet<>();
            for (RuleEvaluation evaluation : evaluations) {
                RuleOutcome outcome = evaluation.outcome();
                outcomes.add(outcome);
                if (outcome.isEvaluated()) {
                    evaluated.add(outcome.ruleId());
                    detections.addAll(evaluation.detections());
                    if (outcome.truncated()) {
                        partiallyEvaluated.add(outcome.ruleId());
                    }
                }
            }

            Instant completedAt = clock.instant();
            DiffResult diff = diffEngine.diff(violationStore.snapshot(), detections, evaluated,
                    partiallyEvaluated, completedAt);
            Map<String, ComplianceRule> rulesById = rules.stream()
                    .collect(Collectors.toMap(ComplianceRule::getId, Function.identity(), (a, b) -> a));
            List<Violation> explained = explanationService.explain(diff.created(), rulesById);
            diff = diff.withCreated(explained);
            violationStore.saveAll(diff.changes());

            boolean allSucceeded = outcomes.stream().allMatch(RuleOutcome::isEvaluated);
            ScanRun completed = run.toBuilder()
                    .completedAt(completedAt)
                    .status(allSucceeded ? ScanRun.Status.COMPLETED : ScanRun.Status.COMPLETED_WITH_ERRORS)
                    .schemaVersion(snapshot.getVersion())
                    .outcomes(outcomes)
                    .newCount(diff.newCount())
                    .persistingCount(diff.persisting().size())
                    .resolvedCount(diff.resolved().size())
                    .build();
            runStore.complete(completed);
            stateMachine.fire(new ScanEvent.RunCompleted(run.getId(), completedAt));
            log.info("扫描 {} 结束: {}，新增 {}，持续 {}，解除 {}", run.getId(), completed.getStatus(),
                    completed.getNewCount(), completed.getPersistingCount(), completed.getResolvedCount());
            return completed;
        } catch (RuntimeException e) {
            return fail(run, e);
        }
    }

    private ScanRun fail(ScanRun run, RuntimeException e) {
        log.error("扫描 {} 失败", run.getId(), e);
        Instant failedAt = clock.instant();
        ScanRun failed = run.toBuilder()
                .completedAt(failedAt)
                .status(ScanRun.Status.FAILED)
                .errorMessage(e.getMessage())
                .build();
        runStore.complete(failed);
        stateMachine.fire(new ScanEvent.RunFailed(run.getId(), failedAt, e.getMessage()));
        return failed;
    }
}
