package com.compliancescan.scheduler;

import com.compliancescan.exception.ScanAlreadyRunningException;
import com.compliancescan.model.ScanRun.Trigger;
import com.compliancescan.model.ScheduleConfig;
import com.compliancescan.scheduler.ScanEvent.ManualTrigger;
import com.compliancescan.scheduler.ScanEvent.RunCompleted;
import com.compliancescan.scheduler.ScanEvent.RunFailed;
import com.compliancescan.scheduler.ScanEvent.TimerFired;
import com.compliancescan.scheduler.ScanState.CoolingDown;
import com.compliancescan.scheduler.ScanState.Idle;
import com.compliancescan.scheduler.ScanState.Running;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 扫描调度状态机：Idle → Running → Idle，失败后在启用定时时进入 CoolingDown 按指数退避重试
 * <p>
 * 所有状态转换都在同一把锁内完成，同一时刻最多一个扫描处于 Running。
 * 正在运行时的新触发直接拒绝，不排队。
 */
public class ScanStateMachine {

    private static final Logger log = LoggerFactory.getLogger(ScanStateMachine.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;
    private final int maxRetries;
    private final Duration baseRetryDelay;
    private final Duration maxRetryDelay;

    private ScanState state = ScanState.idle();
    private ScheduleConfig schedule;
    private String lastFailure;
    private Instant lastFailureAt;
    private boolean retriesExhausted;

    public ScanStateMachine(Clock clock, int defaultIntervalMinutes, boolean enabled, int maxRetries,
                            Duration baseRetryDelay, Duration maxRetryDelay) {
        validateInterval(defaultIntervalMinutes);
        this.clock = clock;
        this.maxRetries = maxRetries;
        this.baseRetryDelay = baseRetryDelay;
        this.maxRetryDelay = maxRetryDelay;
        this.schedule = ScheduleConfig.builder()
                .intervalMinutes(defaultIntervalMinutes)
                .enabled(enabled)
                .nextRunAt(enabled ? clock.instant().plus(Duration.ofMinutes(defaultIntervalMinutes)) : null)
                .build();
    }

    /**
     * 状态转换结果
     */
    public record Transition(ScanState from, ScanState to) {

        /** 本次转换开始的扫描 */
        public Optional<Running> startedRun() {
            if (to instanceof Running running && !(from instanceof Running)) {
                return Optional.of(running);
            }
            return Optional.empty();
        }
    }

    /**
     * 处理事件
     *
     * @throws ScanAlreadyRunningException 扫描进行中又收到手动触发
     * @throws IllegalStateException       收到与当前扫描不符的完成/失败事件
     */
    public Transition fire(ScanEvent event) {
        lock.lock();
        try {
            ScanState from = state;
            ScanState to = next(from, event);
            state = to;
            if (!from.equals(to)) {
                log.debug("调度状态 {} -> {}", from, to);
            }
            return new Transition(from, to);
        } finally {
            lock.unlock();
        }
    }

    private ScanState next(ScanState current, ScanEvent event) {
        if (event instanceof ManualTrigger) {
            if (current instanceof Running running) {
                throw new ScanAlreadyRunningException(running.runId());
            }
            int attempt = current instanceof CoolingDown cooling ? cooling.attempt() : 0;
            return new Running(newRunId(), Trigger.MANUAL, attempt);
        }
        if (event instanceof TimerFired timer) {
            return onTimer(current, timer.now());
        }
        if (event instanceof RunCompleted completed) {
            requireRunning(current, completed.runId());
            onCompleted(completed.at());
            return ScanState.idle();
        }
        if (event instanceof RunFailed failed) {
            Running running = requireRunning(current, failed.runId());
            return onFailed(running, failed);
        }
        throw new IllegalArgumentException("未知事件: " + event);
    }

    private ScanState onTimer(ScanState current, Instant now) {
        if (current instanceof Idle) {
            if (schedule.isEnabled() && schedule.getNextRunAt() != null && !now.isBefore(schedule.getNextRunAt())) {
                return new Running(newRunId(), Trigger.SCHEDULED, 0);
            }
            return current;
        }
        if (current instanceof CoolingDown cooling && !now.isBefore(cooling.nextRetryAt())) {
            return new Running(newRunId(), Trigger.RETRY, cooling.attempt());
        }
        return current;
    }

    private void onCompleted(Instant at) {
        schedule = schedule.toBuilder()
                .lastRunAt(at)
                .nextRunAt(schedule.isEnabled() ? at.plus(interval()) : null)
                .build();
        lastFailure = null;
        lastFailureAt = null;
        retriesExhausted = false;
    }

    private ScanState onFailed(Running running, RunFailed failed) {
        int attempt = running.attempt() + 1;
        lastFailure = failed.reason();
        lastFailureAt = failed.at();

        if (schedule.isEnabled() && attempt <= maxRetries) {
            Instant retryAt = failed.at().plus(retryDelay(attempt));
            log.warn("扫描 {} 失败（第 {} 次），将于 {} 重试: {}", running.runId(), attempt, retryAt, failed.reason());
            retriesExhausted = false;
            return new CoolingDown(attempt, retryAt);
        }

        retriesExhausted = schedule.isEnabled();
        schedule = schedule.toBuilder()
                .nextRunAt(schedule.isEnabled() ? failed.at().plus(interval()) : null)
                .build();
        if (retriesExhausted) {
            log.error("扫描连续失败 {} 次，停止重试，等待下一个定时周期: {}", attempt, failed.reason());
        } else {
            log.error("扫描 {} 失败: {}", running.runId(), failed.reason());
        }
        return ScanState.idle();
    }

    /**
     * 第 n 次失败后的等待时间：base * 2^(n-1)，不超过上限
     */
    Duration retryDelay(int attempt) {
        Duration delay = baseRetryDelay;
        for (int i = 1; i < attempt && delay.compareTo(maxRetryDelay) < 0; i++) {
            delay = delay.multipliedBy(2);
        }
        return delay.compareTo(maxRetryDelay) > 0 ? maxRetryDelay : delay;
    }

    /**
     * 修改定时配置。启用状态下间隔变化或重新启用时，下次执行时间从现在重新计算；
     * 停用会取消等待中的重试与后续定时，但不会中止正在进行的扫描。
     *
     * @throws IllegalArgumentException 间隔不在 60 ~ 1440 分钟之间
     */
    public ScheduleConfig configure(int intervalMinutes, boolean enabled) {
        validateInterval(intervalMinutes);
        lock.lock();
        try {
            Instant now = clock.instant();
            ScheduleConfig.ScheduleConfigBuilder builder = schedule.toBuilder()
                    .intervalMinutes(intervalMinutes)
                    .enabled(enabled);
            if (!enabled) {
                builder.nextRunAt(null);
                if (state instanceof CoolingDown) {
                    log.info("定时扫描已停用，取消等待中的重试");
                    state = ScanState.idle();
                }
            } else if (!schedule.isEnabled() || schedule.getIntervalMinutes() != intervalMinutes
                    || schedule.getNextRunAt() == null) {
                builder.nextRunAt(now.plus(Duration.ofMinutes(intervalMinutes)));
            }
            schedule = builder.build();
            log.info("定时扫描配置更新: 间隔 {} 分钟, 启用 {}, 下次执行 {}",
                    intervalMinutes, enabled, schedule.getNextRunAt());
            return schedule.toBuilder().build();
        } finally {
            lock.unlock();
        }
    }

    public ScheduleConfig schedule() {
        lock.lock();
        try {
            return schedule.toBuilder().build();
        } finally {
            lock.unlock();
        }
    }

    public ScanState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public SchedulerStatus status() {
        lock.lock();
        try {
            String name;
            String runningId = null;
            int attempt = 0;
            Instant nextRetryAt = null;
            if (state instanceof Running running) {
                name = "RUNNING";
                runningId = running.runId();
                attempt = running.attempt();
            } else if (state instanceof CoolingDown cooling) {
                name = "COOLING_DOWN";
                attempt = cooling.attempt();
                nextRetryAt = cooling.nextRetryAt();
            } else {
                name = "IDLE";
            }
            return new SchedulerStatus(name, runningId, attempt, nextRetryAt, schedule.toBuilder().build(),
                    lastFailure, lastFailureAt, retriesExhausted);
        } finally {
            lock.unlock();
        }
    }

    private Running requireRunning(ScanState current, String runId) {
        if (current instanceof Running running && running.runId().equals(runId)) {
            return running;
        }
        throw new IllegalStateException("扫描 " + runId + " 不是当前进行中的扫描，当前状态: " + current);
    }

    private Duration interval() {
        return Duration.ofMinutes(schedule.getIntervalMinutes());
    }

    private static String newRunId() {
        return UUID.randomUUID().toString();
    }

    private static void validateInterval(int intervalMinutes) {
        if (intervalMinutes < ScheduleConfig.MIN_INTERVAL_MINUTES || intervalMinutes > ScheduleConfig.MAX_INTERVAL_MINUTES) {
            throw new IllegalArgumentException("扫描间隔必须在 " + ScheduleConfig.MIN_INTERVAL_MINUTES + " 到 "
                    + ScheduleConfig.MAX_INTERVAL_MINUTES + " 分钟之间: " + intervalMinutes);
        }
    }
}
