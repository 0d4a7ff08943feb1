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
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ScanStateMachineTest {

    private static final Instant START = Instant.parse("2026-05-01T08:00:00Z");

    private final MutableClock clock = new MutableClock(START);

    private ScanStateMachine machine(boolean enabled) {
        return new ScanStateMachine(clock, 360, enabled, 3, Duration.ofMinutes(1), Duration.ofMinutes(30));
    }

    private Running startManual(ScanStateMachine machine) {
        return machine.fire(new ManualTrigger()).startedRun().orElseThrow();
    }

    @Test
    void shouldRejectManualTriggerWhileRunning() {
        ScanStateMachine machine = machine(false);
        Running running = startManual(machine);

        ScanAlreadyRunningException e = assertThrows(ScanAlreadyRunningException.class,
                () -> machine.fire(new ManualTrigger()));
        assertEquals(running.runId(), e.getRunningScanId());
        assertEquals(running, machine.state());
    }

    @Test
    void shouldReturnToIdleAfterCompletion() {
        ScanStateMachine machine = machine(true);
        Running running = startManual(machine);
        Instant done = START.plusSeconds(90);

        machine.fire(new RunCompleted(running.runId(), done));

        assertInstanceOf(Idle.class, machine.state());
        ScheduleConfig schedule = machine.schedule();
        assertEquals(done, schedule.getLastRunAt());
        assertEquals(done.plus(Duration.ofMinutes(360)), schedule.getNextRunAt());
    }

    @Test
    void shouldStartScheduledRunOnlyWhenDue() {
        ScanStateMachine machine = machine(true);

        assertTrue(machine.fire(new TimerFired(START.plus(Duration.ofMinutes(359)))).startedRun().isEmpty());

        Running running = machine.fire(new TimerFired(START.plus(Duration.ofMinutes(360)))).startedRun().orElseThrow();
        assertEquals(Trigger.SCHEDULED, running.trigger());
        assertTrue(machine.fire(new TimerFired(START.plus(Duration.ofMinutes(400)))).startedRun().isEmpty());
    }

    @Test
    void shouldNeverStartScheduledRunWhenDisabled() {
        ScanStateMachine machine = machine(false);

        assertTrue(machine.fire(new TimerFired(START.plus(Duration.ofDays(3)))).startedRun().isEmpty());
        assertNull(machine.schedule().getNextRunAt());
    }

    @Test
    void shouldBackOffExponentiallyAndStopAfterMaxRetries() {
        ScanStateMachine machine = machine(true);
        Running running = startManual(machine);

        Instant failedAt = START;
        for (int attempt = 1; attempt <= 3; attempt++) {
            machine.fire(new RunFailed(running.runId(), failedAt, "连接中断"));
            CoolingDown cooling = assertInstanceOf(CoolingDown.class, machine.state());
            assertEquals(attempt, cooling.attempt());
            Duration expected = Duration.ofMinutes(1L << (attempt - 1));
            assertEquals(failedAt.plus(expected), cooling.nextRetryAt());

            assertTrue(machine.fire(new TimerFired(cooling.nextRetryAt().minusSeconds(1))).startedRun().isEmpty());
            running = machine.fire(new TimerFired(cooling.nextRetryAt())).startedRun().orElseThrow();
            assertEquals(Trigger.RETRY, running.trigger());
            assertEquals(attempt, running.attempt());
            failedAt = cooling.nextRetryAt().plusSeconds(5);
        }

        machine.fire(new RunFailed(running.runId(), failedAt, "连接中断"));

        assertInstanceOf(Idle.class, machine.state());
        SchedulerStatus status = machine.status();
        assertTrue(status.retriesExhausted());
        assertEquals("连接中断", status.lastFailure());
        assertEquals(failedAt.plus(Duration.ofMinutes(360)), status.schedule().getNextRunAt());
    }

    @Test
    void shouldCapRetryDelay() {
        ScanStateMachine machine = new ScanStateMachine(clock, 60, true, 10,
                Duration.ofMinutes(1), Duration.ofMinutes(30));

        assertEquals(Duration.ofMinutes(16), machine.retryDelay(5));
        assertEquals(Duration.ofMinutes(30), machine.retryDelay(6));
        assertEquals(Duration.ofMinutes(30), machine.retryDelay(9));
    }

    @Test
    void shouldNotRetryWhenScheduleDisabled() {
        ScanStateMachine machine = machine(false);
        Running running = startManual(machine);

        machine.fire(new RunFailed(running.runId(), START, "boom"));

        assertInstanceOf(Idle.class, machine.state());
        assertFalse(machine.status().retriesExhausted());
        assertEquals("boom", machine.status().lastFailure());
    }

    @Test
    void shouldClearFailureAfterSuccessfulRun() {
        ScanStateMachine machine = machine(true);
        Running first = startManual(machine);
        machine.fire(new RunFailed(first.runId(), START, "boom"));

        Running second = startManual(machine);
        assertEquals(1, second.attempt());
        machine.fire(new RunCompleted(second.runId(), START.plusSeconds(30)));

        SchedulerStatus status = machine.status();
        assertEquals("IDLE", status.state());
        assertNull(status.lastFailure());
        assertEquals(0, status.retryAttempt());
    }

    @Test
    void shouldRecomputeNextRunWhenIntervalChanges() {
        ScanStateMachine machine = machine(true);
        clock.advance(Duration.ofMinutes(10));

        ScheduleConfig hourly = machine.configure(60, true);
        assertEquals(clock.instant().plus(Duration.ofMinutes(60)), hourly.getNextRunAt());

        clock.advance(Duration.ofMinutes(5));
        ScheduleConfig daily = machine.configure(1440, true);
        assertEquals(clock.instant().plus(Duration.ofMinutes(1440)), daily.getNextRunAt());

        clock.advance(Duration.ofMinutes(5));
        ScheduleConfig unchanged = machine.configure(1440, true);
        assertEquals(daily.getNextRunAt(), unchanged.getNextRunAt());
    }

    @Test
    void shouldRejectIntervalOutsideBounds() {
        ScanStateMachine machine = machine(true);

        assertThrows(IllegalArgumentException.class, () -> machine.configure(59, true));
        assertThrows(IllegalArgumentException.class, () -> machine.configure(1441, true));
        assertEquals(360, machine.schedule().getIntervalMinutes());
    }

    @Test
    void shouldCancelPendingRetryWhenDisabled() {
        ScanStateMachine machine = machine(true);
        Running running = startManual(machine);
        machine.fire(new RunFailed(running.runId(), START, "boom"));
        assertInstanceOf(CoolingDown.class, machine.state());

        machine.configure(360, false);

        assertInstanceOf(Idle.class, machine.state());
        assertNull(machine.schedule().getNextRunAt());
        assertTrue(machine.fire(new TimerFired(START.plus(Duration.ofDays(1)))).startedRun().isEmpty());
    }

    @Test
    void shouldRejectCompletionOfUnknownRun() {
        ScanStateMachine machine = machine(false);
        startManual(machine);

        assertThrows(IllegalStateException.class, () -> machine.fire(new RunCompleted("other", START)));
    }
}
