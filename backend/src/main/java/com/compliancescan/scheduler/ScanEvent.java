package com.compliancescan.scheduler;

import java.time.Instant;

/**
 * 驱动调度状态机的事件
 */
public sealed interface ScanEvent
        permits ScanEvent.TimerFired, ScanEvent.ManualTrigger, ScanEvent.RunCompleted, ScanEvent.RunFailed {

    record TimerFired(Instant now) implements ScanEvent {
    }

    record ManualTrigger() implements ScanEvent {
    }

    record RunCompleted(String runId, Instant at) implements ScanEvent {
    }

    record RunFailed(String runId, Instant at, String reason) implements ScanEvent {
    }
}
