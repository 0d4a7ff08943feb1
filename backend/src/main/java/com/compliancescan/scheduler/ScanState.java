package com.compliancescan.scheduler;

import com.compliancescan.model.ScanRun.Trigger;

import java.time.Instant;

/**
 * 扫描调度状态
 */
public sealed interface ScanState permits ScanState.Idle, ScanState.Running, ScanState.CoolingDown {

    /** 空闲，等待下一次定时或手动触发 */
    record Idle() implements ScanState {
    }

    /**
     * 扫描进行中
     *
     * @param runId   扫描 ID
     * @param trigger 触发方式
     * @param attempt 本次扫描之前连续失败的次数
     */
    record Running(String runId, Trigger trigger, int attempt) implements ScanState {
    }

    /**
     * 失败后等待重试
     *
     * @param attempt     已连续失败的次数
     * @param nextRetryAt 下次重试时间
     */
    record CoolingDown(int attempt, Instant nextRetryAt) implements ScanState {
    }

    static ScanState idle() {
        return new Idle();
    }
}
