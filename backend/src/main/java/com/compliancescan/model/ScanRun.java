package com.compliancescan.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 一次完整扫描的记录
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScanRun {

    /** 扫描 ID */
    private String id;

    /** 触发方式 */
    private Trigger trigger;

    /** 开始时间 */
    private Instant startedAt;

    /** 结束时间，运行中为空 */
    private Instant completedAt;

    /** 扫描状态 */
    private Status status;

    /** 使用的结构快照版本 */
    private String schemaVersion;

    /** 各规则执行结果 */
    @Builder.Default
    private List<RuleOutcome> outcomes = new ArrayList<>();

    /** 新增违规数 */
    private int newCount;

    /** 持续存在的违规数 */
    private int persistingCount;

    /** 已解除的违规数 */
    private int resolvedCount;

    /** 致命错误信息 */
    private String errorMessage;

    public boolean isRunning() {
        return status == Status.RUNNING;
    }

    public enum Status {
        RUNNING, COMPLETED, COMPLETED_WITH_ERRORS, FAILED
    }

    public enum Trigger {
        MANUAL, SCHEDULED, RETRY
    }
}
