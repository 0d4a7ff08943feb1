package com.compliancescan.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 定时扫描配置
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleConfig {

    public static final int MIN_INTERVAL_MINUTES = 60;
    public static final int MAX_INTERVAL_MINUTES = 1440;

    /** 扫描间隔（分钟），取值 60 ~ 1440 */
    private int intervalMinutes;

    /** 是否启用 */
    private boolean enabled;

    /** 下次执行时间 */
    private Instant nextRunAt;

    /** 上次完成时间 */
    private Instant lastRunAt;
}
