package com.compliancescan.scheduler;

import com.compliancescan.model.ScheduleConfig;

import java.time.Instant;

/**
 * 调度状态概览
 *
 * @param state             当前状态名：IDLE / RUNNING / COOLING_DOWN
 * @param runningScanId     进行中的扫描 ID
 * @param retryAttempt      已连续失败的次数
 * @param nextRetryAt       下次重试时间（仅 COOLING_DOWN）
 * @param schedule          定时配置
 * @param lastFailure       最近一次失败原因，成功完成一次扫描后清除
 * @param lastFailureAt     最近一次失败时间
 * @param retriesExhausted  重试次数是否已用尽
 */
public record SchedulerStatus(String state,
                              String runningScanId,
                              int retryAttempt,
                              Instant nextRetryAt,
                              ScheduleConfig schedule,
                              String lastFailure,
                              Instant lastFailureAt,
                              boolean retriesExhausted) {
}
