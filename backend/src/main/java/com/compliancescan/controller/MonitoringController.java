package com.compliancescan.controller;

import com.compliancescan.model.ScheduleConfig;
import com.compliancescan.scheduler.SchedulerStatus;
import com.compliancescan.service.ScanCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.Map;

/**
 * 持续监控配置与调度状态
 */
@RestController
@RequestMapping("/api/monitoring")
@CrossOrigin(origins = "*")
public class MonitoringController {

    private static final Logger log = LoggerFactory.getLogger(MonitoringController.class);

    private final ScanCoordinator scanCoordinator;

    public MonitoringController(ScanCoordinator scanCoordinator) {
        this.scanCoordinator = scanCoordinator;
    }

    @GetMapping("/status")
    public ResponseEntity<SchedulerStatus> status() {
        return ResponseEntity.ok(scanCoordinator.status());
    }

    /**
     * 配置定时扫描，请求体 {"intervalMinutes": 360, "enabled": true}
     */
    @PutMapping("/schedule")
    public ResponseEntity<?> configure(@RequestBody Map<String, Object> request) {
        Object interval = request.get("intervalMinutes");
        if (!(interval instanceof Number number)) {
            return ResponseEntity.badRequest().body(Map.of("error", "请提供扫描间隔 (intervalMinutes)"));
        }
        Integer minutes = toMinutes(number);
        if (minutes == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "扫描间隔必须为整数分钟: " + number));
        }
        Object enabled = request.getOrDefault("enabled", Boolean.TRUE);
        if (!(enabled instanceof Boolean flag)) {
            return ResponseEntity.badRequest().body(Map.of("error", "enabled 必须为 true 或 false"));
        }

        try {
            ScheduleConfig schedule = scanCoordinator.configureSchedule(minutes, flag);
            return ResponseEntity.ok(schedule);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("更新定时配置失败", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "更新定时配置失败: " + e.getMessage()));
        }
    }

    /**
     * 只接受 int 范围内的整数，60.0 视为 60；其他值返回 null
     */
    private static Integer toMinutes(Number number) {
        try {
            BigDecimal value = new BigDecimal(number.toString());
            if (value.stripTrailingZeros().scale() > 0) {
                return null;
            }
            return value.intValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            return null;
        }
    }

    /**
     * 停用定时扫描，保留当前间隔
     */
    @DeleteMapping("/schedule")
    public ResponseEntity<ScheduleConfig> disable() {
        int interval = scanCoordinator.status().schedule().getIntervalMinutes();
        return ResponseEntity.ok(scanCoordinator.configureSchedule(interval, false));
    }
}
