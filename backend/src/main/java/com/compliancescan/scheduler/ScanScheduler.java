package com.compliancescan.scheduler;

import com.compliancescan.service.ScanCoordinator;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 后台定时检查，是否开始扫描由状态机决定
 */
@Component
public class ScanScheduler {

    private final ScanCoordinator coordinator;

    public ScanScheduler(ScanCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Scheduled(fixedDelayString = "${compliance-scan.scheduler.tick-millis:30000}",
            initialDelayString = "${compliance-scan.scheduler.tick-millis:30000}")
    public void tick() {
        coordinator.onTimerTick();
    }
}
