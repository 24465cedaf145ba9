package com.opsbuddy.scheduler;

import com.opsbuddy.incident.IncidentDetector;
import com.opsbuddy.monitor.HealthMonitor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 헬스 폴링 / 장애 탐지 주기 실행
 * - 두 작업은 서로 다른 scheduler thread에서 독립적으로 실행
 * - fixedDelay : 이전 사이클 종료 후 interval 대기 (같은 작업끼리 겹치지 않음)
 * - 사이클 예외는 여기서 흡수 (다음 주기 계속)
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "opsbuddy.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PeriodicTasks {

    private final HealthMonitor healthMonitor;
    private final IncidentDetector incidentDetector;

    @Scheduled(
            initialDelayString = "${opsbuddy.monitor.initial-delay:PT1S}",
            fixedDelayString = "${opsbuddy.monitor.interval:PT30S}"
    )
    public void pollHealth() {
        try {
            healthMonitor.runCycle();
        } catch (RuntimeException e) {
            // LogAspect에서 이미 기록됨
            log.debug("event=HEALTH_CYCLE_ABORTED message={}", e.getMessage());
        }
    }

    @Scheduled(
            initialDelayString = "${opsbuddy.detector.initial-delay:PT5S}",
            fixedDelayString = "${opsbuddy.detector.interval:PT30S}"
    )
    public void detectIncidents() {
        try {
            incidentDetector.runCycle();
        } catch (RuntimeException e) {
            log.debug("event=DETECTION_CYCLE_ABORTED message={}", e.getMessage());
        }
    }
}
