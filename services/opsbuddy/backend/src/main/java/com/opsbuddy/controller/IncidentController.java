package com.opsbuddy.controller;

import com.opsbuddy.dto.DefaultResponse;
import com.opsbuddy.dto.FeatureToggleResponse;
import com.opsbuddy.exception.ApiException;
import com.opsbuddy.incident.IncidentDetector;
import com.opsbuddy.incident.IncidentQueryService;
import com.opsbuddy.incident.IncidentSummary;
import com.opsbuddy.incident.ServiceErrors;
import com.opsbuddy.logging.LogEvent;
import com.opsbuddy.state.RuntimeFeatureState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 장애 탐지 조회 / 제어 API
 */
@Slf4j
@RestController
public class IncidentController {

    private final IncidentQueryService incidentQueryService;
    private final IncidentDetector incidentDetector;
    private final RuntimeFeatureState runtimeFeatureState;
    private final Executor workerExecutor;

    public IncidentController(IncidentQueryService incidentQueryService,
                              IncidentDetector incidentDetector,
                              RuntimeFeatureState runtimeFeatureState,
                              @Qualifier("workerExecutor") Executor workerExecutor) {
        this.incidentQueryService = incidentQueryService;
        this.incidentDetector = incidentDetector;
        this.runtimeFeatureState = runtimeFeatureState;
        this.workerExecutor = workerExecutor;
    }

    @GetMapping("/incidents")
    public ResponseEntity<DefaultResponse<IncidentSummary>> incidents(
            @RequestParam(defaultValue = "1") int hours
    ) {
        return ResponseEntity.ok(
                DefaultResponse.success(HttpStatus.OK.value(), incidentQueryService.summary(hours))
        );
    }

    @GetMapping("/errors/{service}")
    public ResponseEntity<DefaultResponse<ServiceErrors>> serviceErrors(
            @PathVariable String service,
            @RequestParam(defaultValue = "1") int hours
    ) {
        return ResponseEntity.ok(
                DefaultResponse.success(HttpStatus.OK.value(), incidentQueryService.serviceErrors(service, hours))
        );
    }

    /**
     * 즉시 탐지 사이클 실행 요청
     * - 백그라운드 실행, 진행 중인 사이클이 있으면 끝난 뒤 실행
     */
    @PostMapping("/check")
    public ResponseEntity<DefaultResponse<Map<String, Object>>> check() {
        try {
            CompletableFuture.supplyAsync(incidentDetector::runCycle, workerExecutor)
                    .whenComplete((result, error) -> {
                        if (error != null) {
                            log.warn("event=FORCED_DETECTION_FAILED message={}", error.getMessage());
                        } else {
                            log.info("event=FORCED_DETECTION_COMPLETED outcome={} incidents={}",
                                    result.outcome(), result.incidents());
                        }
                    });
        } catch (RejectedExecutionException e) {
            // 대기 중인 수동 사이클이 worker 큐를 모두 채움
            log.warn("event=FORCED_DETECTION_REJECTED message={}", e.getMessage());
            throw new ApiException("DETECTION_BUSY", "Error check already queued", HttpStatus.SERVICE_UNAVAILABLE, e);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Error check initiated");
        body.put("timestamp", Instant.now());

        return ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .body(DefaultResponse.success(HttpStatus.ACCEPTED.value(), body));
    }

    /**
     * 탐지 일시정지 / 재개
     * - 정지 중에는 checkpoint가 유지되어 재개 시 밀린 구간부터 탐지
     */
    @PostMapping("/incidents/detection/toggle")
    public ResponseEntity<DefaultResponse<FeatureToggleResponse>> toggleDetection() {
        boolean enabled = runtimeFeatureState.toggleDetection();

        log.info("event={} feature=incident-detection enabled={}", LogEvent.FEATURE_TOGGLED, enabled);

        return ResponseEntity.ok(
                DefaultResponse.success(
                        HttpStatus.OK.value(),
                        FeatureToggleResponse.of("incident-detection", enabled)
                )
        );
    }
}
