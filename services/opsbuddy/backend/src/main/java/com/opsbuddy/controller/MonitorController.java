package com.opsbuddy.controller;

import com.opsbuddy.broadcast.BroadcastServer;
import com.opsbuddy.domain.ServiceHealthRecord;
import com.opsbuddy.dto.DefaultResponse;
import com.opsbuddy.incident.IncidentDetector;
import com.opsbuddy.monitor.HealthMonitor;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 헬스 모니터 조회 API
 */
@RestController
@RequiredArgsConstructor
public class MonitorController {

    private final HealthMonitor healthMonitor;
    private final IncidentDetector incidentDetector;
    private final BroadcastServer broadcastServer;

    @GetMapping("/services")
    public ResponseEntity<DefaultResponse<List<ServiceHealthRecord>>> services() {
        return ResponseEntity.ok(
                DefaultResponse.success(HttpStatus.OK.value(), healthMonitor.snapshot())
        );
    }

    @GetMapping("/services/{name}")
    public ResponseEntity<DefaultResponse<ServiceHealthRecord>> service(@PathVariable String name) {
        return ResponseEntity.ok(
                DefaultResponse.success(HttpStatus.OK.value(), healthMonitor.require(name))
        );
    }

    @GetMapping("/services/groups/{group}")
    public ResponseEntity<DefaultResponse<List<ServiceHealthRecord>>> group(@PathVariable String group) {
        return ResponseEntity.ok(
                DefaultResponse.success(HttpStatus.OK.value(), healthMonitor.group(group))
        );
    }

    /**
     * 전체 집계 + 주기 작업 / 실시간 연결 상태
     */
    @GetMapping("/system/health")
    public ResponseEntity<DefaultResponse<Map<String, Object>>> systemHealth() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("summary", healthMonitor.summary());
        body.put("lastHealthCycleAt", healthMonitor.getLastCycleAt());
        body.put("lastDetectionCycleAt", incidentDetector.getLastCycleAt());
        body.put("detectionCheckpoint", incidentDetector.getCheckpoint());
        body.put("websocketConnections", broadcastServer.connectionCount());

        return ResponseEntity.ok(
                DefaultResponse.success(HttpStatus.OK.value(), body)
        );
    }
}
