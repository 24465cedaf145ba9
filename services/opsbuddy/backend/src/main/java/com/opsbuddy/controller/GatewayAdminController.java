package com.opsbuddy.controller;

import com.opsbuddy.dto.DefaultResponse;
import com.opsbuddy.dto.FeatureToggleResponse;
import com.opsbuddy.observability.RequestEvent;
import com.opsbuddy.service.GatewayStatusService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/gateway")
@RequiredArgsConstructor
public class GatewayAdminController {

    private final GatewayStatusService gatewayStatusService;

    /**
     * Rate Limit ON/OFF 토글 API
     * - 서버 재시작 없이 동적 전환
     */
    @PostMapping("/rate-limit/toggle")
    public ResponseEntity<DefaultResponse<FeatureToggleResponse>> toggleRateLimit() {
        return ResponseEntity.ok(
                DefaultResponse.success(
                        HttpStatus.OK.value(),
                        gatewayStatusService.toggleRateLimit()
                )
        );
    }

    /**
     * 최근 게이트웨이 요청 이벤트 조회 API
     *
     * - 인메모리 RequestEventBuffer 기반
     * - 최근 N건 (최신 순), 기본값: 50
     */
    @GetMapping("/recent-requests")
    public ResponseEntity<DefaultResponse<List<RequestEvent>>> recentRequests(
            @RequestParam(defaultValue = "50") int limit
    ) {
        return ResponseEntity.ok(
                DefaultResponse.success(
                        HttpStatus.OK.value(),
                        gatewayStatusService.recentRequests(limit)
                )
        );
    }
}
