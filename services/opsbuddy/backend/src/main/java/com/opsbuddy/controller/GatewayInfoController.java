package com.opsbuddy.controller;

import com.opsbuddy.dto.DefaultResponse;
import com.opsbuddy.dto.GatewayInfo;
import com.opsbuddy.dto.GatewayStatusResponse;
import com.opsbuddy.dto.RouteView;
import com.opsbuddy.service.GatewayStatusService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class GatewayInfoController {

    private final GatewayStatusService gatewayStatusService;

    @GetMapping("/")
    public ResponseEntity<DefaultResponse<GatewayInfo>> root() {
        return ResponseEntity.ok(
                DefaultResponse.success(HttpStatus.OK.value(), gatewayStatusService.info())
        );
    }

    /**
     * 라우팅 테이블 / 등록 서비스 목록
     */
    @GetMapping("/api")
    public ResponseEntity<DefaultResponse<List<RouteView>>> routes() {
        return ResponseEntity.ok(
                DefaultResponse.success(HttpStatus.OK.value(), gatewayStatusService.routes())
        );
    }

    /**
     * 게이트웨이 헬스
     * - 외부 모니터가 프로브하므로 envelope 없이 최상위 status 필드로 응답
     */
    @GetMapping("/health")
    public Map<String, Object> health() {
        return gatewayStatusService.health();
    }

    /**
     * 서비스별 헬스 + CircuitBreaker 상태
     */
    @GetMapping("/status")
    public ResponseEntity<DefaultResponse<GatewayStatusResponse>> status() {
        return ResponseEntity.ok(
                DefaultResponse.success(HttpStatus.OK.value(), gatewayStatusService.status())
        );
    }
}
