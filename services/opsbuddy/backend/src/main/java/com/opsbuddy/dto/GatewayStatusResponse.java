package com.opsbuddy.dto;

import com.opsbuddy.breaker.BreakerSnapshot;
import com.opsbuddy.domain.ServiceHealthRecord;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * 서비스별 헬스 + CircuitBreaker 상태 (/status)
 */
@Getter
@AllArgsConstructor
public class GatewayStatusResponse {

    private GatewayInfo gateway;

    private List<ServiceHealthRecord> services;

    // 서비스 이름 → 상태 / 연속 실패 / 마지막 실패 시각
    private Map<String, BreakerSnapshot> circuitBreakers;

    private boolean rateLimitEnabled;
}
