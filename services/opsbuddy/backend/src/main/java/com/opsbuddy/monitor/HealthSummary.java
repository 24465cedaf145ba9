package com.opsbuddy.monitor;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.opsbuddy.domain.HealthStatus;
import com.opsbuddy.domain.ServiceHealthRecord;

import java.time.Instant;
import java.util.Collection;

/**
 * 전체 서비스 헬스 집계
 * - UNHEALTHY 1개 이상 → UNHEALTHY
 * - DEGRADED 1개 이상 → DEGRADED
 * - 전부 HEALTHY → HEALTHY
 * - 그 외 (UNKNOWN 포함) → UNKNOWN
 */
public record HealthSummary(
        @JsonProperty("overall_status") HealthStatus overallStatus,
        @JsonProperty("total_services") int totalServices,
        int healthy,
        int unhealthy,
        int degraded,
        int unknown,
        Instant timestamp
) {

    public static HealthSummary of(Collection<ServiceHealthRecord> records, Instant now) {
        int healthy = 0;
        int unhealthy = 0;
        int degraded = 0;
        int unknown = 0;

        for (ServiceHealthRecord record : records) {
            switch (record.status()) {
                case HEALTHY -> healthy++;
                case UNHEALTHY -> unhealthy++;
                case DEGRADED -> degraded++;
                default -> unknown++;
            }
        }

        HealthStatus overall;
        if (unhealthy > 0) {
            overall = HealthStatus.UNHEALTHY;
        } else if (degraded > 0) {
            overall = HealthStatus.DEGRADED;
        } else if (healthy == records.size()) {
            overall = HealthStatus.HEALTHY;
        } else {
            overall = HealthStatus.UNKNOWN;
        }

        return new HealthSummary(overall, records.size(), healthy, unhealthy, degraded, unknown, now);
    }
}
