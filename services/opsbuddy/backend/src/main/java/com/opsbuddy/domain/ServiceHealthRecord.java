package com.opsbuddy.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 서비스 단위 헬스 상태 스냅샷
 * - HealthMonitor만 교체(갱신)하며, 외부에는 불변 스냅샷으로 노출
 */
public record ServiceHealthRecord(
        String name,
        String url,
        HealthStatus status,
        long responseTimeMs,
        Instant lastCheck,
        int consecutiveFailures,
        String errorMessage,
        Map<String, Object> details
) {

    public ServiceHealthRecord {
        errorMessage = errorMessage == null ? "" : errorMessage;
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static ServiceHealthRecord unknown(ServiceDescriptor descriptor) {
        return new ServiceHealthRecord(
                descriptor.name(),
                descriptor.baseUrl(),
                HealthStatus.UNKNOWN,
                0L,
                null,
                0,
                "",
                Map.of()
        );
    }

    /**
     * 프로브 결과 반영
     * HEALTHY면 연속 실패 0으로 초기화, 그 외 상태는 +1
     */
    public ServiceHealthRecord next(HealthStatus newStatus,
                                    long newResponseTimeMs,
                                    Instant checkedAt,
                                    String newErrorMessage,
                                    Map<String, Object> newDetails) {
        int failures = newStatus == HealthStatus.HEALTHY ? 0 : consecutiveFailures + 1;
        return new ServiceHealthRecord(
                name,
                url,
                newStatus,
                newResponseTimeMs,
                checkedAt,
                failures,
                newErrorMessage,
                newDetails
        );
    }
}
