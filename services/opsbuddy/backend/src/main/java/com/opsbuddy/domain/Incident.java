package com.opsbuddy.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 로그 스토어에서 탐지된 장애 이벤트 (불변)
 * - id는 동일 로그 row에 대해 항상 같은 값 (소비 측 중복 제거 키)
 */
public record Incident(
        String id,
        Instant timestamp,
        String service,
        String level,
        String logger,
        String host,
        String operation,
        String message,
        Map<String, Object> data,
        Instant detectionTime
) {

    public Incident {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}
