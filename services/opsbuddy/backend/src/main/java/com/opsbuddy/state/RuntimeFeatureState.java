package com.opsbuddy.state;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 런타임 ON/OFF 기능 플래그
 * - RATE_LIMIT : 게이트웨이 IP Rate Limit (기본 OFF)
 * - DETECTION : IncidentDetector 주기 작업 (기본 ON, OFF 동안 checkpoint 유지)
 */
@Component
public class RuntimeFeatureState {

    public enum Feature {
        RATE_LIMIT,
        DETECTION
    }

    private final Map<Feature, AtomicBoolean> flags = new EnumMap<>(Feature.class);

    public RuntimeFeatureState(
            @Value("${rate-limit.enabled:false}") boolean rateLimitEnabled,
            @Value("${incident-detection.enabled:true}") boolean detectionEnabled
    ) {
        flags.put(Feature.RATE_LIMIT, new AtomicBoolean(rateLimitEnabled));
        flags.put(Feature.DETECTION, new AtomicBoolean(detectionEnabled));
    }

    public boolean isEnabled(Feature feature) {
        return flags.get(feature).get();
    }

    public boolean isRateLimitEnabled() {
        return isEnabled(Feature.RATE_LIMIT);
    }

    public boolean isDetectionEnabled() {
        return isEnabled(Feature.DETECTION);
    }

    /**
     * 현재 값을 반전하고 바뀐 값을 반환
     * 동시 toggle 시 CAS 재시도로 호출 수만큼 정확히 반전
     */
    public boolean toggle(Feature feature) {
        AtomicBoolean flag = flags.get(feature);
        boolean current;
        do {
            current = flag.get();
        } while (!flag.compareAndSet(current, !current));
        return !current;
    }

    public boolean toggleRateLimit() {
        return toggle(Feature.RATE_LIMIT);
    }

    public boolean toggleDetection() {
        return toggle(Feature.DETECTION);
    }
}
