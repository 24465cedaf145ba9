package com.opsbuddy.service;

import com.opsbuddy.breaker.BreakerSnapshot;
import com.opsbuddy.config.OpsProperties;
import com.opsbuddy.domain.HealthStatus;
import com.opsbuddy.domain.ServiceDescriptor;
import com.opsbuddy.domain.ServiceHealthRecord;
import com.opsbuddy.dto.FeatureToggleResponse;
import com.opsbuddy.dto.GatewayInfo;
import com.opsbuddy.dto.GatewayStatusResponse;
import com.opsbuddy.dto.RouteView;
import com.opsbuddy.logging.LogEvent;
import com.opsbuddy.monitor.HealthMonitor;
import com.opsbuddy.monitor.HealthSummary;
import com.opsbuddy.observability.RequestEvent;
import com.opsbuddy.observability.RequestEventBuffer;
import com.opsbuddy.registry.ServiceRegistry;
import com.opsbuddy.state.RuntimeFeatureState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 게이트웨이 운영 상태 조회
 * - 헬스 판단은 HealthMonitor의 최신 스냅샷 사용 (요청마다 업스트림을 다시 프로브하지 않음)
 */
@Slf4j
@Service
public class GatewayStatusService {

    private final OpsProperties.Gateway gateway;
    private final ServiceRegistry registry;
    private final HealthMonitor healthMonitor;
    private final RequestEventBuffer requestEventBuffer;
    private final RuntimeFeatureState runtimeFeatureState;
    private final Clock clock;
    private final Instant startedAt;

    public GatewayStatusService(OpsProperties properties,
                                ServiceRegistry registry,
                                HealthMonitor healthMonitor,
                                RequestEventBuffer requestEventBuffer,
                                RuntimeFeatureState runtimeFeatureState,
                                Clock clock) {
        this.gateway = properties.getGateway();
        this.registry = registry;
        this.healthMonitor = healthMonitor;
        this.requestEventBuffer = requestEventBuffer;
        this.runtimeFeatureState = runtimeFeatureState;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public GatewayInfo info() {
        Instant now = clock.instant();
        return new GatewayInfo(
                gateway.getName(),
                gateway.getVersion(),
                Duration.between(startedAt, now).toSeconds(),
                now
        );
    }

    public List<RouteView> routes() {
        return registry.services().stream()
                .map(GatewayStatusService::toRouteView)
                .toList();
    }

    /**
     * 다른 모니터가 프로브할 수 있도록 최상위 status를 가진 평문 본문
     */
    public Map<String, Object> health() {
        HealthSummary summary = healthMonitor.summary();

        Map<String, Object> services = new LinkedHashMap<>();
        List<String> unhealthy = new ArrayList<>();

        for (ServiceHealthRecord record : healthMonitor.snapshot()) {
            services.put(record.name(), record.status().value());
            if (record.status() != HealthStatus.HEALTHY) {
                unhealthy.add(record.name());
            }
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", summary.overallStatus().value());
        body.put("gateway", info());
        body.put("services", services);
        body.put("unhealthy_services", unhealthy);
        body.put("summary", summary);
        return body;
    }

    public GatewayStatusResponse status() {
        Map<String, BreakerSnapshot> breakers = new LinkedHashMap<>();
        registry.breakers().forEach((name, breaker) -> breakers.put(name, breaker.snapshot()));

        return new GatewayStatusResponse(
                info(),
                healthMonitor.snapshot(),
                breakers,
                runtimeFeatureState.isRateLimitEnabled()
        );
    }

    public List<RequestEvent> recentRequests(int limit) {
        return requestEventBuffer.getRecent(limit);
    }

    /**
     * Rate Limit 상태를 ON ↔ OFF로 전환
     */
    public FeatureToggleResponse toggleRateLimit() {
        boolean enabled = runtimeFeatureState.toggleRateLimit();

        log.info("event={} feature=rate-limit enabled={}", LogEvent.FEATURE_TOGGLED, enabled);

        return FeatureToggleResponse.of("rate-limit", enabled);
    }

    private static RouteView toRouteView(ServiceDescriptor descriptor) {
        return new RouteView(
                descriptor.name(),
                descriptor.baseUrl(),
                descriptor.routes(),
                descriptor.retries(),
                descriptor.timeout().toMillis(),
                descriptor.breakerThreshold()
        );
    }
}
