package com.opsbuddy.config.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 관측 메트릭 정의
 * - 게이트웨이 / RateLimit / 장애 탐지 / 브로드캐스트 Counter를 명시적으로 등록
 * - Prometheus / Grafana 시계열 분석용
 * - label을 두지 않아 cardinality 증가 방지
 */
@Configuration
public class MetricsConfig {

    /**
     * 모든 메트릭에 공통 tag 부여
     * Grafana에서 서비스 단위 필터링 가능
     */
    @Bean
    MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
                .commonTags("service", "opsbuddy-backend");
    }

    /**
     * Rate Limit 차단 누적 카운터
     */
    @Bean
    public Counter rateLimitBlockedCounter(MeterRegistry registry) {
        return Counter.builder("rate_limit_blocked_total")
                .description("Total blocked requests by rate limit")
                .register(registry);
    }

    /**
     * Rate Limit 통과 누적 카운터
     */
    @Bean
    public Counter rateLimitAllowedCounter(MeterRegistry registry) {
        return Counter.builder("rate_limit_allowed_total")
                .description("Total allowed requests by rate limit")
                .register(registry);
    }

    @Bean
    public Counter gatewayForwardedCounter(MeterRegistry registry) {
        return Counter.builder("gateway_forwarded_total")
                .description("Requests relayed from an upstream response below 500")
                .register(registry);
    }

    /**
     * CircuitBreaker OPEN 차단 누적 카운터
     */
    @Bean
    public Counter circuitRejectedCounter(MeterRegistry registry) {
        return Counter.builder("gateway_circuit_rejected_total")
                .description("Requests rejected without an upstream call because the circuit is open")
                .register(registry);
    }

    /**
     * 업스트림 장애 누적 카운터 (timeout / 연결 실패 / 5xx)
     */
    @Bean
    public Counter upstreamFailureCounter(MeterRegistry registry) {
        return Counter.builder("gateway_upstream_failure_total")
                .description("Upstream timeouts, connection failures and 5xx responses")
                .register(registry);
    }

    @Bean
    public Counter incidentEmittedCounter(MeterRegistry registry) {
        return Counter.builder("incident_emitted_total")
                .description("Incidents published by the detector")
                .register(registry);
    }

    @Bean
    public Counter broadcastSendFailureCounter(MeterRegistry registry) {
        return Counter.builder("broadcast_send_failure_total")
                .description("Failed sends to real-time clients")
                .register(registry);
    }

    /**
     * 헬스 프로브 응답 시간
     */
    @Bean
    public Timer healthProbeTimer(MeterRegistry registry) {
        return Timer.builder("health_probe_duration")
                .description("Health probe round trip time")
                .register(registry);
    }

}
