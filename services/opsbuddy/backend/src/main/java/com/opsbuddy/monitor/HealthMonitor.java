package com.opsbuddy.monitor;

import com.opsbuddy.config.OpsProperties;
import com.opsbuddy.domain.HealthStatus;
import com.opsbuddy.domain.ServiceDescriptor;
import com.opsbuddy.domain.ServiceHealthRecord;
import com.opsbuddy.exception.ConfigurationException;
import com.opsbuddy.logging.LogEvent;
import com.opsbuddy.observability.OpsMetrics;
import com.opsbuddy.registry.ServiceRegistry;
import com.opsbuddy.relay.RelayPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;

/**
 * 서비스 헬스 폴러
 *
 * - 사이클마다 모든 서비스 헬스 엔드포인트를 동시에 프로브 (개별 실패는 사이클에 영향 없음)
 * - 서비스별 ServiceHealthRecord를 교체 방식으로 갱신 (읽는 쪽은 불변 스냅샷)
 * - 상태 변경 여부와 무관하게 매 사이클 모든 레코드를 발행
 */
@Slf4j
@Service
public class HealthMonitor {

    private final ServiceRegistry registry;
    private final RestTemplate probeRestTemplate;
    private final HealthResponseParser parser;
    private final RelayPublisher publisher;
    private final OpsMetrics metrics;
    private final Executor probeExecutor;
    private final String healthChannel;
    private final Duration probeTimeout;
    private final Clock clock;

    private final Map<String, ServiceHealthRecord> records = new ConcurrentHashMap<>();

    private volatile Instant lastCycleAt;

    public HealthMonitor(ServiceRegistry registry,
                         @Qualifier("probeRestTemplate") RestTemplate probeRestTemplate,
                         HealthResponseParser parser,
                         RelayPublisher publisher,
                         OpsMetrics metrics,
                         @Qualifier("probeExecutor") Executor probeExecutor,
                         OpsProperties properties,
                         Clock clock) {
        this.registry = registry;
        this.probeRestTemplate = probeRestTemplate;
        this.parser = parser;
        this.publisher = publisher;
        this.metrics = metrics;
        this.probeExecutor = probeExecutor;
        this.healthChannel = properties.getRelay().getChannels().getHealth();
        this.probeTimeout = properties.getMonitor().getProbeTimeout();
        this.clock = clock;

        for (ServiceDescriptor descriptor : registry.services()) {
            records.put(descriptor.name(), ServiceHealthRecord.unknown(descriptor));
        }
    }

    /**
     * 1회 폴링 사이클
     * @return 사이클 종료 시점의 전체 집계
     */
    public HealthSummary runCycle() {
        List<CompletableFuture<ProbeResult>> probes = new ArrayList<>();

        for (ServiceDescriptor descriptor : registry.services()) {
            probes.add(
                    CompletableFuture.supplyAsync(() -> probe(descriptor), probeExecutor)
                            .exceptionally(e -> ProbeResult.failed(descriptor, e, clock.instant()))
            );
        }

        CompletableFuture.allOf(probes.toArray(CompletableFuture[]::new)).join();

        for (CompletableFuture<ProbeResult> probe : probes) {
            apply(probe.join());
        }

        lastCycleAt = clock.instant();

        return summary();
    }

    /**
     * 단일 서비스 프로브 (예외를 던지지 않음)
     */
    ProbeResult probe(ServiceDescriptor descriptor) {
        long start = System.nanoTime();

        try {
            ResponseEntity<String> response = probeRestTemplate.exchange(
                    descriptor.healthUrl(),
                    HttpMethod.GET,
                    null,
                    String.class
            );

            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            metrics.probeCompleted(elapsed);

            int code = response.getStatusCode().value();

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("http_status", code);

            if (code >= 400) {
                return new ProbeResult(descriptor.name(), HealthStatus.UNHEALTHY, elapsed, clock.instant(),
                        "HTTP " + code, details);
            }

            ParsedHealth parsed = parser.parse(response.getBody());
            if (parsed.payload() != null) {
                details.put("payload", parsed.payload());
            }

            return new ProbeResult(descriptor.name(), parsed.status(), elapsed, clock.instant(), "", details);

        } catch (RestClientException e) {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            metrics.probeCompleted(elapsed);

            return new ProbeResult(descriptor.name(), HealthStatus.UNHEALTHY, elapsed, clock.instant(),
                    describeTransportError(e), Map.of());
        }
    }

    private void apply(ProbeResult result) {
        ServiceHealthRecord previous = records.get(result.service());

        ServiceHealthRecord next = previous.next(
                result.status(),
                result.elapsed().toMillis(),
                result.checkedAt(),
                result.errorMessage(),
                result.details()
        );

        records.put(result.service(), next);

        if (previous.status() != next.status()) {
            log.info(
                    "event={} service={} from={} to={} error={}",
                    LogEvent.HEALTH_STATUS_CHANGED,
                    next.name(),
                    previous.status().value(),
                    next.status().value(),
                    next.errorMessage()
            );
        }

        if (next.status() == HealthStatus.UNHEALTHY) {
            log.warn(
                    "event={} service={} consecutiveFailures={} error={}",
                    LogEvent.HEALTH_PROBE_FAILED,
                    next.name(),
                    next.consecutiveFailures(),
                    next.errorMessage()
            );
        }

        publisher.publish(healthChannel, HealthUpdates.toMessage(next, clock.instant()));
    }

    String describeTransportError(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof HttpTimeoutException
                    || t instanceof SocketTimeoutException
                    || t instanceof TimeoutException) {
                return "Request timeout after " + probeTimeout.toMillis() + "ms";
            }
            if (t instanceof ConnectException) {
                return "Connection refused";
            }
        }
        Throwable root = error;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }

    public List<ServiceHealthRecord> snapshot() {
        List<ServiceHealthRecord> result = new ArrayList<>();
        for (ServiceDescriptor descriptor : registry.services()) {
            result.add(records.get(descriptor.name()));
        }
        return result;
    }

    public Optional<ServiceHealthRecord> find(String name) {
        return Optional.ofNullable(records.get(name));
    }

    public ServiceHealthRecord require(String name) {
        return find(name).orElseThrow(() -> ConfigurationException.serviceNotFound(name));
    }

    /**
     * 그룹에 속한 서비스 레코드
     * @throws ConfigurationException 그룹에 속한 서비스가 없는 경우
     */
    public List<ServiceHealthRecord> group(String group) {
        List<ServiceHealthRecord> result = registry.services().stream()
                .filter(d -> group.equals(d.group()))
                .map(d -> records.get(d.name()))
                .toList();

        if (result.isEmpty()) {
            throw new ConfigurationException("SERVICE_GROUP_NOT_FOUND", "Service group '" + group + "' not found");
        }
        return result;
    }

    public HealthSummary summary() {
        return HealthSummary.of(snapshot(), clock.instant());
    }

    public Instant getLastCycleAt() {
        return lastCycleAt;
    }

    record ProbeResult(
            String service,
            HealthStatus status,
            Duration elapsed,
            Instant checkedAt,
            String errorMessage,
            Map<String, Object> details
    ) {
        static ProbeResult failed(ServiceDescriptor descriptor, Throwable error, Instant now) {
            return new ProbeResult(descriptor.name(), HealthStatus.UNHEALTHY, Duration.ZERO, now,
                    "Probe failed: " + error.getMessage(), Map.of());
        }
    }
}
