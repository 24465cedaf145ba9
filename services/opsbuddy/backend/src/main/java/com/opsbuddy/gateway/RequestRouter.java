package com.opsbuddy.gateway;

import com.opsbuddy.breaker.ServiceCircuitBreaker;
import com.opsbuddy.domain.ServiceDescriptor;
import com.opsbuddy.exception.ApiException;
import com.opsbuddy.exception.CircuitOpenException;
import com.opsbuddy.exception.ConfigurationException;
import com.opsbuddy.exception.TransportException;
import com.opsbuddy.exception.UpstreamException;
import com.opsbuddy.logging.LogEvent;
import com.opsbuddy.observability.OpsMetrics;
import com.opsbuddy.observability.RequestEvent;
import com.opsbuddy.observability.RequestEventBuffer;
import com.opsbuddy.registry.RoutingTable;
import com.opsbuddy.registry.ServiceRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 게이트웨이 요청 처리
 *
 * 1. 라우팅 테이블에서 가장 긴 prefix 매칭 (없으면 404)
 * 2. 서비스 CircuitBreaker 확인 (OPEN이면 업스트림 호출 없이 503)
 * 3. hop-by-hop 헤더를 제외하고 method / query / body 그대로 전달
 * 4. 결과를 CircuitBreaker에 1회 보고
 *    - 응답 < 500 : 성공, 응답 그대로 반환
 *    - 응답 5xx  : 실패, 502
 *    - timeout    : 실패, 504 / 연결 실패 : 실패, 502
 */
@Slf4j
@Service
public class RequestRouter {

    private static final Duration RETRY_WAIT = Duration.ofMillis(200);

    private final ServiceRegistry registry;
    private final UpstreamClient upstreamClient;
    private final RequestEventBuffer requestEventBuffer;
    private final OpsMetrics metrics;

    // idempotent 요청 transport 실패 재시도 (retries > 0 인 서비스만)
    private final Map<String, Retry> retries;

    public RequestRouter(ServiceRegistry registry,
                         UpstreamClient upstreamClient,
                         RequestEventBuffer requestEventBuffer,
                         OpsMetrics metrics,
                         RetryRegistry retryRegistry) {
        this.registry = registry;
        this.upstreamClient = upstreamClient;
        this.requestEventBuffer = requestEventBuffer;
        this.metrics = metrics;

        Map<String, Retry> byService = new LinkedHashMap<>();
        for (ServiceDescriptor descriptor : registry.services()) {
            if (descriptor.retries() > 0) {
                byService.put(descriptor.name(), createRetry(retryRegistry, descriptor));
            }
        }
        this.retries = Map.copyOf(byService);
    }

    public ResponseEntity<byte[]> route(ForwardRequest request) {
        long start = System.nanoTime();

        String target = null;
        int status = 500;
        String outcome = LogEvent.GATEWAY_FAILED;

        try {
            RoutingTable.Route route = registry.routingTable().match(request.path())
                    .orElseThrow(() -> ConfigurationException.routeNotFound(request.path()));

            target = route.serviceName();

            ServiceDescriptor descriptor = registry.require(target);
            ServiceCircuitBreaker breaker = registry.breaker(target);

            if (!breaker.canExecute()) {
                metrics.circuitRejected();
                throw new CircuitOpenException(target);
            }

            ResponseEntity<byte[]> response = forward(descriptor, breaker, request);

            status = response.getStatusCode().value();
            outcome = LogEvent.GATEWAY_FORWARDED;

            return response;

        } catch (ApiException e) {
            status = e.getStatus().value();
            outcome = e.getCode();
            throw e;

        } finally {
            long durationMs = Duration.ofNanos(System.nanoTime() - start).toMillis();
            record(request, target, status, outcome, durationMs);
        }
    }

    /**
     * 업스트림 호출 및 CircuitBreaker 보고
     * - canExecute()가 true를 반환한 뒤에만 호출 (결과 보고 누락 금지)
     */
    private ResponseEntity<byte[]> forward(ServiceDescriptor descriptor,
                                           ServiceCircuitBreaker breaker,
                                           ForwardRequest request) {
        long callStart = System.nanoTime();

        ResponseEntity<byte[]> response;
        try {
            response = call(descriptor, request);
        } catch (TransportException e) {
            breaker.onFailure(elapsedSince(callStart), e);
            metrics.upstreamFailure();
            throw e;
        } catch (RuntimeException e) {
            breaker.onFailure(elapsedSince(callStart), e);
            throw e;
        }

        int code = response.getStatusCode().value();

        if (code >= 500) {
            UpstreamException error = new UpstreamException(descriptor.name(), code);
            breaker.onFailure(elapsedSince(callStart), error);
            metrics.upstreamFailure();
            throw error;
        }

        breaker.onSuccess(elapsedSince(callStart));
        metrics.forwarded();

        return ResponseEntity
                .status(code)
                .headers(ForwardHeaders.forResponse(response.getHeaders()))
                .body(response.getBody());
    }

    private ResponseEntity<byte[]> call(ServiceDescriptor descriptor, ForwardRequest request) {
        URI uri = buildUri(descriptor, request);

        var headers = ForwardHeaders.forRequest(request.headers(), request.clientIp(), request.traceId());

        Retry retry = retries.get(descriptor.name());

        if (retry == null || !request.isIdempotentRead()) {
            return upstreamClient.exchange(descriptor, request.method(), uri, headers, request.body());
        }

        return Retry.decorateSupplier(
                retry,
                () -> upstreamClient.exchange(descriptor, request.method(), uri, headers, request.body())
        ).get();
    }

    static URI buildUri(ServiceDescriptor descriptor, ForwardRequest request) {
        StringBuilder url = new StringBuilder(descriptor.baseUrl()).append(request.path());
        if (request.query() != null && !request.query().isEmpty()) {
            url.append('?').append(request.query());
        }
        return URI.create(url.toString());
    }

    private void record(ForwardRequest request, String target, int status, String outcome, long durationMs) {
        if (LogEvent.GATEWAY_FORWARDED.equals(outcome)) {
            log.info(
                    "event={} method={} path={} target={} status={} latencyMs={}",
                    outcome,
                    request.method(),
                    request.path(),
                    target,
                    status,
                    durationMs
            );
        } else {
            log.warn(
                    "event={} method={} path={} target={} status={} latencyMs={}",
                    outcome,
                    request.method(),
                    request.path(),
                    target,
                    status,
                    durationMs
            );
        }

        requestEventBuffer.add(new RequestEvent(
                Instant.now(),
                request.traceId(),
                request.clientIp(),
                request.method().name(),
                request.path(),
                target,
                status,
                outcome,
                durationMs
        ));
    }

    private static Retry createRetry(RetryRegistry retryRegistry, ServiceDescriptor descriptor) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(descriptor.retries() + 1)
                .waitDuration(RETRY_WAIT)
                .retryExceptions(TransportException.class)
                .build();

        Retry retry = retryRegistry.retry("gateway-" + descriptor.name(), config);

        retry.getEventPublisher().onRetry(event ->
                log.warn(
                        "event={} target={} attempt={} message={}",
                        LogEvent.UPSTREAM_RETRY,
                        descriptor.name(),
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() == null ? null : event.getLastThrowable().getMessage()
                )
        );

        return retry;
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
