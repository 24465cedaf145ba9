package com.opsbuddy.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.opsbuddy.dto.DefaultResponse;
import com.opsbuddy.logging.LogEvent;
import com.opsbuddy.logging.TraceContext;
import com.opsbuddy.observability.RequestEvent;
import com.opsbuddy.observability.RequestEventBuffer;
import com.opsbuddy.state.RuntimeFeatureState;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import io.micrometer.core.instrument.Counter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

/**
 * 게이트웨이 라우팅 요청(/api/...) IP별 Rate Limit
 *
 * - TraceIdFilter 이후 실행 (trace_id 존재 보장)
 * - CircuitBreaker 이전 1차 방어, 차단 시 업스트림 / 브레이커 모두 미관여
 * - RuntimeFeatureState로 런타임 ON/OFF (기본 OFF)
 */
@Slf4j
public class RateLimitFilter extends OncePerRequestFilter {

    private static final String ROUTED_PREFIX = "/api/";

    private final ClientIpResolver clientIpResolver;
    private final RuntimeFeatureState runtimeFeatureState;
    private final RequestEventBuffer requestEventBuffer;
    private final ObjectMapper objectMapper;
    private final Counter blockedCounter;
    private final Counter allowedCounter;
    private final Bandwidth limit;

    // 10분 미사용 IP는 제거, 최대 10,000 IP
    private final Cache<String, Bucket> buckets = Caffeine.newBuilder()
            .expireAfterAccess(Duration.ofMinutes(10))
            .maximumSize(10_000)
            .build();

    public RateLimitFilter(ClientIpResolver clientIpResolver,
                           RuntimeFeatureState runtimeFeatureState,
                           RequestEventBuffer requestEventBuffer,
                           ObjectMapper objectMapper,
                           Counter blockedCounter,
                           Counter allowedCounter,
                           int capacity,
                           int refillPerSecond) {
        this.clientIpResolver = clientIpResolver;
        this.runtimeFeatureState = runtimeFeatureState;
        this.requestEventBuffer = requestEventBuffer;
        this.objectMapper = objectMapper;
        this.blockedCounter = blockedCounter;
        this.allowedCounter = allowedCounter;
        // burst = capacity, 1초마다 refillPerSecond 토큰 보충
        this.limit = Bandwidth.classic(capacity, Refill.intervally(refillPerSecond, Duration.ofSeconds(1)));
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !runtimeFeatureState.isRateLimitEnabled()
                || !request.getRequestURI().startsWith(ROUTED_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        String clientIp = clientIpResolver.resolve(request);
        Bucket bucket = buckets.get(clientIp, ip -> Bucket.builder().addLimit(limit).build());

        if (bucket.tryConsume(1)) {
            // 통과한 요청의 이벤트는 RequestRouter가 기록
            allowedCounter.increment();
            filterChain.doFilter(request, response);
            return;
        }

        reject(request, response, clientIp);
    }

    private void reject(HttpServletRequest request, HttpServletResponse response, String clientIp) throws IOException {
        blockedCounter.increment();

        String traceId = TraceContext.current();
        int status = HttpStatus.TOO_MANY_REQUESTS.value();

        log.warn(
                "event={} traceId={} ip={} method={} uri={}",
                LogEvent.RATE_LIMIT_REJECTED,
                traceId,
                clientIp,
                request.getMethod(),
                request.getRequestURI()
        );

        response.setStatus(status);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(
                response.getOutputStream(),
                DefaultResponse.failure(status, "RATE_LIMIT_EXCEEDED", "Too many requests")
        );

        requestEventBuffer.add(new RequestEvent(
                Instant.now(),
                traceId,
                clientIp,
                request.getMethod(),
                request.getRequestURI(),
                null,
                status,
                LogEvent.RATE_LIMIT_REJECTED,
                0L
        ));
    }
}
