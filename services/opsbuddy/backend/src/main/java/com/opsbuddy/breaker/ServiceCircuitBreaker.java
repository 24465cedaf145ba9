package com.opsbuddy.breaker;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 서비스 단위 CircuitBreaker
 *
 * - 상태 전이는 Resilience4j 상태 머신에 위임
 *   (COUNT_BASED window = threshold, failure rate 100% → 연속 threshold회 실패 시 OPEN)
 * - HALF_OPEN 허용 호출 수 1 → OPEN→HALF_OPEN 전환 시 동시 호출자 중 단 1건만 통과
 * - 연속 실패 횟수 / 마지막 실패 시각은 /status 노출용으로 별도 추적
 */
@Slf4j
public class ServiceCircuitBreaker {

    // 느린 호출은 상태 판단에 쓰지 않음 (timeout은 transport 실패로 집계)
    private static final Duration SLOW_CALL_DISABLED = Duration.ofDays(1);

    private final CircuitBreaker delegate;
    private final int threshold;
    private final Duration cooldown;

    private final AtomicInteger failureCount = new AtomicInteger();
    private final AtomicReference<Instant> lastFailureTime = new AtomicReference<>();

    ServiceCircuitBreaker(CircuitBreaker delegate, int threshold, Duration cooldown) {
        this.delegate = delegate;
        this.threshold = threshold;
        this.cooldown = cooldown;
    }

    public static ServiceCircuitBreaker create(CircuitBreakerRegistry registry,
                                               String name,
                                               int threshold,
                                               Duration cooldown) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(threshold)
                .minimumNumberOfCalls(threshold)
                .failureRateThreshold(100f)
                .slowCallDurationThreshold(SLOW_CALL_DISABLED)
                .slowCallRateThreshold(100f)
                .waitDurationInOpenState(cooldown)
                .permittedNumberOfCallsInHalfOpenState(1)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .build();

        CircuitBreaker circuitBreaker = registry.circuitBreaker(name, config);

        circuitBreaker.getEventPublisher().onStateTransition(event ->
                log.warn(
                        "event=CIRCUIT_STATE_CHANGED circuit={} transition={}",
                        name,
                        event.getStateTransition()
                )
        );

        return new ServiceCircuitBreaker(circuitBreaker, threshold, cooldown);
    }

    /**
     * 호출 허용 여부
     * - OPEN: cooldown 경과 시 HALF_OPEN 전환 후 시험 호출 1건만 true
     * - true를 받은 호출자는 반드시 onSuccess / onFailure 중 하나를 호출해야 함
     */
    public boolean canExecute() {
        return delegate.tryAcquirePermission();
    }

    public void onSuccess() {
        onSuccess(Duration.ZERO);
    }

    public void onSuccess(Duration elapsed) {
        delegate.onSuccess(elapsed.toNanos(), TimeUnit.NANOSECONDS);

        failureCount.set(0);
        lastFailureTime.set(null);

        // OPEN 이전에 허용됐던 호출의 성공도 CLOSED로 복귀
        if (delegate.getState() != CircuitBreaker.State.CLOSED) {
            delegate.transitionToClosedState();
        }
    }

    public void onFailure() {
        onFailure(Duration.ZERO, new IllegalStateException("upstream call failed"));
    }

    public void onFailure(Duration elapsed, Throwable cause) {
        failureCount.incrementAndGet();
        lastFailureTime.set(Instant.now());

        delegate.onError(elapsed.toNanos(), TimeUnit.NANOSECONDS, cause);
    }

    public BreakerState getState() {
        return switch (delegate.getState()) {
            case OPEN, FORCED_OPEN -> BreakerState.OPEN;
            case HALF_OPEN -> BreakerState.HALF_OPEN;
            default -> BreakerState.CLOSED;
        };
    }

    public int getFailureCount() {
        return failureCount.get();
    }

    public String getName() {
        return delegate.getName();
    }

    public BreakerSnapshot snapshot() {
        return new BreakerSnapshot(
                getState(),
                failureCount.get(),
                lastFailureTime.get(),
                threshold,
                cooldown.toSeconds()
        );
    }
}
