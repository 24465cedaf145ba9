package com.opsbuddy.breaker;

import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@DisplayName("ServiceCircuitBreaker")
class ServiceCircuitBreakerTest {

    private CircuitBreakerRegistry registry;

    @BeforeEach
    void setUp() {
        registry = CircuitBreakerRegistry.ofDefaults();
    }

    @Test
    @DisplayName("연속 실패가 임계치에 도달하면 OPEN")
    void opensAfterThresholdConsecutiveFailures() {
        ServiceCircuitBreaker breaker = ServiceCircuitBreaker.create(registry, "svc", 3, Duration.ofSeconds(60));

        for (int i = 0; i < 2; i++) {
            assertThat(breaker.canExecute()).isTrue();
            breaker.onFailure();
        }
        assertThat(breaker.getState()).isEqualTo(BreakerState.CLOSED);

        assertThat(breaker.canExecute()).isTrue();
        breaker.onFailure();

        assertThat(breaker.getState()).isEqualTo(BreakerState.OPEN);
        assertThat(breaker.canExecute()).isFalse();
        assertThat(breaker.snapshot().failureCount()).isEqualTo(3);
        assertThat(breaker.snapshot().lastFailureTime()).isNotNull();
    }

    @Test
    @DisplayName("중간 성공은 연속 실패 횟수를 초기화")
    void successResetsFailureCount() {
        ServiceCircuitBreaker breaker = ServiceCircuitBreaker.create(registry, "svc", 3, Duration.ofSeconds(60));

        breaker.canExecute();
        breaker.onFailure();
        breaker.canExecute();
        breaker.onFailure();
        breaker.canExecute();
        breaker.onSuccess();
        breaker.canExecute();
        breaker.onFailure();
        breaker.canExecute();
        breaker.onFailure();

        assertThat(breaker.getState()).isEqualTo(BreakerState.CLOSED);
        assertThat(breaker.getFailureCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("cooldown 경과 후 시험 호출 성공 시 CLOSED 복귀")
    void halfOpenTrialSuccessCloses() {
        ServiceCircuitBreaker breaker = ServiceCircuitBreaker.create(registry, "svc", 1, Duration.ofMillis(100));

        breaker.canExecute();
        breaker.onFailure();
        assertThat(breaker.canExecute()).isFalse();

        await().atMost(2, TimeUnit.SECONDS).until(breaker::canExecute);
        assertThat(breaker.getState()).isEqualTo(BreakerState.HALF_OPEN);

        breaker.onSuccess();

        assertThat(breaker.getState()).isEqualTo(BreakerState.CLOSED);
        assertThat(breaker.snapshot().failureCount()).isZero();
        assertThat(breaker.snapshot().lastFailureTime()).isNull();
    }

    @Test
    @DisplayName("시험 호출 실패 시 다시 OPEN")
    void halfOpenTrialFailureReopens() {
        ServiceCircuitBreaker breaker = ServiceCircuitBreaker.create(registry, "svc", 2, Duration.ofMillis(100));

        breaker.canExecute();
        breaker.onFailure();
        breaker.canExecute();
        breaker.onFailure();

        await().atMost(2, TimeUnit.SECONDS).until(breaker::canExecute);
        breaker.onFailure();

        assertThat(breaker.getState()).isEqualTo(BreakerState.OPEN);
        assertThat(breaker.canExecute()).isFalse();
    }

    @Test
    @DisplayName("HALF_OPEN 전환 시 동시 호출자 중 1건만 통과")
    void onlyOneConcurrentTrialPasses() throws Exception {
        ServiceCircuitBreaker breaker = ServiceCircuitBreaker.create(registry, "svc", 1, Duration.ofMillis(200));

        breaker.canExecute();
        breaker.onFailure();
        Thread.sleep(300);

        int callers = 16;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();

        try {
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return breaker.canExecute();
                }));
            }
            start.countDown();

            int permitted = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    permitted++;
                }
            }
            assertThat(permitted).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("snapshot은 임계치와 cooldown을 함께 노출")
    void snapshotExposesConfiguration() {
        ServiceCircuitBreaker breaker = ServiceCircuitBreaker.create(registry, "svc", 5, Duration.ofSeconds(60));

        BreakerSnapshot snapshot = breaker.snapshot();

        assertThat(snapshot.state()).isEqualTo(BreakerState.CLOSED);
        assertThat(snapshot.threshold()).isEqualTo(5);
        assertThat(snapshot.cooldownSeconds()).isEqualTo(60);
        assertThat(snapshot.failureCount()).isZero();
    }
}
