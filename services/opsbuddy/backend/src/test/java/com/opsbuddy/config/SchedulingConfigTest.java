package com.opsbuddy.config;

import com.opsbuddy.logging.TraceContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SchedulingConfig")
class SchedulingConfigTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("worker 작업은 호출 스레드의 trace_id를 이어받고 종료 후 정리")
    void propagatesCallerTraceId() throws Exception {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            MDC.put(TraceContext.TRACE_ID_KEY, "req-1");
            CompletableFuture<String> seen = new CompletableFuture<>();
            pool.execute(SchedulingConfig.withCallerMdc(() -> seen.complete(TraceContext.current())));

            assertThat(seen.get(2, TimeUnit.SECONDS)).isEqualTo("req-1");

            CompletableFuture<String> after = new CompletableFuture<>();
            pool.execute(() -> after.complete(String.valueOf(TraceContext.current())));
            assertThat(after.get(2, TimeUnit.SECONDS)).isEqualTo("null");
        } finally {
            pool.shutdownNow();
        }
    }
}
