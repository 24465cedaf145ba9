package com.opsbuddy.config;

import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.Map;

/**
 * 주기 작업 / 백그라운드 실행기 구성
 *
 * - taskScheduler       : HealthMonitor / IncidentDetector 주기 실행 (서로 독립, 최소 2 thread)
 * - probeExecutor       : 헬스 프로브 동시 실행
 * - broadcastExecutor   : 실시간 클라이언트 전송 (클라이언트별 독립)
 * - workerExecutor      : 수동 탐지 사이클 (/check)
 *
 * 종료 시 대기 시간을 제한해 진행 중인 호출 때문에 shutdown이 묶이지 않게 함
 */
@Configuration
public class SchedulingConfig {

    private static final int AWAIT_TERMINATION_SECONDS = 10;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("ops-scheduler-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(AWAIT_TERMINATION_SECONDS);
        return scheduler;
    }

    @Bean
    public ThreadPoolTaskExecutor probeExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(8);
        executor.setThreadNamePrefix("health-probe-");
        executor.setAwaitTerminationSeconds(AWAIT_TERMINATION_SECONDS);
        return executor;
    }

    @Bean
    public ThreadPoolTaskExecutor broadcastExecutor(OpsProperties properties) {
        int poolSize = properties.getBroadcast().getSenderPoolSize();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setThreadNamePrefix("broadcast-");
        // 전송 중인 프레임은 버림 (종료 시 클라이언트 연결도 함께 끊김)
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    @Bean
    public ThreadPoolTaskExecutor workerExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(10);
        executor.setThreadNamePrefix("ops-worker-");
        executor.setTaskDecorator(SchedulingConfig::withCallerMdc);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(AWAIT_TERMINATION_SECONDS);
        return executor;
    }

    // 요청 스레드의 trace_id를 worker로 전달
    static Runnable withCallerMdc(Runnable task) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            if (context != null) {
                MDC.setContextMap(context);
            }
            try {
                task.run();
            } finally {
                MDC.clear();
            }
        };
    }

    /**
     * 주기 실행 활성화 (테스트 등에서 opsbuddy.scheduling.enabled=false 로 끔)
     */
    @Configuration
    @EnableScheduling
    @ConditionalOnProperty(prefix = "opsbuddy.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class EnabledScheduling {
    }
}
