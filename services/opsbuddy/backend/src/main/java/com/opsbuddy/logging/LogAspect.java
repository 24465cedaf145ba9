package com.opsbuddy.logging;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.event.Level;
import org.springframework.stereotype.Component;

@Aspect
@Component
@Slf4j
public class LogAspect {

    /**
     * 헬스 모니터 / 장애 탐지 주기 작업에만 적용
     * - 요청 스레드가 아니므로 사이클마다 trace_id를 새로 부여
     */
    @Around(
            "execution(* com.opsbuddy.monitor.HealthMonitor.runCycle(..)) || " +
                    "execution(* com.opsbuddy.incident.IncidentDetector.runCycle(..))"
    )
    public Object logCycle(ProceedingJoinPoint joinPoint) throws Throwable {

        long start = System.currentTimeMillis();
        String component = joinPoint.getSignature().getDeclaringType().getSimpleName();

        // HTTP 요청(/check)에서 호출된 경우 기존 trace_id 유지
        boolean ownsTraceId = TraceContext.current() == null;
        TraceContext.getOrCreate();

        log.debug("event={} component={}", LogEvent.CYCLE_START, component);

        try {
            Object result = joinPoint.proceed();

            long duration = System.currentTimeMillis() - start;

            log.debug("event={} component={} durationMs={}", LogEvent.CYCLE_END, component, duration);

            return result;

        } catch (Exception e) {
            long duration = System.currentTimeMillis() - start;

            // 예외 유형에 따라 로그 레벨 결정
            Level level = LogLevelPolicy.decideByException(e);

            if (level == Level.WARN) {
                log.warn(
                        "event={} component={} durationMs={} message={}",
                        LogEvent.CYCLE_FAIL,
                        component,
                        duration,
                        e.getMessage()
                );

            } else {
                log.error(
                        "event={} component={} durationMs={} message={}",
                        LogEvent.CYCLE_ERROR,
                        component,
                        duration,
                        e.getMessage(),
                        e
                );

            }
            throw e;
        } finally {
            if (ownsTraceId) {
                TraceContext.clear();
            }
        }
    }
}
