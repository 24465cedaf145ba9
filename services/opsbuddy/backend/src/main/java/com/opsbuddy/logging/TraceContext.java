package com.opsbuddy.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * 요청 / 주기 작업 단위 trace_id 관리
 * - HTTP 요청은 TraceIdFilter가, 스케줄 작업은 LogAspect가 MDC에 설정
 */
public final class TraceContext {

    public static final String TRACE_ID_KEY = "trace_id";

    public static final String TRACE_ID_HEADER = "X-Trace-Id";

    private TraceContext() {
    }

    /**
     * 현재 trace_id 조회 (없으면 null)
     */
    public static String current() {
        return MDC.get(TRACE_ID_KEY);
    }

    /**
     * trace_id 조회 (없으면 생성 후 MDC 저장)
     */
    public static String getOrCreate() {
        String traceId = MDC.get(TRACE_ID_KEY);

        if (traceId == null) {
            traceId = generate();
            MDC.put(TRACE_ID_KEY, traceId);
        }

        return traceId;
    }

    public static void clear() {
        MDC.remove(TRACE_ID_KEY);
    }

    public static String generate() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
