package com.opsbuddy.observability;

import java.time.Instant;

/**
 * 게이트웨이 요청 관측 이벤트 모델
 *
 * @param target 라우팅된 서비스 이름 (라우트 매칭 전 차단 시 null)
 * @param event  결과 구분 (GATEWAY_FORWARDED, CIRCUIT_OPEN, UPSTREAM_TIMEOUT ...)
 */
public record RequestEvent(
        Instant timestamp,
        String traceId,
        String ip,
        String method,
        String path,
        String target,
        int status,
        String event,
        long durationMs
) {}
