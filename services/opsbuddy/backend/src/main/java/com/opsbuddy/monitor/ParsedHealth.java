package com.opsbuddy.monitor;

import com.opsbuddy.domain.HealthStatus;

/**
 * 헬스 응답 본문 해석 결과
 *
 * @param status  서비스가 보고한 상태 ("unknown" 보고 시 UNKNOWN, 본문으로 판단 불가 시 HEALTHY)
 * @param source  status를 어디서 읽었는지
 * @param payload 파싱된 응답 본문 (JSON이 아니면 null)
 */
public record ParsedHealth(HealthStatus status, Source source, Object payload) {

    public enum Source {
        /** { "status": "degraded" } */
        TOP_LEVEL,
        /** { "service": { "status": "degraded" } } */
        NESTED_SERVICE,
        /** { "data": { "status": "degraded" } } (DefaultResponse 형태) */
        DATA_ENVELOPE,
        /** status 필드 없음 / 인식하지 못한 값 / JSON 아님 */
        DEFAULT
    }

    public static ParsedHealth fallback(Object payload) {
        return new ParsedHealth(HealthStatus.HEALTHY, Source.DEFAULT, payload);
    }
}
