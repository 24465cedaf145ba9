package com.opsbuddy.logging;

public final class LogEvent {

    private LogEvent() {
        // 인스턴스 생성 방지
    }

    /** 게이트웨이 요청 전달 완료 (업스트림 응답 < 500) */
    public static final String GATEWAY_FORWARDED = "GATEWAY_FORWARDED";

    /** 게이트웨이 요청 실패 (라우트 없음 / 차단 / 업스트림 장애) */
    public static final String GATEWAY_FAILED = "GATEWAY_FAILED";

    /** transport 실패 후 재시도 */
    public static final String UPSTREAM_RETRY = "UPSTREAM_RETRY";

    /** CircuitBreaker가 OPEN 상태라 업스트림 호출 없이 차단 */
    public static final String CIRCUIT_OPEN = "CIRCUIT_OPEN";

    /** 주기 작업 시작 */
    public static final String CYCLE_START = "CYCLE_START";

    /** 주기 작업 정상 종료 */
    public static final String CYCLE_END = "CYCLE_END";

    /** 주기 작업 중 비치명적 실패 (다음 주기에 재시도) */
    public static final String CYCLE_FAIL = "CYCLE_FAIL";

    /** 주기 작업 중 치명적 실패 */
    public static final String CYCLE_ERROR = "CYCLE_ERROR";

    /** 서비스 헬스 상태 변경 */
    public static final String HEALTH_STATUS_CHANGED = "HEALTH_STATUS_CHANGED";

    /** 개별 서비스 프로브 실패 */
    public static final String HEALTH_PROBE_FAILED = "HEALTH_PROBE_FAILED";

    /** 장애 탐지 (incident 발행) */
    public static final String INCIDENT_DETECTED = "INCIDENT_DETECTED";

    /** 로그 스토어 조회 실패 (checkpoint 유지) */
    public static final String LOG_QUERY_FAILED = "LOG_QUERY_FAILED";

    /** 사이클 페이지 상한 도달, 남은 row는 다음 사이클에 커서부터 조회 */
    public static final String DETECTION_BACKLOG = "DETECTION_BACKLOG";

    /** 탐지 일시정지 상태라 사이클 건너뜀 */
    public static final String DETECTION_PAUSED = "DETECTION_PAUSED";

    /** Pub/Sub 발행 실패 (메시지 유실) */
    public static final String PUBLISH_FAILED = "PUBLISH_FAILED";

    /** 브로커 구독 메시지 처리 실패 */
    public static final String SUBSCRIBER_FAILED = "SUBSCRIBER_FAILED";

    /** 실시간 클라이언트 연결 / 해제 */
    public static final String CLIENT_CONNECTED = "CLIENT_CONNECTED";
    public static final String CLIENT_DISCONNECTED = "CLIENT_DISCONNECTED";

    /** 전송 실패 누적 또는 버퍼 초과로 클라이언트 제거 */
    public static final String CLIENT_PRUNED = "CLIENT_PRUNED";

    /** 최대 연결 수 초과로 신규 연결 거부 */
    public static final String CLIENT_REJECTED = "CLIENT_REJECTED";

    /** 비즈니스 예외(ApiException) 발생 */
    public static final String BUSINESS_EXCEPTION = "BUSINESS_EXCEPTION";

    /** 예상하지 못한 시스템 예외 */
    public static final String UNHANDLED_EXCEPTION = "UNHANDLED_EXCEPTION";

    /** Rate Limit에 의해 요청이 차단됨 */
    public static final String RATE_LIMIT_REJECTED = "RATE_LIMIT_REJECTED";

    /** 런타임 기능 토글 */
    public static final String FEATURE_TOGGLED = "FEATURE_TOGGLED";

}
