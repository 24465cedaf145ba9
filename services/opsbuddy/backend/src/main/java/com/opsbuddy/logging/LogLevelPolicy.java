package com.opsbuddy.logging;

import com.opsbuddy.exception.ApiException;
import com.opsbuddy.exception.BrokerException;
import com.opsbuddy.exception.CircuitOpenException;
import com.opsbuddy.exception.TransportException;
import com.opsbuddy.exception.UpstreamException;
import org.slf4j.event.Level;
import org.springframework.dao.DataAccessException;

/**
 * 로그 레벨 판단 정책
 */
public final class LogLevelPolicy {

    private LogLevelPolicy() {
    }

    /**
     * 예외 기반 로그 레벨 결정
     * - 외부 의존성 장애(업스트림 / 브로커 / 스토어)는 다음 호출에서 회복 가능 → WARN
     * - 그 외 (코드 결함 추정) → ERROR
     */
    public static Level decideByException(Throwable t) {

        if (t == null) {
            return Level.INFO;
        }

        // CircuitBreaker OPEN
        if (t instanceof CircuitOpenException) {
            return Level.WARN;
        }

        // 업스트림 timeout / 연결 실패 / 5xx
        if (t instanceof TransportException || t instanceof UpstreamException) {
            return Level.WARN;
        }

        // Pub/Sub 브로커
        if (t instanceof BrokerException) {
            return Level.WARN;
        }

        // 로그 스토어 (DB / SQL)
        if (t instanceof DataAccessException) {
            return Level.WARN;
        }

        // 4xx 성격의 비즈니스 예외
        if (t instanceof ApiException api && api.getStatus().is4xxClientError()) {
            return Level.WARN;
        }

        return Level.ERROR;
    }
}
