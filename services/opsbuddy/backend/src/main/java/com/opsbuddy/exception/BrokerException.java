package com.opsbuddy.exception;

import org.springframework.http.HttpStatus;

/**
 * Pub/Sub 브로커 publish / subscribe 실패
 * - 발행은 부수 효과이므로 호출 측에서 로그 후 무시
 */
public class BrokerException extends ApiException {

    public BrokerException(String message, Throwable cause) {
        super("BROKER_ERROR", message, HttpStatus.SERVICE_UNAVAILABLE, cause);
    }
}
