package com.opsbuddy.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * CircuitBreaker가 호출을 허용하지 않음 (업스트림 호출 없이 503)
 */
@Getter
public class CircuitOpenException extends ApiException {

    private final String service;

    public CircuitOpenException(String service) {
        super(
                "CIRCUIT_OPEN",
                "Service " + service + " is temporarily unavailable",
                HttpStatus.SERVICE_UNAVAILABLE
        );
        this.service = service;
    }
}
