package com.opsbuddy.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 업스트림에 도달하지 못한 호출 (timeout / connection refused)
 * - timeout → 504, 그 외 → 502
 */
@Getter
public class TransportException extends ApiException {

    private final String service;
    private final boolean timeout;

    public TransportException(String service, boolean timeout, String message, Throwable cause) {
        super(
                timeout ? "UPSTREAM_TIMEOUT" : "UPSTREAM_UNREACHABLE",
                message,
                timeout ? HttpStatus.GATEWAY_TIMEOUT : HttpStatus.BAD_GATEWAY,
                cause
        );
        this.service = service;
        this.timeout = timeout;
    }
}
