package com.opsbuddy.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 업스트림이 5xx로 응답한 경우
 */
@Getter
public class UpstreamException extends ApiException {

    private final String service;
    private final int upstreamStatus;

    public UpstreamException(String service, int upstreamStatus) {
        super(
                "UPSTREAM_ERROR",
                "Service " + service + " responded with HTTP " + upstreamStatus,
                HttpStatus.BAD_GATEWAY
        );
        this.service = service;
        this.upstreamStatus = upstreamStatus;
    }
}
