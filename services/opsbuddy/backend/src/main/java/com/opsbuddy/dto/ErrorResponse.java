package com.opsbuddy.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 실패 응답의 error 필드
 */
@Getter
@AllArgsConstructor
public class ErrorResponse {

    // CIRCUIT_OPEN, UPSTREAM_TIMEOUT, ROUTE_NOT_FOUND, INVALID_TIME_RANGE ...
    private String code;

    private String message;
}
