package com.opsbuddy.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 코드 + HTTP 상태를 함께 갖는 애플리케이션 예외
 * - GlobalExceptionHandler에서 DefaultResponse.failure로 변환
 */
@Getter
public class ApiException extends RuntimeException {

    private final String code;
    private final HttpStatus status;

    public ApiException(String code, String message, HttpStatus status) {
        super(message);
        this.code = code;
        this.status = status;
    }

    public ApiException(String code, String message, HttpStatus status, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.status = status;
    }
}
