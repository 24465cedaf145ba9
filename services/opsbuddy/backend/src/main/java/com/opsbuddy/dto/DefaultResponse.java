package com.opsbuddy.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 조회 / 관리 API 공통 응답 {httpCode, data, error}
 * - 게이트웨이 전달 응답(/api/**)과 /health 본문에는 쓰지 않음
 */
@Getter
@AllArgsConstructor
public class DefaultResponse<T> {

    private int httpCode;
    private T data;
    private ErrorResponse error;

    public static <T> DefaultResponse<T> success(int httpCode, T data) {
        return new DefaultResponse<>(httpCode, data, null);
    }

    public static DefaultResponse<Void> failure(int httpCode, String code, String message) {
        return new DefaultResponse<>(
                httpCode,
                null,
                new ErrorResponse(code, message)
        );
    }
}
