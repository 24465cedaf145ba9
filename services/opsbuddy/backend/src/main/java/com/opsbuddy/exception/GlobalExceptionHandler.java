package com.opsbuddy.exception;

import com.opsbuddy.dto.DefaultResponse;
import com.opsbuddy.logging.LogEvent;
import com.opsbuddy.logging.LogLevelPolicy;
import com.opsbuddy.logging.TraceContext;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.event.Level;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice(basePackages = "com.opsbuddy.controller")
public class GlobalExceptionHandler {

    /**
     * 애플리케이션 예외 처리
     * - 게이트웨이 실패(CIRCUIT_OPEN, UPSTREAM_*)와 조회 실패가 모두 여기로 수렴
     * - 요청 이벤트 기록은 RequestRouter가 이미 수행
     * - 로그 레벨은 LogLevelPolicy 기준 (외부 의존성 장애 / 4xx → WARN)
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<DefaultResponse<Void>> handleApiException(ApiException e,
                                                                    HttpServletRequest request) {

        Level level = LogLevelPolicy.decideByException(e);

        if (level == Level.ERROR) {
            log.error(
                    "event={} code={} path={} trace_id={}",
                    LogEvent.BUSINESS_EXCEPTION,
                    e.getCode(),
                    request.getRequestURI(),
                    TraceContext.current(),
                    e
            );
        } else {
            log.warn(
                    "event={} code={} path={} message={} trace_id={}",
                    LogEvent.BUSINESS_EXCEPTION,
                    e.getCode(),
                    request.getRequestURI(),
                    e.getMessage(),
                    TraceContext.current()
            );
        }

        return ResponseEntity
                .status(e.getStatus())
                .body(DefaultResponse.failure(
                        e.getStatus().value(),
                        e.getCode(),
                        e.getMessage()
                ));
    }

    /**
     * 쿼리 파라미터 누락 / 타입 불일치 (예: hours=abc)
     */
    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<DefaultResponse<Void>> handleBadParameter(Exception e) {
        log.warn(
                "event={} code=INVALID_PARAMETER message={} trace_id={}",
                LogEvent.BUSINESS_EXCEPTION,
                e.getMessage(),
                TraceContext.current()
        );

        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(DefaultResponse.failure(
                        HttpStatus.BAD_REQUEST.value(),
                        "INVALID_PARAMETER",
                        e.getMessage()
                ));
    }

    /**
     * 예상하지 못한 예외 처리
     * - 반드시 로그를 남겨 "로그 없는 장애"를 방지
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<DefaultResponse<Void>> handleException(Exception e) {
        log.error(
                "event={} trace_id={}",
                LogEvent.UNHANDLED_EXCEPTION,
                TraceContext.current(),
                e
        );

        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(DefaultResponse.failure(
                        HttpStatus.INTERNAL_SERVER_ERROR.value(),
                        "INTERNAL_SERVER_ERROR",
                        "서버 내부 오류가 발생했습니다"
                ));
    }
}
