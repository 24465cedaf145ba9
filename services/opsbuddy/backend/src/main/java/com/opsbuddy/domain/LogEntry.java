package com.opsbuddy.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * 로그 스토어 row (서비스들이 적재한 구조화 로그)
 * - 이 서비스는 조회만 수행
 */
@Entity
@Table(
        name = "service_logs",
        indexes = {
                @Index(name = "idx_service_logs_logged_at", columnList = "logged_at"),
                @Index(name = "idx_service_logs_service_level", columnList = "service, level")
        }
)
@Getter
@NoArgsConstructor
public class LogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * 로그 발생 시각 (UTC)
     */
    @Column(name = "logged_at", nullable = false)
    private Instant loggedAt;

    @Column(nullable = false, length = 64)
    private String service;

    /**
     * DEBUG / INFO / WARNING / ERROR / CRITICAL / FATAL
     */
    @Column(nullable = false, length = 16)
    private String level;

    @Column(length = 128)
    private String logger;

    @Column(length = 128)
    private String operation;

    @Column(length = 128)
    private String host;

    @Column(nullable = false, columnDefinition = "text")
    private String message;

    /**
     * 로그에 첨부된 부가 데이터 (JSON object)
     */
    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "text")
    private Map<String, Object> data = new HashMap<>();

    public LogEntry(Instant loggedAt,
                    String service,
                    String level,
                    String logger,
                    String operation,
                    String host,
                    String message,
                    Map<String, Object> data) {
        this.loggedAt = loggedAt;
        this.service = service;
        this.level = level;
        this.logger = logger;
        this.operation = operation;
        this.host = host;
        this.message = message;
        this.data = data == null ? new HashMap<>() : new HashMap<>(data);
    }
}
