package com.opsbuddy.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.orm.jpa.HibernatePropertiesCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 로그 스토어 쿼리 타임아웃
 *
 * - Hikari connection-timeout은 커넥션 획득 대기만 제한하므로 statement 단위 타임아웃을 별도로 설정
 * - 초과 시 QueryTimeoutException으로 변환되어 탐지 사이클은 QUERY_FAILED (checkpoint 유지)
 */
@Slf4j
@Configuration
public class JpaConfig {

    static final String QUERY_TIMEOUT_HINT = "jakarta.persistence.query.timeout";

    @Bean
    public HibernatePropertiesCustomizer queryTimeoutCustomizer(OpsProperties properties) {
        long timeoutMillis = properties.getDetector().getQueryTimeout().toMillis();

        log.info("event=JPA_CONFIGURED queryTimeoutMs={}", timeoutMillis);

        return hibernateProperties -> hibernateProperties.put(QUERY_TIMEOUT_HINT, timeoutMillis);
    }
}
