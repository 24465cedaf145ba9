package com.opsbuddy.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JpaConfig")
class JpaConfigTest {

    @Test
    @DisplayName("detector.query-timeout을 JPA 쿼리 타임아웃 힌트(ms)로 등록")
    void registersQueryTimeoutHint() {
        OpsProperties properties = new OpsProperties();
        properties.getDetector().setQueryTimeout(Duration.ofSeconds(3));
        Map<String, Object> hibernateProperties = new HashMap<>();

        new JpaConfig().queryTimeoutCustomizer(properties).customize(hibernateProperties);

        assertThat(hibernateProperties).containsEntry("jakarta.persistence.query.timeout", 3000L);
    }

    @Test
    @DisplayName("기본 타임아웃 10초")
    void defaultsToTenSeconds() {
        Map<String, Object> hibernateProperties = new HashMap<>();

        new JpaConfig().queryTimeoutCustomizer(new OpsProperties()).customize(hibernateProperties);

        assertThat(hibernateProperties).containsEntry(JpaConfig.QUERY_TIMEOUT_HINT, 10_000L);
    }
}
