package com.opsbuddy.incident;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("IncidentIdGenerator")
class IncidentIdGeneratorTest {

    private static final Instant AT = Instant.parse("2024-05-01T10:15:30.123456Z");

    @Test
    @DisplayName("같은 입력은 항상 같은 16자리 hex id")
    void deterministicHexId() {
        String first = IncidentIdGenerator.generate("file-service", "ERROR", AT, "disk full");
        String second = IncidentIdGenerator.generate("file-service", "ERROR", AT, "disk full");

        assertThat(first).isEqualTo(second).hasSize(16).matches("[0-9a-f]{16}");
    }

    @Test
    @DisplayName("초 미만 차이와 메시지 50자 이후 차이는 id에 영향 없음")
    void ignoresSubSecondAndMessageTail() {
        String base = "x".repeat(50);

        assertThat(IncidentIdGenerator.generate("svc", "ERROR", AT, base + "tail-a"))
                .isEqualTo(IncidentIdGenerator.generate("svc", "ERROR", AT.plusMillis(500), base + "tail-b"));
    }

    @Test
    @DisplayName("서비스 / 레벨 / 초 단위 시각 / 메시지 앞부분이 다르면 다른 id")
    void differsOnKeyFields() {
        String id = IncidentIdGenerator.generate("svc", "ERROR", AT, "boom");

        assertThat(IncidentIdGenerator.generate("other", "ERROR", AT, "boom")).isNotEqualTo(id);
        assertThat(IncidentIdGenerator.generate("svc", "CRITICAL", AT, "boom")).isNotEqualTo(id);
        assertThat(IncidentIdGenerator.generate("svc", "ERROR", AT.plusSeconds(1), "boom")).isNotEqualTo(id);
        assertThat(IncidentIdGenerator.generate("svc", "ERROR", AT, "bang")).isNotEqualTo(id);
    }

    @Test
    @DisplayName("레벨 대소문자는 구분하지 않음")
    void levelIsCaseInsensitive() {
        assertThat(IncidentIdGenerator.generate("svc", "error", AT, "boom"))
                .isEqualTo(IncidentIdGenerator.generate("svc", "ERROR", AT, "boom"));
    }
}
