package com.opsbuddy.monitor;

import com.opsbuddy.domain.HealthStatus;
import com.opsbuddy.support.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HealthResponseParser")
class HealthResponseParserTest {

    private final HealthResponseParser parser = new HealthResponseParser(TestFixtures.objectMapper());

    @ParameterizedTest(name = "{0} → {1} ({2})")
    @CsvSource(delimiter = '|', value = {
            "{\"status\":\"degraded\"}                         | DEGRADED  | TOP_LEVEL",
            "{\"status\":\"UNHEALTHY\"}                        | UNHEALTHY | TOP_LEVEL",
            "{\"service\":{\"status\":\"degraded\"}}           | DEGRADED  | NESTED_SERVICE",
            "{\"data\":{\"status\":\"unhealthy\"}}             | UNHEALTHY | DATA_ENVELOPE",
            "{\"status\":\"unknown\"}                          | UNKNOWN   | TOP_LEVEL",
            "{\"service\":{\"status\":\"Unknown\"}}            | UNKNOWN   | NESTED_SERVICE",
            "{\"status\":\"ok\",\"data\":{\"status\":\"degraded\"}} | DEGRADED | DATA_ENVELOPE",
            "{\"uptime\":12}                                   | HEALTHY   | DEFAULT",
            "{\"status\":\"starting\"}                         | HEALTHY   | DEFAULT",
            "not json                                          | HEALTHY   | DEFAULT"
    })
    void readsStatusInPriorityOrder(String body, HealthStatus expected, ParsedHealth.Source source) {
        ParsedHealth parsed = parser.parse(body);

        assertThat(parsed.status()).isEqualTo(expected);
        assertThat(parsed.source()).isEqualTo(source);
    }

    @Test
    @DisplayName("빈 본문은 HEALTHY, payload 없음")
    void emptyBodyIsHealthy() {
        ParsedHealth parsed = parser.parse("");

        assertThat(parsed.status()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(parsed.payload()).isNull();
    }

    @Test
    @DisplayName("JSON 본문은 payload로 보존")
    @SuppressWarnings("unchecked")
    void keepsJsonPayload() {
        ParsedHealth parsed = parser.parse("{\"status\":\"healthy\",\"version\":\"1.2\"}");

        assertThat((Map<String, Object>) parsed.payload()).containsEntry("version", "1.2");
    }
}
