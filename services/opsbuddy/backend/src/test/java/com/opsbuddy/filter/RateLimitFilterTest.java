package com.opsbuddy.filter;

import com.fasterxml.jackson.databind.JsonNode;
import com.opsbuddy.observability.RequestEvent;
import com.opsbuddy.observability.RequestEventBuffer;
import com.opsbuddy.state.RuntimeFeatureState;
import com.opsbuddy.support.TestFixtures;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RateLimitFilter")
class RateLimitFilterTest {

    private RuntimeFeatureState featureState;
    private RequestEventBuffer buffer;
    private Counter blocked;
    private Counter allowed;
    private RateLimitFilter filter;

    @BeforeEach
    void setUp() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        featureState = new RuntimeFeatureState(true, true);
        buffer = new RequestEventBuffer();
        blocked = Counter.builder("rate_limit_blocked_total").register(registry);
        allowed = Counter.builder("rate_limit_allowed_total").register(registry);

        // burst 2, 초당 1 토큰
        filter = new RateLimitFilter(new ClientIpResolver(), featureState, buffer, TestFixtures.objectMapper(),
                blocked, allowed, 2, 1);
    }

    private MockHttpServletResponse call(String uri, String ip) throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", uri);
        request.setRemoteAddr(ip);
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(request, response, new MockFilterChain());
        return response;
    }

    @Test
    @DisplayName("burst 초과 시 429 envelope, IP별로 독립")
    void blocksBeyondBurstPerIp() throws Exception {
        assertThat(call("/api/files/1", "10.0.0.1").getStatus()).isEqualTo(200);
        assertThat(call("/api/files/1", "10.0.0.1").getStatus()).isEqualTo(200);

        MockHttpServletResponse rejected = call("/api/files/1", "10.0.0.1");

        assertThat(rejected.getStatus()).isEqualTo(429);
        JsonNode body = TestFixtures.objectMapper().readTree(rejected.getContentAsString());
        assertThat(body.path("httpCode").asInt()).isEqualTo(429);
        assertThat(body.path("error").path("code").asText()).isEqualTo("RATE_LIMIT_EXCEEDED");
        assertThat(call("/api/files/1", "10.0.0.2").getStatus()).isEqualTo(200);

        assertThat(blocked.count()).isEqualTo(1.0);
        assertThat(allowed.count()).isEqualTo(3.0);
        assertThat(buffer.getRecent(10))
                .extracting(RequestEvent::status)
                .containsExactly(429);
    }

    @Test
    @DisplayName("X-Forwarded-For 첫 항목을 클라이언트 키로 사용")
    void keysByForwardedClient() throws Exception {
        for (int i = 0; i < 2; i++) {
            MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/utils/x");
            request.addHeader("X-Forwarded-For", "198.51.100.7, 10.0.0.9");
            filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());
        }

        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/utils/x");
        request.addHeader("X-Forwarded-For", "198.51.100.7");
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(request, response, new MockFilterChain());

        assertThat(response.getStatus()).isEqualTo(429);
        assertThat(buffer.getRecent(1).get(0).ip()).isEqualTo("198.51.100.7");
    }

    @Test
    @DisplayName("비활성화 상태 / 라우팅 대상 외 경로는 통과")
    void passesWhenDisabledOrNotRouted() throws Exception {
        for (int i = 0; i < 5; i++) {
            assertThat(call("/status", "10.0.0.1").getStatus()).isEqualTo(200);
        }

        featureState.toggleRateLimit();
        for (int i = 0; i < 5; i++) {
            assertThat(call("/api/files/1", "10.0.0.1").getStatus()).isEqualTo(200);
        }

        assertThat(blocked.count()).isZero();
    }
}
