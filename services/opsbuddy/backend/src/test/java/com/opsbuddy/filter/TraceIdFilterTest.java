package com.opsbuddy.filter;

import com.opsbuddy.logging.TraceContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TraceIdFilter")
class TraceIdFilterTest {

    private final TraceIdFilter filter = new TraceIdFilter();

    @Test
    @DisplayName("전달받은 X-Trace-Id 재사용, 응답 헤더에 기록, 종료 후 MDC 정리")
    void reusesIncomingTraceId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/files/1");
        request.addHeader(TraceContext.TRACE_ID_HEADER, "abc123");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(request, response, (req, res) -> seen.set(TraceContext.current()));

        assertThat(seen.get()).isEqualTo("abc123");
        assertThat(response.getHeader(TraceContext.TRACE_ID_HEADER)).isEqualTo("abc123");
        assertThat(MDC.get(TraceContext.TRACE_ID_KEY)).isNull();
    }

    @Test
    @DisplayName("헤더가 없으면 32자리 trace_id 생성")
    void generatesTraceId() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest("GET", "/"), response, (req, res) -> { });

        assertThat(response.getHeader(TraceContext.TRACE_ID_HEADER)).hasSize(32);
    }

    @Test
    @DisplayName("허용되지 않는 문자 / 너무 긴 X-Trace-Id는 새로 생성")
    void replacesUnsafeTraceId() {
        assertThat(TraceIdFilter.accept("abc\nevent=FAKE")).hasSize(32).doesNotContain("FAKE");
        assertThat(TraceIdFilter.accept("x".repeat(65))).hasSize(32);
        assertThat(TraceIdFilter.accept("")).hasSize(32);
        assertThat(TraceIdFilter.accept("req-42_a")).isEqualTo("req-42_a");
    }
}
