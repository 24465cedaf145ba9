package com.opsbuddy.filter;

import com.opsbuddy.logging.TraceContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.regex.Pattern;

/**
 * HTTP 요청 단위 trace_id 부여
 *
 * - X-Trace-Id가 있으면 재사용 (게이트웨이 앞단에서 이미 부여한 경우)
 * - 로그 / 업스트림 헤더에 그대로 실리므로 짧은 영숫자 토큰만 허용, 그 외는 새로 생성
 */
public class TraceIdFilter extends OncePerRequestFilter {

    private static final Pattern ACCEPTED = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        String traceId = accept(request.getHeader(TraceContext.TRACE_ID_HEADER));

        MDC.put(TraceContext.TRACE_ID_KEY, traceId);
        response.setHeader(TraceContext.TRACE_ID_HEADER, traceId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // 서블릿 스레드 재사용
            MDC.clear();
        }
    }

    static String accept(String incoming) {
        if (incoming != null && ACCEPTED.matcher(incoming).matches()) {
            return incoming;
        }
        return TraceContext.generate();
    }
}
