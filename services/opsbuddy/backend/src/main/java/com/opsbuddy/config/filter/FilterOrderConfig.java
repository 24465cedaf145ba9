package com.opsbuddy.config.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsbuddy.config.OpsProperties;
import com.opsbuddy.filter.ClientIpResolver;
import com.opsbuddy.filter.RateLimitFilter;
import com.opsbuddy.filter.TraceIdFilter;
import com.opsbuddy.observability.RequestEventBuffer;
import com.opsbuddy.state.RuntimeFeatureState;
import io.micrometer.core.instrument.Counter;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Filter 실행 순서를 명시적으로 고정
 *
 * 1. TraceIdFilter   : 요청 진입 시 trace_id 생성
 * 2. RateLimitFilter : trace_id 생성 이후 게이트웨이 라우팅 요청 1차 방어
 *
 * 로직은 Filter에 두고, 이 클래스는 "순서"만 책임
 */
@Configuration
public class FilterOrderConfig {

    @Bean
    public FilterRegistrationBean<TraceIdFilter> traceIdFilterRegistration() {
        FilterRegistrationBean<TraceIdFilter> registration = new FilterRegistrationBean<>();
        registration.setFilter(new TraceIdFilter());

        // trace_id 먼저 생성
        registration.setOrder(1);

        return registration;
    }

    @Bean
    public FilterRegistrationBean<RateLimitFilter> rateLimitFilterRegistration(
            ClientIpResolver clientIpResolver,
            RuntimeFeatureState runtimeFeatureState,
            RequestEventBuffer requestEventBuffer,
            ObjectMapper objectMapper,
            Counter rateLimitBlockedCounter,
            Counter rateLimitAllowedCounter,
            OpsProperties properties
    ) {

        RateLimitFilter filter =
                new RateLimitFilter(
                        clientIpResolver,
                        runtimeFeatureState,
                        requestEventBuffer,
                        objectMapper,
                        rateLimitBlockedCounter,
                        rateLimitAllowedCounter,
                        properties.getGateway().getRateLimitCapacity(),
                        properties.getGateway().getRateLimitRefillPerSecond()
                );

        FilterRegistrationBean<RateLimitFilter> registration =
                new FilterRegistrationBean<>();

        registration.setFilter(filter);
        registration.addUrlPatterns("/api/*");

        // trace_id 생성 이후 실행
        registration.setOrder(2);

        return registration;
    }
}
