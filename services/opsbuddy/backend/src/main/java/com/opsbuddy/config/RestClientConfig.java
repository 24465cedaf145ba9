package com.opsbuddy.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.DefaultResponseErrorHandler;
import org.springframework.web.client.ResponseErrorHandler;
import org.springframework.web.client.RestTemplate;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * 외부 호출용 RestTemplate 구성
 *
 * - 모든 호출에 connect / read timeout 명시
 * - 4xx / 5xx 응답도 예외 없이 그대로 반환 (상태 판단은 호출 측 책임)
 */
@Configuration
public class RestClientConfig {

    /**
     * 상태 코드로 예외를 던지지 않는 에러 핸들러
     */
    public static final ResponseErrorHandler PASS_THROUGH = new DefaultResponseErrorHandler() {
        @Override
        public boolean hasError(ClientHttpResponse response) {
            return false;
        }
    };

    /**
     * 헬스 프로브 전용 RestTemplate
     * - opsbuddy.monitor.probe-timeout 으로 응답 대기 상한 고정
     */
    @Bean
    public RestTemplate probeRestTemplate(RestTemplateBuilder builder, OpsProperties properties) {
        return build(builder, properties.getMonitor().getProbeTimeout());
    }

    /**
     * 지정 timeout으로 RestTemplate 생성
     * - JDK HttpClient 기반 (PATCH 포함 모든 메서드 지원)
     */
    public static RestTemplate build(RestTemplateBuilder builder, Duration timeout) {
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();

        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(timeout);

        return builder
                .requestFactory(() -> requestFactory)
                .errorHandler(PASS_THROUGH)
                .build();
    }
}
