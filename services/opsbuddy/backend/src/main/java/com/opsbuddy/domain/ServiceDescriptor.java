package com.opsbuddy.domain;

import java.time.Duration;
import java.util.List;

/**
 * 기동 시 설정에서 생성되는 서비스 정의 (불변)
 *
 * @param name             서비스 식별자 (예: file-service)
 * @param baseUrl          업스트림 base URL
 * @param healthPath       헬스 체크 경로
 * @param timeout          호출 단위 timeout
 * @param retries          idempotent 요청의 transport 실패 재시도 횟수
 * @param breakerThreshold 연속 실패 임계치 (OPEN 전환)
 * @param group            모니터링 그룹 (null 가능)
 * @param routes           게이트웨이 라우팅 prefix 목록
 */
public record ServiceDescriptor(
        String name,
        String baseUrl,
        String healthPath,
        Duration timeout,
        int retries,
        int breakerThreshold,
        String group,
        List<String> routes
) {

    public ServiceDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("service name is required");
        }
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl is required for service " + name);
        }
        if (breakerThreshold < 1) {
            throw new IllegalArgumentException("breakerThreshold must be >= 1 for service " + name);
        }
        baseUrl = stripTrailingSlash(baseUrl);
        healthPath = healthPath == null || healthPath.isBlank() ? "/health" : healthPath;
        timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
        retries = Math.max(0, retries);
        routes = routes == null ? List.of() : List.copyOf(routes);
    }

    public String healthUrl() {
        return baseUrl + (healthPath.startsWith("/") ? healthPath : "/" + healthPath);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
