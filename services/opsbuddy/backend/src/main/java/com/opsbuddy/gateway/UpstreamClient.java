package com.opsbuddy.gateway;

import com.opsbuddy.config.RestClientConfig;
import com.opsbuddy.domain.ServiceDescriptor;
import com.opsbuddy.exception.TransportException;
import com.opsbuddy.registry.ServiceRegistry;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * 서비스별 HTTP 호출 클라이언트
 * - 서비스마다 자신의 timeout을 가진 RestTemplate 1개
 * - 응답 상태 코드는 해석하지 않고, 응답을 받지 못한 경우만 TransportException으로 변환
 */
@Component
public class UpstreamClient {

    private final Map<String, RestTemplate> templates;

    public UpstreamClient(ServiceRegistry registry, RestTemplateBuilder builder) {
        Map<String, RestTemplate> byService = new LinkedHashMap<>();
        for (ServiceDescriptor descriptor : registry.services()) {
            byService.put(descriptor.name(), RestClientConfig.build(builder, descriptor.timeout()));
        }
        this.templates = Map.copyOf(byService);
    }

    public ResponseEntity<byte[]> exchange(ServiceDescriptor descriptor,
                                           HttpMethod method,
                                           URI uri,
                                           HttpHeaders headers,
                                           byte[] body) {
        RestTemplate restTemplate = templates.get(descriptor.name());
        if (restTemplate == null) {
            throw new IllegalStateException("no client for service " + descriptor.name());
        }

        HttpEntity<byte[]> entity = body.length == 0
                ? new HttpEntity<>(headers)
                : new HttpEntity<>(body, headers);

        try {
            return restTemplate.exchange(uri, method, entity, byte[].class);
        } catch (RestClientException e) {
            boolean timeout = isTimeout(e);
            throw new TransportException(
                    descriptor.name(),
                    timeout,
                    timeout
                            ? "Service " + descriptor.name() + " timed out after " + descriptor.timeout().toMillis() + "ms"
                            : "Service " + descriptor.name() + " is unreachable: " + describe(e),
                    e
            );
        }
    }

    /**
     * 원인 체인에서 timeout 계열 예외 탐색
     */
    static boolean isTimeout(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof HttpTimeoutException
                    || t instanceof SocketTimeoutException
                    || t instanceof TimeoutException) {
                return true;
            }
        }
        return false;
    }

    static boolean isConnectionRefused(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof ConnectException) {
                return true;
            }
        }
        return false;
    }

    private static String describe(Throwable error) {
        if (isConnectionRefused(error)) {
            return "Connection refused";
        }
        Throwable root = error;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }
}
