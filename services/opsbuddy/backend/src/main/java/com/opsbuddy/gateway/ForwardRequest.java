package com.opsbuddy.gateway;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;

/**
 * 게이트웨이가 받은 요청 (서블릿 API와 분리된 형태)
 *
 * @param path  디코딩 전 요청 경로 (/api/files/1)
 * @param query 디코딩 전 query string (없으면 null)
 */
public record ForwardRequest(
        HttpMethod method,
        String path,
        String query,
        HttpHeaders headers,
        byte[] body,
        String clientIp,
        String traceId
) {

    public ForwardRequest {
        headers = headers == null ? new HttpHeaders() : headers;
        body = body == null ? new byte[0] : body;
    }

    public boolean isIdempotentRead() {
        return method == HttpMethod.GET || method == HttpMethod.HEAD || method == HttpMethod.OPTIONS;
    }
}
