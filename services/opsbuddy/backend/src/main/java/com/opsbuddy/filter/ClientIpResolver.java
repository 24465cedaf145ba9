package com.opsbuddy.filter;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

/**
 * 클라이언트 IP 판별
 *
 * - resolve : 원 요청자 IP (rate limit 키, 요청 이벤트 기록용)
 * - peerAddress : 게이트웨이에 직접 연결된 구간 주소 (X-Forwarded-For 추가용)
 */
@Component
public class ClientIpResolver {

    private static final String FORWARDED_FOR = "X-Forwarded-For";

    public String resolve(HttpServletRequest request) {
        String forwardedFor = request.getHeader(FORWARDED_FOR);

        if (forwardedFor != null && !forwardedFor.isBlank()) {
            // 첫 번째 항목이 최초 요청자
            return forwardedFor.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }

    public String peerAddress(HttpServletRequest request) {
        return request.getRemoteAddr();
    }
}
