package com.opsbuddy.gateway;

import com.opsbuddy.logging.TraceContext;
import org.springframework.http.HttpHeaders;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 게이트웨이 전달 시 헤더 정리
 * - hop-by-hop 헤더는 구간 단위이므로 전달하지 않음
 * - Host / Content-Length는 HTTP 클라이언트가 다시 계산
 */
final class ForwardHeaders {

    private static final Set<String> HOP_BY_HOP = Set.of(
            "connection",
            "keep-alive",
            "proxy-authenticate",
            "proxy-authorization",
            "proxy-connection",
            "te",
            "trailer",
            "transfer-encoding",
            "upgrade"
    );

    private static final Set<String> RECOMPUTED = Set.of(
            "host",
            "content-length",
            "expect"
    );

    private ForwardHeaders() {
    }

    static HttpHeaders forRequest(HttpHeaders incoming, String clientIp, String traceId) {
        HttpHeaders headers = copyWithout(incoming);

        if (clientIp != null) {
            String forwardedFor = incoming.getFirst("X-Forwarded-For");
            headers.set("X-Forwarded-For",
                    forwardedFor == null || forwardedFor.isBlank() ? clientIp : forwardedFor + ", " + clientIp);
        }
        if (traceId != null) {
            headers.set(TraceContext.TRACE_ID_HEADER, traceId);
        }
        return headers;
    }

    static HttpHeaders forResponse(HttpHeaders upstream) {
        return copyWithout(upstream);
    }

    static boolean isHopByHop(String name) {
        return HOP_BY_HOP.contains(name.toLowerCase(Locale.ROOT));
    }

    private static HttpHeaders copyWithout(HttpHeaders source) {
        // Connection 헤더에 나열된 이름도 hop-by-hop으로 취급
        List<String> connectionTokens = source.getConnection().stream()
                .map(token -> token.trim().toLowerCase(Locale.ROOT))
                .toList();

        HttpHeaders target = new HttpHeaders();
        source.forEach((name, values) -> {
            String lower = name.toLowerCase(Locale.ROOT);
            if (HOP_BY_HOP.contains(lower) || RECOMPUTED.contains(lower) || connectionTokens.contains(lower)) {
                return;
            }
            target.addAll(name, values);
        });
        return target;
    }
}
