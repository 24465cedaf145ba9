package com.opsbuddy.controller;

import com.opsbuddy.filter.ClientIpResolver;
import com.opsbuddy.gateway.ForwardRequest;
import com.opsbuddy.gateway.RequestRouter;
import com.opsbuddy.logging.TraceContext;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StreamUtils;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.Collections;

/**
 * /api/** 동적 라우팅 진입점
 * - 라우팅 / 차단 / 전달은 RequestRouter 담당
 */
@RestController
@RequiredArgsConstructor
public class GatewayController {

    private final RequestRouter requestRouter;
    private final ClientIpResolver clientIpResolver;

    @RequestMapping("/api/**")
    public ResponseEntity<byte[]> forward(HttpServletRequest request) throws IOException {
        return requestRouter.route(toForwardRequest(request));
    }

    private ForwardRequest toForwardRequest(HttpServletRequest request) throws IOException {
        HttpHeaders headers = new HttpHeaders();
        for (String name : Collections.list(request.getHeaderNames())) {
            headers.addAll(name, Collections.list(request.getHeaders(name)));
        }

        return new ForwardRequest(
                HttpMethod.valueOf(request.getMethod()),
                request.getRequestURI(),
                request.getQueryString(),
                headers,
                StreamUtils.copyToByteArray(request.getInputStream()),
                clientIpResolver.peerAddress(request),
                TraceContext.current()
        );
    }
}
