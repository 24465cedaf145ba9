package com.opsbuddy.monitor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsbuddy.domain.HealthStatus;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * 헬스 엔드포인트 응답 본문 → ParsedHealth
 *
 * 판단 순서 (처음 인식되는 값 사용)
 * 1. 최상위 status
 * 2. service.status
 * 3. data.status
 * 인식하는 값 : healthy / degraded / unhealthy / unknown (서비스가 스스로 판단 불가를 보고)
 * 그 외 (필드 없음 / 인식하지 못한 값 / JSON 아님) → HEALTHY
 */
@Component
public class HealthResponseParser {

    private final ObjectMapper objectMapper;

    public HealthResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ParsedHealth parse(String body) {
        if (body == null || body.isBlank()) {
            return ParsedHealth.fallback(null);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return ParsedHealth.fallback(null);
        }

        Object payload = objectMapper.convertValue(root, Object.class);

        if (root == null || !root.isObject()) {
            return ParsedHealth.fallback(payload);
        }

        Optional<HealthStatus> topLevel = statusOf(root);
        if (topLevel.isPresent()) {
            return new ParsedHealth(topLevel.get(), ParsedHealth.Source.TOP_LEVEL, payload);
        }

        Optional<HealthStatus> nested = statusOf(root.get("service"));
        if (nested.isPresent()) {
            return new ParsedHealth(nested.get(), ParsedHealth.Source.NESTED_SERVICE, payload);
        }

        Optional<HealthStatus> envelope = statusOf(root.get("data"));
        if (envelope.isPresent()) {
            return new ParsedHealth(envelope.get(), ParsedHealth.Source.DATA_ENVELOPE, payload);
        }

        return ParsedHealth.fallback(payload);
    }

    private static Optional<HealthStatus> statusOf(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        JsonNode status = node.get("status");
        if (status == null || !status.isTextual()) {
            return Optional.empty();
        }
        return switch (status.asText().trim().toLowerCase(Locale.ROOT)) {
            case "healthy" -> Optional.of(HealthStatus.HEALTHY);
            case "degraded" -> Optional.of(HealthStatus.DEGRADED);
            case "unhealthy" -> Optional.of(HealthStatus.UNHEALTHY);
            case "unknown" -> Optional.of(HealthStatus.UNKNOWN);
            default -> Optional.empty();
        };
    }
}
