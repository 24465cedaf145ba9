package com.opsbuddy.registry;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 경로 prefix → 서비스 라우팅 테이블 (불변)
 * - 가장 긴 prefix 우선
 * - prefix는 path segment 경계에서만 매칭 (/api/files 는 /api/filesystem 에 매칭되지 않음)
 */
public final class RoutingTable {

    private final List<Route> routes;

    public RoutingTable(Map<String, String> prefixToService) {
        this.routes = prefixToService.entrySet().stream()
                .map(e -> new Route(normalize(e.getKey()), e.getValue()))
                .sorted(Comparator.comparingInt((Route r) -> r.prefix().length()).reversed())
                .toList();
    }

    public Optional<Route> match(String path) {
        if (path == null || path.isEmpty()) {
            return Optional.empty();
        }
        for (Route route : routes) {
            if (matches(route.prefix(), path)) {
                return Optional.of(route);
            }
        }
        return Optional.empty();
    }

    public List<Route> routes() {
        return routes;
    }

    private static boolean matches(String prefix, String path) {
        if (!path.startsWith(prefix)) {
            return false;
        }
        return path.length() == prefix.length()
                || prefix.endsWith("/")
                || path.charAt(prefix.length()) == '/';
    }

    private static String normalize(String prefix) {
        String p = prefix.startsWith("/") ? prefix : "/" + prefix;
        return p.length() > 1 && p.endsWith("/") ? p.substring(0, p.length() - 1) : p;
    }

    public record Route(String prefix, String serviceName) {
    }
}
