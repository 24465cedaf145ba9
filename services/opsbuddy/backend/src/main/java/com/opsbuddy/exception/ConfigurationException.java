package com.opsbuddy.exception;

import org.springframework.http.HttpStatus;

/**
 * 등록되지 않은 라우트 / 서비스 / 그룹
 * - 항상 404, 재시도 대상 아님
 */
public class ConfigurationException extends ApiException {

    public ConfigurationException(String code, String message) {
        super(code, message, HttpStatus.NOT_FOUND);
    }

    public static ConfigurationException routeNotFound(String path) {
        return new ConfigurationException("ROUTE_NOT_FOUND", "No route found for path: " + path);
    }

    public static ConfigurationException serviceNotFound(String name) {
        return new ConfigurationException("SERVICE_NOT_FOUND", "Service '" + name + "' not found");
    }
}
