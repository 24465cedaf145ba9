package com.opsbuddy.monitor;

import com.opsbuddy.domain.ServiceHealthRecord;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * service_health 채널 메시지 형식
 * <pre>
 * { "service": "file-service",
 *   "status": { "health", "response_time", "last_check", "consecutive_failures", "error_message", "details" },
 *   "timestamp": "..." }
 * </pre>
 */
public final class HealthUpdates {

    private HealthUpdates() {
    }

    public static Map<String, Object> toMessage(ServiceHealthRecord record, Instant publishedAt) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("service", record.name());
        message.put("status", toStatus(record));
        message.put("timestamp", publishedAt.toString());
        return message;
    }

    public static Map<String, Object> toStatus(ServiceHealthRecord record) {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("health", record.status().value());
        // 초 단위
        status.put("response_time", record.responseTimeMs() / 1000.0);
        status.put("last_check", record.lastCheck() == null ? null : record.lastCheck().toString());
        status.put("consecutive_failures", record.consecutiveFailures());
        status.put("error_message", record.errorMessage());
        status.put("details", record.details());
        return status;
    }
}
