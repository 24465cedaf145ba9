package com.opsbuddy.incident;

import com.opsbuddy.domain.Incident;
import com.opsbuddy.domain.LogEntry;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 탐지기가 발행하는 메시지 형식
 */
final class IncidentEvents {

    static final String SOURCE = "incident-service";

    private IncidentEvents() {
    }

    static Incident toIncident(LogEntry entry, Instant detectionTime) {
        return new Incident(
                IncidentIdGenerator.generate(entry.getService(), entry.getLevel(), entry.getLoggedAt(), entry.getMessage()),
                entry.getLoggedAt(),
                entry.getService(),
                entry.getLevel(),
                entry.getLogger(),
                entry.getHost(),
                entry.getOperation(),
                entry.getMessage(),
                entry.getData(),
                detectionTime
        );
    }

    /**
     * incidents 채널
     * { event_type: "error_detected", timestamp, data: {..., incident_id}, source }
     */
    static Map<String, Object> incidentDetected(Incident incident, Instant now) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("timestamp", incident.timestamp() == null ? null : incident.timestamp().toString());
        data.put("service", incident.service());
        data.put("level", incident.level());
        data.put("logger", incident.logger());
        data.put("operation", incident.operation());
        data.put("host", incident.host());
        data.put("message", incident.message());
        data.put("data", incident.data());
        data.put("incident_id", incident.id());
        data.put("detection_time", incident.detectionTime().toString());

        return envelope("error_detected", data, now);
    }

    /**
     * error_logs 채널 (UI 실시간 로그 표시용 원본 echo)
     */
    static Map<String, Object> errorLog(LogEntry entry, Instant now) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", "error_log");
        message.put("error", errorView(entry));
        message.put("timestamp", now.toString());
        return message;
    }

    /**
     * analytics_updates 채널 (사이클 단위 서비스별 집계)
     */
    static Map<String, Object> analyticsUpdate(String service, int errorCount, Instant start, Instant end, Instant now) {
        Map<String, Object> timeRange = new LinkedHashMap<>();
        timeRange.put("start", start.toString());
        timeRange.put("end", end.toString());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("service", service);
        data.put("error_count", errorCount);
        data.put("time_range", timeRange);
        data.put("summary", "Detected " + errorCount + " errors for " + service);

        return envelope("analytics_update", data, now);
    }

    static Map<String, Object> errorView(LogEntry entry) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("timestamp", entry.getLoggedAt() == null ? null : entry.getLoggedAt().toString());
        view.put("service", entry.getService() == null ? "unknown" : entry.getService());
        view.put("level", entry.getLevel() == null ? "ERROR" : entry.getLevel());
        view.put("logger", entry.getLogger() == null ? "unknown" : entry.getLogger());
        view.put("message", entry.getMessage() == null ? "No message" : entry.getMessage());
        view.put("operation", entry.getOperation());
        view.put("host", entry.getHost());
        view.put("data", entry.getData());
        return view;
    }

    private static Map<String, Object> envelope(String eventType, Map<String, Object> data, Instant now) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("event_type", eventType);
        event.put("timestamp", now.toString());
        event.put("data", data);
        event.put("source", SOURCE);
        return event;
    }
}
