package com.opsbuddy.incident;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 최근 N시간 장애 요약
 */
public record IncidentSummary(
        @JsonProperty("total_errors") long totalErrors,
        @JsonProperty("services_affected") int servicesAffected,
        @JsonProperty("error_breakdown") Map<String, ServiceBreakdown> errorBreakdown,
        @JsonProperty("time_range") Map<String, Instant> timeRange,
        @JsonProperty("recent_error_count") int recentErrorCount,
        @JsonProperty("recent_errors") List<Map<String, Object>> recentErrors
) {

    public record ServiceBreakdown(
            @JsonProperty("total_errors") long totalErrors,
            @JsonProperty("error_levels") Map<String, Long> errorLevels
    ) {
    }
}
