package com.opsbuddy.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum HealthStatus {

    HEALTHY("healthy"),
    DEGRADED("degraded"),
    UNHEALTHY("unhealthy"),
    UNKNOWN("unknown");

    private final String value;

    HealthStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
