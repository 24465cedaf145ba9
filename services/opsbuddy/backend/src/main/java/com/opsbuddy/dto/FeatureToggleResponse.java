package com.opsbuddy.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 런타임 기능 토글 결과
 */
@Getter
@AllArgsConstructor
public class FeatureToggleResponse {

    private String feature;

    private boolean enabled;

    // 예: "OFF -> ON"
    private String status;

    public static FeatureToggleResponse of(String feature, boolean enabled) {
        String from = enabled ? "OFF" : "ON";
        String to = enabled ? "ON" : "OFF";
        return new FeatureToggleResponse(feature, enabled, from + " -> " + to);
    }
}
