package com.opsbuddy.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

@Getter
@AllArgsConstructor
public class GatewayInfo {

    private String name;
    private String version;
    private long uptimeSeconds;
    private Instant timestamp;
}
