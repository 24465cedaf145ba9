package com.opsbuddy.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * 라우팅 테이블 항목 (/api)
 */
@Getter
@AllArgsConstructor
public class RouteView {

    private String service;
    private String baseUrl;
    private List<String> prefixes;
    private int retries;
    private long timeoutMs;
    private int breakerThreshold;
}
