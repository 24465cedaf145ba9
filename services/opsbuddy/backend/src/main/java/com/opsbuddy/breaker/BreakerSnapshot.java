package com.opsbuddy.breaker;

import java.time.Instant;

public record BreakerSnapshot(
        BreakerState state,
        int failureCount,
        Instant lastFailureTime,   // null 가능
        int threshold,
        long cooldownSeconds
) {}
