package com.opsbuddy.breaker;

public enum BreakerState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
