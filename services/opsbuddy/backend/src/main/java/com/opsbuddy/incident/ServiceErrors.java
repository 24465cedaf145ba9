package com.opsbuddy.incident;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record ServiceErrors(
        String service,
        List<Map<String, Object>> errors,
        int count,
        Instant timestamp
) {
}
