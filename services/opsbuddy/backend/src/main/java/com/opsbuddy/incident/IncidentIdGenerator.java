package com.opsbuddy.incident;

import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * 로그 row → 결정적 incident id
 * - md5("service_LEVEL_timestamp_message[0..50]") 앞 16자리
 * - timestamp는 초 단위 절삭 후 ISO-8601 UTC (같은 row를 다시 읽어도 같은 id)
 */
public final class IncidentIdGenerator {

    private static final int MESSAGE_PREFIX_LENGTH = 50;
    private static final int ID_LENGTH = 16;

    private IncidentIdGenerator() {
    }

    public static String generate(String service, String level, Instant timestamp, String message) {
        String key = (service == null ? "unknown" : service)
                + "_" + (level == null ? "INFO" : level.toUpperCase(Locale.ROOT))
                + "_" + (timestamp == null ? "" : DateTimeFormatter.ISO_INSTANT.format(timestamp.truncatedTo(ChronoUnit.SECONDS)))
                + "_" + prefix(message);

        return DigestUtils.md5DigestAsHex(key.getBytes(StandardCharsets.UTF_8)).substring(0, ID_LENGTH);
    }

    private static String prefix(String message) {
        if (message == null) {
            return "";
        }
        return message.length() <= MESSAGE_PREFIX_LENGTH ? message : message.substring(0, MESSAGE_PREFIX_LENGTH);
    }
}
