package com.opsbuddy.incident;

import java.time.Instant;
import java.util.Map;

/**
 * 탐지 사이클 1회 결과
 *
 * @param outcome     COMPLETED / PAUSED / QUERY_FAILED
 * @param windowStart 조회 시작 시각 (checkpoint - overlap, 밀린 구간을 이어서 읽는 중이면 커서 시각)
 * @param checkpoint  사이클 종료 후 checkpoint
 * @param incidents   발행한 incident 수 (overlap 재조회 포함)
 * @param perService  서비스별 신규 건수 (analytics 집계와 동일)
 */
public record DetectionResult(
        Outcome outcome,
        Instant windowStart,
        Instant checkpoint,
        int incidents,
        Map<String, Integer> perService
) {

    public enum Outcome {
        COMPLETED,
        PAUSED,
        QUERY_FAILED
    }

    public DetectionResult {
        perService = perService == null ? Map.of() : Map.copyOf(perService);
    }

    static DetectionResult skipped(Outcome outcome, Instant checkpoint) {
        return new DetectionResult(outcome, null, checkpoint, 0, Map.of());
    }
}
