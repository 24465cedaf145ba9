package com.opsbuddy.incident;

import com.opsbuddy.config.OpsProperties;
import com.opsbuddy.domain.LogEntry;
import com.opsbuddy.exception.ApiException;
import com.opsbuddy.repository.LogEntryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * incident HTTP 조회용 서비스 (탐지 사이클과 무관한 읽기 전용 경로)
 */
@Slf4j
@Service
public class IncidentQueryService {

    public static final String SUMMARY_CACHE = "incidentSummary";

    static final int MAX_HOURS = 24 * 30;

    private static final Duration RECENT_WINDOW = Duration.ofMinutes(30);
    private static final int RECENT_ERRORS_LIMIT = 10;

    private final LogEntryRepository logEntryRepository;
    private final Clock clock;
    private final List<String> levels;
    private final int batchSize;

    public IncidentQueryService(LogEntryRepository logEntryRepository,
                                OpsProperties properties,
                                Clock clock) {
        this.logEntryRepository = logEntryRepository;
        this.clock = clock;
        this.levels = properties.getDetector().getLevels().stream()
                .map(level -> level.toUpperCase(Locale.ROOT))
                .toList();
        this.batchSize = properties.getDetector().getBatchSize();
    }

    /**
     * 최근 hours 시간 동안의 서비스 / 레벨별 에러 집계 + 최근 30분 에러
     * - 짧은 TTL로 캐싱 (대시보드 polling 대비)
     */
    @Cacheable(cacheNames = SUMMARY_CACHE, key = "#hours")
    public IncidentSummary summary(int hours) {
        validateHours(hours);

        Instant end = clock.instant();
        Instant start = end.minus(Duration.ofHours(hours));

        Map<String, Long> totals = new LinkedHashMap<>();
        Map<String, Map<String, Long>> levelsByService = new LinkedHashMap<>();
        long totalErrors = 0;

        for (LogEntryRepository.ServiceLevelCount row : logEntryRepository.countByServiceAndLevel(levels, start, end)) {
            long count = row.getTotal() == null ? 0L : row.getTotal();
            totals.merge(row.getService(), count, Long::sum);
            levelsByService.computeIfAbsent(row.getService(), key -> new LinkedHashMap<>())
                    .put(row.getLevel(), count);
            totalErrors += count;
        }

        Map<String, IncidentSummary.ServiceBreakdown> breakdown = new LinkedHashMap<>();
        totals.forEach((service, total) ->
                breakdown.put(service, new IncidentSummary.ServiceBreakdown(total, levelsByService.get(service)))
        );

        List<LogEntry> recent = logEntryRepository.findByLevelInAndLoggedAtBetweenOrderByLoggedAtDesc(
                levels,
                end.minus(RECENT_WINDOW),
                end,
                PageRequest.of(0, batchSize)
        );

        Map<String, Instant> timeRange = new LinkedHashMap<>();
        timeRange.put("start", start);
        timeRange.put("end", end);

        return new IncidentSummary(
                totalErrors,
                breakdown.size(),
                breakdown,
                timeRange,
                recent.size(),
                recent.stream()
                        .limit(RECENT_ERRORS_LIMIT)
                        .map(IncidentEvents::errorView)
                        .toList()
        );
    }

    /**
     * 특정 서비스의 최근 hours 시간 에러 (최신 순, batch-size 상한)
     */
    public ServiceErrors serviceErrors(String service, int hours) {
        validateHours(hours);

        Instant end = clock.instant();
        Instant start = end.minus(Duration.ofHours(hours));

        List<Map<String, Object>> errors = logEntryRepository
                .findByServiceAndLevelInAndLoggedAtBetweenOrderByLoggedAtDesc(
                        service,
                        levels,
                        start,
                        end,
                        PageRequest.of(0, batchSize)
                )
                .stream()
                .map(IncidentEvents::errorView)
                .toList();

        return new ServiceErrors(service, errors, errors.size(), end);
    }

    private static void validateHours(int hours) {
        if (hours < 1 || hours > MAX_HOURS) {
            throw new ApiException(
                    "INVALID_TIME_RANGE",
                    "hours must be between 1 and " + MAX_HOURS,
                    HttpStatus.BAD_REQUEST
            );
        }
    }
}
