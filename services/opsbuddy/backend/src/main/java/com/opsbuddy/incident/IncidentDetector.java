package com.opsbuddy.incident;

import com.opsbuddy.config.OpsProperties;
import com.opsbuddy.domain.Incident;
import com.opsbuddy.domain.LogEntry;
import com.opsbuddy.logging.LogEvent;
import com.opsbuddy.observability.OpsMetrics;
import com.opsbuddy.relay.RelayPublisher;
import com.opsbuddy.repository.LogEntryRepository;
import com.opsbuddy.state.RuntimeFeatureState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 로그 스토어 기반 장애 탐지기
 *
 * 사이클 단위
 * 1. t_now 고정
 * 2. level ∈ levels, checkpoint - overlap ≤ timestamp ≤ t_now 인 row를 (timestamp, id) 오름차순으로 페이지 조회
 *    - 가득 찬 페이지 뒤에는 마지막 row의 (timestamp, id) 커서 이후부터 다음 페이지 조회
 * 3. row마다 incident 발행 (incidents + error_logs 채널), 서비스별 집계 발행 (analytics 채널)
 * 4. 짧은 페이지까지 모두 읽으면 checkpoint = max(checkpoint, t_now)
 *    페이지 상한에 걸리면 checkpoint는 커서 시각까지만 전진, 다음 사이클은 overlap 없이 커서부터 이어서 조회
 *
 * - 조회 실패 시 checkpoint / 커서 유지 (다음 사이클에 같은 구간 재조회)
 * - overlap 구간 중복은 결정적 id로 소비 측에서 제거, analytics는 이전 checkpoint 이후 row만 집계
 * - 스케줄 사이클과 수동 사이클(/check)은 동시에 실행되지 않음
 */
@Slf4j
@Service
public class IncidentDetector {

    private final LogEntryRepository logEntryRepository;
    private final RelayPublisher publisher;
    private final RuntimeFeatureState runtimeFeatureState;
    private final OpsMetrics metrics;
    private final Clock clock;

    private final Duration overlap;
    private final int batchSize;
    private final int maxPagesPerCycle;
    private final List<String> levels;
    private final String incidentChannel;
    private final String errorChannel;
    private final String analyticsChannel;

    private final ReentrantLock cycleLock = new ReentrantLock();

    // 단조 증가 (감소 금지)
    private final AtomicReference<Instant> checkpoint;

    // 페이지 상한으로 끊긴 지점, null이면 밀린 구간 없음 (cycleLock 안에서만 변경)
    private volatile Cursor backlog;

    private volatile Instant lastCycleAt;

    public IncidentDetector(LogEntryRepository logEntryRepository,
                            RelayPublisher publisher,
                            RuntimeFeatureState runtimeFeatureState,
                            OpsMetrics metrics,
                            OpsProperties properties,
                            Clock clock) {
        this.logEntryRepository = logEntryRepository;
        this.publisher = publisher;
        this.runtimeFeatureState = runtimeFeatureState;
        this.metrics = metrics;
        this.clock = clock;

        OpsProperties.Detector detector = properties.getDetector();
        this.overlap = detector.getOverlap();
        this.batchSize = detector.getBatchSize();
        this.maxPagesPerCycle = Math.max(1, detector.getMaxPagesPerCycle());
        this.levels = detector.getLevels().stream()
                .map(level -> level.toUpperCase(Locale.ROOT))
                .toList();

        OpsProperties.Channels channels = properties.getRelay().getChannels();
        this.incidentChannel = channels.getIncidents();
        this.errorChannel = channels.getErrors();
        this.analyticsChannel = channels.getAnalytics();

        // 기동 이후 적재된 로그부터 탐지
        this.checkpoint = new AtomicReference<>(clock.instant());
    }

    public DetectionResult runCycle() {
        cycleLock.lock();
        try {
            return detect();
        } finally {
            cycleLock.unlock();
        }
    }

    private DetectionResult detect() {
        if (!runtimeFeatureState.isDetectionEnabled()) {
            log.debug("event={} checkpoint={}", LogEvent.DETECTION_PAUSED, checkpoint.get());
            return DetectionResult.skipped(DetectionResult.Outcome.PAUSED, checkpoint.get());
        }

        Instant now = clock.instant();
        Instant previous = checkpoint.get();
        Cursor resumeFrom = backlog;
        boolean catchingUp = resumeFrom != null;

        // 밀린 구간을 이어서 읽는 중이면 overlap 없이 커서부터, 커서 이후 row는 모두 처음 읽는 row
        Instant windowStart = catchingUp ? resumeFrom.loggedAt() : previous.minus(overlap);

        Map<String, Integer> perService = new LinkedHashMap<>();
        Cursor cursor = resumeFrom;
        int emitted = 0;
        int pages = 0;

        while (true) {
            List<LogEntry> page;
            try {
                page = fetch(cursor, windowStart, now);
            } catch (RuntimeException e) {
                log.warn(
                        "event={} windowStart={} checkpoint={} page={} message={}",
                        LogEvent.LOG_QUERY_FAILED,
                        windowStart,
                        previous,
                        pages,
                        e.getMessage()
                );
                return DetectionResult.skipped(DetectionResult.Outcome.QUERY_FAILED, checkpoint.get());
            }
            pages++;

            for (LogEntry row : page) {
                Incident incident = emit(row, now);
                emitted++;

                if (catchingUp || row.getLoggedAt().isAfter(previous)) {
                    perService.merge(incident.service() == null ? "unknown" : incident.service(), 1, Integer::sum);
                }
            }

            if (page.size() < batchSize) {
                cursor = null;
                break;
            }
            cursor = Cursor.of(page.get(page.size() - 1));
            if (pages >= maxPagesPerCycle) {
                break;
            }
        }

        backlog = cursor;
        Instant boundary = cursor == null ? now : cursor.loggedAt();

        if (cursor != null) {
            log.warn(
                    "event={} pages={} batchSize={} cursorAt={} cursorId={}",
                    LogEvent.DETECTION_BACKLOG,
                    pages,
                    batchSize,
                    cursor.loggedAt(),
                    cursor.id()
            );
        }

        Instant countedFrom = catchingUp ? resumeFrom.loggedAt() : previous;
        perService.forEach((service, count) ->
                publisher.publish(analyticsChannel, IncidentEvents.analyticsUpdate(service, count, countedFrom, boundary, now))
        );

        Instant advanced = checkpoint.accumulateAndGet(boundary, IncidentDetector::later);
        lastCycleAt = now;

        if (emitted > 0) {
            log.info(
                    "event={} incidents={} services={} windowStart={} checkpoint={}",
                    LogEvent.INCIDENT_DETECTED,
                    emitted,
                    perService.keySet(),
                    windowStart,
                    advanced
            );
        }

        return new DetectionResult(DetectionResult.Outcome.COMPLETED, windowStart, advanced, emitted, perService);
    }

    private List<LogEntry> fetch(Cursor cursor, Instant windowStart, Instant now) {
        if (cursor == null) {
            return logEntryRepository.findByLevelInAndLoggedAtBetweenOrderByLoggedAtAscIdAsc(
                    levels,
                    windowStart,
                    now,
                    PageRequest.of(0, batchSize)
            );
        }
        return logEntryRepository.findPageAfter(
                levels,
                cursor.loggedAt(),
                cursor.id(),
                now,
                PageRequest.of(0, batchSize)
        );
    }

    private Incident emit(LogEntry row, Instant now) {
        Incident incident = IncidentEvents.toIncident(row, now);

        publisher.publish(incidentChannel, IncidentEvents.incidentDetected(incident, now));
        publisher.publish(errorChannel, IncidentEvents.errorLog(row, now));
        metrics.incidentEmitted();

        log.debug(
                "event={} incidentId={} service={} level={}",
                LogEvent.INCIDENT_DETECTED,
                incident.id(),
                incident.service(),
                incident.level()
        );
        return incident;
    }

    private static Instant later(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }

    public Instant getCheckpoint() {
        return checkpoint.get();
    }

    public Instant getLastCycleAt() {
        return lastCycleAt;
    }

    public boolean isRunning() {
        return cycleLock.isLocked();
    }

    /**
     * 다음 페이지 시작 위치 (마지막으로 읽은 row의 timestamp, id)
     */
    private record Cursor(Instant loggedAt, Long id) {

        static Cursor of(LogEntry row) {
            return new Cursor(row.getLoggedAt(), row.getId());
        }
    }
}
