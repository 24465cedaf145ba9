package com.opsbuddy.repository;

import com.opsbuddy.domain.LogEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@DisplayName("LogEntryRepository")
class LogEntryRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");
    private static final List<String> LEVELS = List.of("ERROR", "CRITICAL", "FATAL");

    @Autowired
    private LogEntryRepository repository;

    @BeforeEach
    void setUp() {
        repository.saveAll(List.of(
                entry(T0.plusSeconds(30), "file-service", "ERROR", "disk full"),
                entry(T0.plusSeconds(10), "file-service", "INFO", "uploaded"),
                entry(T0.plusSeconds(20), "utility-service", "CRITICAL", "oom"),
                entry(T0.plusSeconds(40), "file-service", "ERROR", "disk full again"),
                entry(T0.minusSeconds(60), "file-service", "ERROR", "old")
        ));
    }

    private static LogEntry entry(Instant at, String service, String level, String message) {
        return new LogEntry(at, service, level, "app", "op", "node-1", message, Map.of("attempt", 1));
    }

    @Test
    @DisplayName("탐지 조회 : from ~ to 구간, 오래된 순, 페이지 크기 상한")
    void detectionQueryIsAscendingAndBounded() {
        List<LogEntry> rows = repository.findByLevelInAndLoggedAtBetweenOrderByLoggedAtAscIdAsc(
                LEVELS, T0, T0.plusSeconds(3600), PageRequest.of(0, 2));

        assertThat(rows).extracting(LogEntry::getMessage).containsExactly("oom", "disk full");
    }

    @Test
    @DisplayName("탐지 조회 : to 이후 row 제외")
    void detectionQueryStopsAtUpperBound() {
        List<LogEntry> rows = repository.findByLevelInAndLoggedAtBetweenOrderByLoggedAtAscIdAsc(
                LEVELS, T0, T0.plusSeconds(30), PageRequest.of(0, 10));

        assertThat(rows).extracting(LogEntry::getMessage).containsExactly("oom", "disk full");
    }

    @Test
    @DisplayName("다음 페이지 조회 : (시각, id) 커서 이후만, 같은 시각은 id로 이어서")
    void pageAfterCursorContinuesWithinSameTimestamp() {
        Instant burst = T0.plusSeconds(50);
        List<LogEntry> saved = repository.saveAll(List.of(
                entry(burst, "file-service", "ERROR", "burst-1"),
                entry(burst, "file-service", "ERROR", "burst-2"),
                entry(burst, "file-service", "ERROR", "burst-3")
        ));
        LogEntry first = saved.get(0);

        List<LogEntry> rows = repository.findPageAfter(
                LEVELS, first.getLoggedAt(), first.getId(), T0.plusSeconds(3600), PageRequest.of(0, 10));

        assertThat(rows).extracting(LogEntry::getMessage).containsExactly("burst-2", "burst-3");
    }

    @Test
    @DisplayName("다음 페이지 조회 : 이전 페이지 마지막 row 이후부터")
    void pageAfterCursorFollowsFirstPage() {
        List<LogEntry> firstPage = repository.findByLevelInAndLoggedAtBetweenOrderByLoggedAtAscIdAsc(
                LEVELS, T0, T0.plusSeconds(3600), PageRequest.of(0, 2));
        LogEntry last = firstPage.get(firstPage.size() - 1);

        List<LogEntry> next = repository.findPageAfter(
                LEVELS, last.getLoggedAt(), last.getId(), T0.plusSeconds(3600), PageRequest.of(0, 2));

        assertThat(next).extracting(LogEntry::getMessage).containsExactly("disk full again");
    }

    @Test
    @DisplayName("서비스별 최근 에러 : 최신 순, INFO 제외")
    void serviceErrorsAreNewestFirst() {
        List<LogEntry> rows = repository.findByServiceAndLevelInAndLoggedAtBetweenOrderByLoggedAtDesc(
                "file-service", LEVELS, T0, T0.plusSeconds(3600), PageRequest.of(0, 10));

        assertThat(rows).extracting(LogEntry::getMessage).containsExactly("disk full again", "disk full");
        assertThat(rows.get(0).getData()).containsEntry("attempt", 1);
    }

    @Test
    @DisplayName("서비스 / 레벨별 집계")
    void countsByServiceAndLevel() {
        List<LogEntryRepository.ServiceLevelCount> counts =
                repository.countByServiceAndLevel(LEVELS, T0, T0.plusSeconds(3600));

        assertThat(counts)
                .extracting(c -> c.getService() + ":" + c.getLevel() + ":" + c.getTotal())
                .containsExactlyInAnyOrder("file-service:ERROR:2", "utility-service:CRITICAL:1");
    }
}
