package com.opsbuddy.repository;

import com.opsbuddy.domain.LogEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface LogEntryRepository
        extends JpaRepository<LogEntry, Long> {

    // 탐지 사이클 첫 페이지: (loggedAt, id) 오름차순
    List<LogEntry> findByLevelInAndLoggedAtBetweenOrderByLoggedAtAscIdAsc(
            Collection<String> levels,
            Instant from,
            Instant to,
            Pageable pageable
    );

    /**
     * 탐지 사이클 다음 페이지
     * (afterAt, afterId) 커서 이후 row만 조회하므로 같은 시각의 row가 batch보다 많아도 건너뛰지 않음
     */
    @Query("""
            select l from LogEntry l
            where l.level in :levels
              and l.loggedAt <= :to
              and (l.loggedAt > :afterAt or (l.loggedAt = :afterAt and l.id > :afterId))
            order by l.loggedAt asc, l.id asc
            """)
    List<LogEntry> findPageAfter(
            @Param("levels") Collection<String> levels,
            @Param("afterAt") Instant afterAt,
            @Param("afterId") Long afterId,
            @Param("to") Instant to,
            Pageable pageable
    );

    List<LogEntry> findByLevelInAndLoggedAtBetweenOrderByLoggedAtDesc(
            Collection<String> levels,
            Instant from,
            Instant to,
            Pageable pageable
    );

    List<LogEntry> findByServiceAndLevelInAndLoggedAtBetweenOrderByLoggedAtDesc(
            String service,
            Collection<String> levels,
            Instant from,
            Instant to,
            Pageable pageable
    );

    @Query("""
            select l.service as service, l.level as level, count(l) as total
            from LogEntry l
            where l.level in :levels
              and l.loggedAt between :from and :to
            group by l.service, l.level
            """)
    List<ServiceLevelCount> countByServiceAndLevel(
            @Param("levels") Collection<String> levels,
            @Param("from") Instant from,
            @Param("to") Instant to
    );

    /**
     * 서비스 / 레벨별 집계 projection
     */
    interface ServiceLevelCount {
        String getService();

        String getLevel();

        Long getTotal();
    }
}
