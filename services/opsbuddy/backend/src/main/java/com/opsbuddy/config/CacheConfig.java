package com.opsbuddy.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.opsbuddy.incident.IncidentQueryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * 로컬 캐시 (Caffeine)
 *
 * - incidentSummary : 대시보드 polling으로 반복되는 집계 쿼리 흡수
 * - 인스턴스 단위 캐시 (짧은 TTL이라 인스턴스 간 불일치 허용)
 */
@Slf4j
@Configuration
public class CacheConfig {

    @Value("${cache.caffeine.max-size:100}")
    private int caffeineMaxSize;

    @Value("${cache.caffeine.expire-after-write:30}")
    private int caffeineExpireSeconds;

    @Bean
    public CacheManager cacheManager() {
        CaffeineCacheManager cacheManager = new CaffeineCacheManager(IncidentQueryService.SUMMARY_CACHE);
        cacheManager.setCaffeine(Caffeine.newBuilder()
                .maximumSize(caffeineMaxSize)
                .expireAfterWrite(caffeineExpireSeconds, TimeUnit.SECONDS)
                .recordStats()
        );

        log.info("event=CACHE_CONFIGURED type=caffeine maxSize={} expireAfterWriteSeconds={}",
                caffeineMaxSize, caffeineExpireSeconds);

        return cacheManager;
    }
}
