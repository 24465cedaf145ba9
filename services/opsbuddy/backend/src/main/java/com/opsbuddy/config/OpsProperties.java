package com.opsbuddy.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * opsbuddy.* 설정 바인딩
 *
 * - services : 게이트웨이 라우팅 / 헬스 모니터링 대상 (기동 시 ServiceRegistry로 고정)
 * - monitor / detector : 주기 작업 설정
 * - relay / broadcast : Pub/Sub 및 실시간 전송 설정
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "opsbuddy")
public class OpsProperties {

    private Gateway gateway = new Gateway();
    private List<Service> services = new ArrayList<>();
    private Monitor monitor = new Monitor();
    private Detector detector = new Detector();
    private Relay relay = new Relay();
    private Broadcast broadcast = new Broadcast();

    @Getter
    @Setter
    public static class Gateway {
        private String name = "OpsBuddy API Gateway";
        private String version = "1.0.0";

        // OPEN 유지 시간 (모든 서비스 공통)
        private Duration circuitBreakerCooldown = Duration.ofSeconds(60);

        private int rateLimitCapacity = 40;
        private int rateLimitRefillPerSecond = 20;
    }

    @Getter
    @Setter
    public static class Service {
        private String name;
        private String baseUrl;
        private String healthPath = "/health";
        private Duration timeout = Duration.ofSeconds(30);
        private int retries = 0;
        private int breakerThreshold = 5;
        private String group;
        private List<String> routes = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Monitor {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration interval = Duration.ofSeconds(30);
        private Duration probeTimeout = Duration.ofSeconds(10);
    }

    @Getter
    @Setter
    public static class Detector {
        private Duration initialDelay = Duration.ofSeconds(5);
        private Duration interval = Duration.ofSeconds(30);

        // checkpoint 이전으로 되돌아가 다시 조회하는 구간 (store/detector 시계 차이 보정)
        private Duration overlap = Duration.ofSeconds(5);

        private int batchSize = 1000;

        // 한 사이클에서 읽는 최대 페이지 수, 초과분은 다음 사이클에 커서부터 이어서 조회
        private int maxPagesPerCycle = 10;

        // 로그 스토어 쿼리 타임아웃 (JPA 전역 힌트)
        private Duration queryTimeout = Duration.ofSeconds(10);

        private List<String> levels = new ArrayList<>(List.of("ERROR", "CRITICAL", "FATAL"));
    }

    @Getter
    @Setter
    public static class Relay {
        private String type = "redis";
        private Duration recoveryInterval = Duration.ofSeconds(5);
        private Channels channels = new Channels();
    }

    @Getter
    @Setter
    public static class Channels {
        private String health = "service_health";
        private String incidents = "incidents";
        private String analytics = "analytics_updates";
        private String errors = "error_logs";
    }

    @Getter
    @Setter
    public static class Broadcast {
        // 전송 1건 상한 (초과 시 클라이언트 제거)
        private Duration sendTimeLimit = Duration.ofSeconds(2);

        // 클라이언트별 미전송 프레임 상한
        private int outboundQueueCapacity = 256;
        private int maxSendFailures = 3;
        private int maxConnections = 1000;
        private int senderPoolSize = 16;
    }
}
