package com.opsbuddy.gateway;

import com.opsbuddy.breaker.BreakerState;
import com.opsbuddy.domain.ServiceDescriptor;
import com.opsbuddy.exception.CircuitOpenException;
import com.opsbuddy.exception.ConfigurationException;
import com.opsbuddy.exception.TransportException;
import com.opsbuddy.exception.UpstreamException;
import com.opsbuddy.logging.LogEvent;
import com.opsbuddy.observability.RequestEvent;
import com.opsbuddy.observability.RequestEventBuffer;
import com.opsbuddy.registry.ServiceRegistry;
import com.opsbuddy.support.FakeUpstream;
import com.opsbuddy.support.Ports;
import com.opsbuddy.support.TestFixtures;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RequestRouter")
class RequestRouterTest {

    private FakeUpstream upstream;
    private RequestEventBuffer events;
    private SimpleMeterRegistry meters;

    @BeforeEach
    void setUp() {
        upstream = FakeUpstream.start();
        events = new RequestEventBuffer();
        meters = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        upstream.close();
    }

    private ServiceDescriptor files(String baseUrl, Duration timeout, int retries) {
        return new ServiceDescriptor("file-service", baseUrl, "/health", timeout, retries, 3, "core",
                List.of("/api/files"));
    }

    private RequestRouter router(ServiceRegistry registry) {
        return new RequestRouter(
                registry,
                new UpstreamClient(registry, new RestTemplateBuilder()),
                events,
                TestFixtures.metrics(meters),
                RetryRegistry.ofDefaults()
        );
    }

    private RequestRouter router(ServiceDescriptor descriptor) {
        return router(TestFixtures.registry(Duration.ofSeconds(60), descriptor));
    }

    private static ForwardRequest get(String path, String query) {
        return new ForwardRequest(HttpMethod.GET, path, query, new HttpHeaders(), null, "10.0.0.7", "trace-1");
    }

    @Test
    @DisplayName("method / path / query / body를 그대로 전달하고 응답을 그대로 반환")
    void forwardsRequestAndRelaysResponse() {
        // given
        upstream.respond(201, "{\"id\":42}");
        RequestRouter router = router(files(upstream.baseUrl(), Duration.ofSeconds(2), 0));

        HttpHeaders headers = new HttpHeaders();
        headers.add("X-Custom", "yes");
        headers.add("Content-Type", "application/json");
        headers.add("Keep-Alive", "timeout=5");
        headers.add("X-Forwarded-For", "203.0.113.9");

        ForwardRequest request = new ForwardRequest(
                HttpMethod.POST,
                "/api/files/upload",
                "name=a%20b&x=1",
                headers,
                "{\"name\":\"a\"}".getBytes(StandardCharsets.UTF_8),
                "10.0.0.7",
                "trace-1"
        );

        // when
        ResponseEntity<byte[]> response = router.route(request);

        // then
        assertThat(response.getStatusCode().value()).isEqualTo(201);
        assertThat(new String(response.getBody(), StandardCharsets.UTF_8)).isEqualTo("{\"id\":42}");
        assertThat(response.getHeaders().getFirst("X-Upstream")).isEqualTo("fake");

        FakeUpstream.Recorded received = upstream.lastRequest();
        assertThat(received.method()).isEqualTo("POST");
        assertThat(received.path()).isEqualTo("/api/files/upload");
        assertThat(received.query()).isEqualTo("name=a%20b&x=1");
        assertThat(received.body()).isEqualTo("{\"name\":\"a\"}");
        assertThat(received.header("X-Custom")).isEqualTo("yes");
        assertThat(received.header("Keep-Alive")).isNull();
        assertThat(received.header("X-Forwarded-For")).isEqualTo("203.0.113.9, 10.0.0.7");
        assertThat(received.header("X-Trace-Id")).isEqualTo("trace-1");

        RequestEvent event = events.getRecent(1).get(0);
        assertThat(event.event()).isEqualTo(LogEvent.GATEWAY_FORWARDED);
        assertThat(event.target()).isEqualTo("file-service");
        assertThat(event.status()).isEqualTo(201);
        assertThat(meters.counter("gateway_forwarded_total").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("4xx 응답은 그대로 반환하고 CircuitBreaker에는 성공으로 보고")
    void clientErrorsAreRelayedAsSuccess() {
        upstream.respond(404, "{\"detail\":\"not found\"}");
        ServiceRegistry registry = TestFixtures.registry(Duration.ofSeconds(60),
                files(upstream.baseUrl(), Duration.ofSeconds(2), 0));
        RequestRouter router = router(registry);

        for (int i = 0; i < 5; i++) {
            ResponseEntity<byte[]> response = router.route(get("/api/files/missing", null));
            assertThat(response.getStatusCode().value()).isEqualTo(404);
        }

        assertThat(registry.breaker("file-service").getState()).isEqualTo(BreakerState.CLOSED);
        assertThat(registry.breaker("file-service").getFailureCount()).isZero();
    }

    @Test
    @DisplayName("5xx가 임계치만큼 연속되면 이후 요청은 업스트림 호출 없이 503")
    void opensCircuitAfterConsecutiveServerErrors() {
        // given
        upstream.respond(500, "{\"error\":\"boom\"}");
        ServiceRegistry registry = TestFixtures.registry(Duration.ofSeconds(60),
                files(upstream.baseUrl(), Duration.ofSeconds(2), 0));
        RequestRouter router = router(registry);

        // when
        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> router.route(get("/api/files/1", null)))
                    .isInstanceOf(UpstreamException.class)
                    .satisfies(e -> assertThat(((UpstreamException) e).getStatus().value()).isEqualTo(502));
        }

        // then
        assertThatThrownBy(() -> router.route(get("/api/files/1", null)))
                .isInstanceOf(CircuitOpenException.class)
                .satisfies(e -> assertThat(((CircuitOpenException) e).getStatus().value()).isEqualTo(503));

        assertThat(upstream.hits()).isEqualTo(3);
        assertThat(registry.breaker("file-service").getState()).isEqualTo(BreakerState.OPEN);
        assertThat(events.getRecent(1).get(0).event()).isEqualTo("CIRCUIT_OPEN");
        assertThat(meters.counter("gateway_circuit_rejected_total").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("업스트림 응답 지연이 timeout을 넘으면 504")
    void timeoutBecomesGatewayTimeout() {
        upstream.respondSlowly(200, "{}", Duration.ofSeconds(2));
        RequestRouter router = router(files(upstream.baseUrl(), Duration.ofMillis(300), 0));

        assertThatThrownBy(() -> router.route(get("/api/files/slow", null)))
                .isInstanceOfSatisfying(TransportException.class, e -> {
                    assertThat(e.isTimeout()).isTrue();
                    assertThat(e.getStatus().value()).isEqualTo(504);
                    assertThat(e.getCode()).isEqualTo("UPSTREAM_TIMEOUT");
                });
    }

    @Test
    @DisplayName("연결 실패는 502")
    void connectionRefusedBecomesBadGateway() {
        RequestRouter router = router(files("http://127.0.0.1:" + Ports.closedPort(), Duration.ofSeconds(1), 0));

        assertThatThrownBy(() -> router.route(get("/api/files/1", null)))
                .isInstanceOfSatisfying(TransportException.class, e -> {
                    assertThat(e.isTimeout()).isFalse();
                    assertThat(e.getStatus().value()).isEqualTo(502);
                    assertThat(e.getCode()).isEqualTo("UPSTREAM_UNREACHABLE");
                });
    }

    @Test
    @DisplayName("매칭되는 라우트가 없으면 404, 업스트림 호출 없음")
    void unknownRouteIsNotFound() {
        RequestRouter router = router(files(upstream.baseUrl(), Duration.ofSeconds(1), 0));

        assertThatThrownBy(() -> router.route(get("/api/unknown/1", null)))
                .isInstanceOfSatisfying(ConfigurationException.class, e -> {
                    assertThat(e.getStatus().value()).isEqualTo(404);
                    assertThat(e.getCode()).isEqualTo("ROUTE_NOT_FOUND");
                });

        assertThat(upstream.hits()).isZero();
        RequestEvent event = events.getRecent(1).get(0);
        assertThat(event.target()).isNull();
        assertThat(event.status()).isEqualTo(404);
    }

    @Test
    @DisplayName("GET transport 실패는 retries만큼 재시도, CircuitBreaker 보고는 1회")
    void retriesIdempotentReadsOnTransportFailure() {
        upstream.respondSlowly(200, "{}", Duration.ofSeconds(1));
        ServiceRegistry registry = TestFixtures.registry(Duration.ofSeconds(60),
                files(upstream.baseUrl(), Duration.ofMillis(200), 1));
        RequestRouter router = router(registry);

        assertThatThrownBy(() -> router.route(get("/api/files/1", null)))
                .isInstanceOf(TransportException.class);

        assertThat(upstream.hits()).isEqualTo(2);
        assertThat(registry.breaker("file-service").getFailureCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("POST는 재시도하지 않음")
    void doesNotRetryWrites() {
        upstream.respondSlowly(200, "{}", Duration.ofSeconds(1));
        RequestRouter router = router(files(upstream.baseUrl(), Duration.ofMillis(200), 2));

        ForwardRequest post = new ForwardRequest(HttpMethod.POST, "/api/files", null, new HttpHeaders(),
                "x".getBytes(StandardCharsets.UTF_8), "10.0.0.7", "trace-1");

        assertThatThrownBy(() -> router.route(post)).isInstanceOf(TransportException.class);

        assertThat(upstream.hits()).isEqualTo(1);
    }

    @Test
    @DisplayName("업스트림 URL 조립")
    void buildsUpstreamUri() {
        ServiceDescriptor descriptor = files("http://files:8001/", Duration.ofSeconds(1), 0);

        assertThat(RequestRouter.buildUri(descriptor, get("/api/files/a%2Fb", "q=1")).toString())
                .isEqualTo("http://files:8001/api/files/a%2Fb?q=1");
        assertThat(RequestRouter.buildUri(descriptor, get("/api/files", "")).toString())
                .isEqualTo("http://files:8001/api/files");
    }
}
