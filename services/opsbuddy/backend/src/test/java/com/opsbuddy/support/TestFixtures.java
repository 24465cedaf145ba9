package com.opsbuddy.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsbuddy.breaker.ServiceCircuitBreaker;
import com.opsbuddy.config.OpsProperties;
import com.opsbuddy.domain.ServiceDescriptor;
import com.opsbuddy.observability.OpsMetrics;
import com.opsbuddy.registry.ServiceRegistry;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.time.Duration;
import java.util.List;

/**
 * 단위 테스트 공용 객체
 */
public final class TestFixtures {

    private TestFixtures() {
    }

    public static ObjectMapper objectMapper() {
        return Jackson2ObjectMapperBuilder.json().build();
    }

    public static OpsMetrics metrics(MeterRegistry registry) {
        return new OpsMetrics(
                Counter.builder("gateway_forwarded_total").register(registry),
                Counter.builder("gateway_circuit_rejected_total").register(registry),
                Counter.builder("gateway_upstream_failure_total").register(registry),
                Counter.builder("incident_emitted_total").register(registry),
                Counter.builder("broadcast_send_failure_total").register(registry),
                Timer.builder("health_probe_duration").register(registry)
        );
    }

    public static OpsMetrics metrics() {
        return metrics(new SimpleMeterRegistry());
    }

    public static ServiceDescriptor service(String name, String baseUrl, String... routes) {
        return new ServiceDescriptor(name, baseUrl, "/health", Duration.ofSeconds(2), 0, 3, null, List.of(routes));
    }

    public static ServiceRegistry registry(Duration cooldown, ServiceDescriptor... services) {
        CircuitBreakerRegistry breakers = CircuitBreakerRegistry.ofDefaults();
        return new ServiceRegistry(
                List.of(services),
                d -> ServiceCircuitBreaker.create(breakers, d.name(), d.breakerThreshold(), cooldown)
        );
    }

    public static OpsProperties properties() {
        return new OpsProperties();
    }
}
