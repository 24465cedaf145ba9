package com.opsbuddy.config;

import com.opsbuddy.breaker.ServiceCircuitBreaker;
import com.opsbuddy.domain.ServiceDescriptor;
import com.opsbuddy.registry.ServiceRegistry;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

/**
 * 서비스 레지스트리 구성
 * - opsbuddy.services 설정을 ServiceDescriptor로 고정하고 서비스별 CircuitBreaker 생성
 */
@Slf4j
@Configuration
public class RegistryConfig {

    @Bean
    public ServiceRegistry serviceRegistry(OpsProperties properties,
                                           CircuitBreakerRegistry circuitBreakerRegistry) {

        List<ServiceDescriptor> descriptors = properties.getServices().stream()
                .map(RegistryConfig::toDescriptor)
                .toList();

        Duration cooldown = properties.getGateway().getCircuitBreakerCooldown();

        ServiceRegistry registry = new ServiceRegistry(
                descriptors,
                d -> ServiceCircuitBreaker.create(
                        circuitBreakerRegistry,
                        d.name(),
                        d.breakerThreshold(),
                        cooldown
                )
        );

        log.info(
                "event=REGISTRY_READY services={} routes={}",
                descriptors.stream().map(ServiceDescriptor::name).toList(),
                registry.routingTable().routes()
        );

        return registry;
    }

    static ServiceDescriptor toDescriptor(OpsProperties.Service service) {
        return new ServiceDescriptor(
                service.getName(),
                service.getBaseUrl(),
                service.getHealthPath(),
                service.getTimeout(),
                service.getRetries(),
                service.getBreakerThreshold(),
                service.getGroup(),
                service.getRoutes()
        );
    }
}
