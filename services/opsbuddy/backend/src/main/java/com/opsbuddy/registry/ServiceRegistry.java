package com.opsbuddy.registry;

import com.opsbuddy.breaker.ServiceCircuitBreaker;
import com.opsbuddy.domain.ServiceDescriptor;
import com.opsbuddy.exception.ConfigurationException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * 기동 시 1회 생성되는 서비스 레지스트리 (프로세스 수명 동안 불변)
 *
 * - 서비스 정의, 라우팅 테이블, 서비스별 CircuitBreaker를 보관
 * - Gateway / HealthMonitor가 같은 핸들을 주입받아 사용
 */
public final class ServiceRegistry {

    private final Map<String, ServiceDescriptor> descriptors;
    private final Map<String, ServiceCircuitBreaker> breakers;
    private final RoutingTable routingTable;

    public ServiceRegistry(Collection<ServiceDescriptor> services,
                           Function<ServiceDescriptor, ServiceCircuitBreaker> breakerFactory) {
        Map<String, ServiceDescriptor> byName = new LinkedHashMap<>();
        Map<String, ServiceCircuitBreaker> breakerByName = new LinkedHashMap<>();
        Map<String, String> routes = new LinkedHashMap<>();

        for (ServiceDescriptor descriptor : services) {
            if (byName.putIfAbsent(descriptor.name(), descriptor) != null) {
                throw new IllegalArgumentException("duplicate service name: " + descriptor.name());
            }
            breakerByName.put(descriptor.name(), breakerFactory.apply(descriptor));

            for (String prefix : descriptor.routes()) {
                String previous = routes.putIfAbsent(prefix, descriptor.name());
                if (previous != null) {
                    throw new IllegalArgumentException(
                            "route " + prefix + " is claimed by both " + previous + " and " + descriptor.name());
                }
            }
        }

        this.descriptors = Collections.unmodifiableMap(byName);
        this.breakers = Collections.unmodifiableMap(breakerByName);
        this.routingTable = new RoutingTable(routes);
    }

    public Collection<ServiceDescriptor> services() {
        return descriptors.values();
    }

    public Optional<ServiceDescriptor> find(String name) {
        return Optional.ofNullable(descriptors.get(name));
    }

    public ServiceDescriptor require(String name) {
        return find(name).orElseThrow(() -> ConfigurationException.serviceNotFound(name));
    }

    public ServiceCircuitBreaker breaker(String name) {
        ServiceCircuitBreaker breaker = breakers.get(name);
        if (breaker == null) {
            throw ConfigurationException.serviceNotFound(name);
        }
        return breaker;
    }

    public Map<String, ServiceCircuitBreaker> breakers() {
        return breakers;
    }

    public RoutingTable routingTable() {
        return routingTable;
    }
}
