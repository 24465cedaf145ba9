package com.opsbuddy.config;

import com.opsbuddy.relay.InMemoryPubSubRelay;
import com.opsbuddy.relay.PubSubRelay;
import com.opsbuddy.relay.RedisPubSubRelay;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

/**
 * Pub/Sub Relay 구성
 * - opsbuddy.relay.type=redis (기본) : Redis 브로커
 * - opsbuddy.relay.type=in-memory    : 단일 프로세스 (로컬 실행 / 테스트)
 */
@Slf4j
@Configuration
public class RelayConfig {

    @Configuration
    @ConditionalOnProperty(prefix = "opsbuddy.relay", name = "type", havingValue = "redis", matchIfMissing = true)
    static class RedisRelayConfig {

        /**
         * 구독 컨테이너
         * - 연결 실패 시 recovery interval 간격으로 재연결 후 기존 채널 재구독
         */
        @Bean
        public RedisMessageListenerContainer redisMessageListenerContainer(RedisConnectionFactory connectionFactory,
                                                                           OpsProperties properties) {
            RedisMessageListenerContainer container = new RedisMessageListenerContainer();
            container.setConnectionFactory(connectionFactory);
            container.setRecoveryInterval(properties.getRelay().getRecoveryInterval().toMillis());
            return container;
        }

        @Bean
        public PubSubRelay redisPubSubRelay(StringRedisTemplate stringRedisTemplate,
                                            RedisMessageListenerContainer redisMessageListenerContainer) {
            log.info("event=RELAY_CONFIGURED type=redis");
            return new RedisPubSubRelay(stringRedisTemplate, redisMessageListenerContainer);
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "opsbuddy.relay", name = "type", havingValue = "in-memory")
    static class InMemoryRelayConfig {

        @Bean
        public PubSubRelay inMemoryPubSubRelay() {
            log.info("event=RELAY_CONFIGURED type=in-memory");
            return new InMemoryPubSubRelay();
        }
    }
}
