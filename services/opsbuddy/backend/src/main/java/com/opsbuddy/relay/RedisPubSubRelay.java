package com.opsbuddy.relay;

import com.opsbuddy.exception.BrokerException;
import com.opsbuddy.logging.LogEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.nio.charset.StandardCharsets;

/**
 * Redis Pub/Sub Relay (opsbuddy.relay.type=redis)
 *
 * - publish : StringRedisTemplate.convertAndSend (JSON 문자열 그대로 전달)
 * - subscribe : RedisMessageListenerContainer에 채널 리스너 등록
 *   연결이 끊기면 컨테이너가 recovery interval 간격으로 재연결 + 재구독
 */
@Slf4j
@RequiredArgsConstructor
public class RedisPubSubRelay implements PubSubRelay {

    private final StringRedisTemplate redisTemplate;
    private final RedisMessageListenerContainer listenerContainer;

    @Override
    public void publish(String channel, String message) {
        try {
            redisTemplate.convertAndSend(channel, message);
        } catch (DataAccessException e) {
            throw new BrokerException("failed to publish to channel " + channel, e);
        }
    }

    @Override
    public void subscribe(String channel, RelayMessageHandler handler) {
        listenerContainer.addMessageListener(
                (message, pattern) -> {
                    String body = new String(message.getBody(), StandardCharsets.UTF_8);
                    try {
                        handler.onMessage(channel, body);
                    } catch (RuntimeException e) {
                        log.warn(
                                "event={} channel={} message={}",
                                LogEvent.SUBSCRIBER_FAILED,
                                channel,
                                e.getMessage()
                        );
                    }
                },
                new ChannelTopic(channel)
        );
        log.info("event=RELAY_SUBSCRIBED channel={} type=redis", channel);
    }
}
