package com.opsbuddy.relay;

import com.opsbuddy.logging.LogEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 단일 프로세스 Relay (opsbuddy.relay.type=in-memory)
 * - 발행 스레드에서 구독자를 순서대로 호출 (채널별 발행 순서 유지)
 * - 구독자 예외는 다른 구독자 전달에 영향 없음
 */
@Slf4j
public class InMemoryPubSubRelay implements PubSubRelay {

    private final Map<String, List<RelayMessageHandler>> handlers = new ConcurrentHashMap<>();

    @Override
    public void publish(String channel, String message) {
        List<RelayMessageHandler> subscribers = handlers.get(channel);
        if (subscribers == null) {
            return;
        }
        for (RelayMessageHandler handler : subscribers) {
            try {
                handler.onMessage(channel, message);
            } catch (RuntimeException e) {
                log.warn(
                        "event={} channel={} message={}",
                        LogEvent.SUBSCRIBER_FAILED,
                        channel,
                        e.getMessage()
                );
            }
        }
    }

    @Override
    public void subscribe(String channel, RelayMessageHandler handler) {
        handlers.computeIfAbsent(channel, key -> new CopyOnWriteArrayList<>()).add(handler);
        log.info("event=RELAY_SUBSCRIBED channel={} type=in-memory", channel);
    }
}
