package com.opsbuddy.relay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsbuddy.exception.BrokerException;
import com.opsbuddy.logging.LogEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 객체를 JSON으로 직렬화해 발행
 * - 발행 실패는 로그만 남기고 버림 (주기 작업은 계속 진행)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RelayPublisher {

    private final PubSubRelay relay;
    private final ObjectMapper objectMapper;

    /**
     * @return 브로커에 전달했으면 true
     */
    public boolean publish(String channel, Object payload) {
        String message;
        try {
            message = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.error(
                    "event={} channel={} reason=serialization message={}",
                    LogEvent.PUBLISH_FAILED,
                    channel,
                    e.getMessage(),
                    e
            );
            return false;
        }

        try {
            relay.publish(channel, message);
            return true;
        } catch (BrokerException e) {
            log.warn(
                    "event={} channel={} message={}",
                    LogEvent.PUBLISH_FAILED,
                    channel,
                    e.getMessage()
            );
            return false;
        }
    }
}
