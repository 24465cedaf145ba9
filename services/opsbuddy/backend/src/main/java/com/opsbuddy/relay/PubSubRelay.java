package com.opsbuddy.relay;

import com.opsbuddy.exception.BrokerException;

/**
 * 채널 단위 publish / subscribe
 *
 * - best-effort, at-most-once (구독 이전 발행 메시지는 받지 못함)
 * - 같은 발행자의 같은 채널 메시지는 순서 보장, 채널 간 순서는 보장하지 않음
 * - 브로커 재연결 시 구독은 자동 복구, 단절 구간 메시지는 유실
 */
public interface PubSubRelay {

    /**
     * @throws BrokerException 브로커에 전달하지 못한 경우
     */
    void publish(String channel, String message);

    void subscribe(String channel, RelayMessageHandler handler);
}
