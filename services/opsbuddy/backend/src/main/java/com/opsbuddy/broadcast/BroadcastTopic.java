package com.opsbuddy.broadcast;

import com.opsbuddy.config.OpsProperties;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.Function;

/**
 * 클라이언트 구독 토픽 ↔ Relay 채널 ↔ 전송 프레임 type
 */
public enum BroadcastTopic {

    HEALTH("health_updates", "health_update", OpsProperties.Channels::getHealth),
    INCIDENTS("incident_updates", "incident_update", OpsProperties.Channels::getIncidents),
    ANALYTICS("analytics_updates", "analytics_update", OpsProperties.Channels::getAnalytics),
    ERRORS("error_logs", "error_log", OpsProperties.Channels::getErrors);

    private final String topicName;
    private final String frameType;
    private final Function<OpsProperties.Channels, String> channel;

    BroadcastTopic(String topicName, String frameType, Function<OpsProperties.Channels, String> channel) {
        this.topicName = topicName;
        this.frameType = frameType;
        this.channel = channel;
    }

    public String topicName() {
        return topicName;
    }

    public String frameType() {
        return frameType;
    }

    public String channel(OpsProperties.Channels channels) {
        return channel.apply(channels);
    }

    public static Optional<BroadcastTopic> fromTopicName(String name) {
        return Arrays.stream(values())
                .filter(topic -> topic.topicName.equals(name))
                .findFirst();
    }
}
