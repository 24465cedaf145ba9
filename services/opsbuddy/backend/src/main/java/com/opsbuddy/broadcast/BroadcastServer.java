package com.opsbuddy.broadcast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.opsbuddy.config.OpsProperties;
import com.opsbuddy.logging.LogEvent;
import com.opsbuddy.monitor.HealthMonitor;
import com.opsbuddy.monitor.HealthUpdates;
import com.opsbuddy.observability.OpsMetrics;
import com.opsbuddy.relay.PubSubRelay;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 실시간 클라이언트 fan-out (/ws)
 *
 * - Relay 4개 채널을 구독해 구독 중인 모든 클라이언트에 프레임 {type, data, timestamp} 전송
 * - 클라이언트별 bounded outbound 큐 + 전송 작업 1개 (broadcastExecutor)
 *   느린 클라이언트는 worker 1개만 점유하고 다른 클라이언트 전송은 계속 진행
 * - 전송 1건이 send-time-limit을 넘기거나 큐가 가득 차면 즉시 제거
 * - 연속 전송 실패가 max-send-failures에 도달하면 제거
 *
 * 클라이언트 → 서버: {"type":"subscribe"|"unsubscribe", "subscriptions":[...]}, {"type":"ping"}
 */
@Slf4j
@Component
public class BroadcastServer extends TextWebSocketHandler {

    private final PubSubRelay relay;
    private final HealthMonitor healthMonitor;
    private final ObjectMapper objectMapper;
    private final Executor broadcastExecutor;
    private final OpsMetrics metrics;
    private final Clock clock;

    private final OpsProperties.Channels channels;
    private final Duration sendTimeLimit;
    private final int outboundQueueCapacity;
    private final int maxSendFailures;
    private final int maxConnections;

    private final Map<String, ClientConnection> clients = new ConcurrentHashMap<>();

    // 등록만 직렬화, 제거는 clients 맵에서 바로 수행
    private final Object registrationLock = new Object();

    public BroadcastServer(PubSubRelay relay,
                           HealthMonitor healthMonitor,
                           ObjectMapper objectMapper,
                           @Qualifier("broadcastExecutor") Executor broadcastExecutor,
                           OpsMetrics metrics,
                           OpsProperties properties,
                           Clock clock) {
        this.relay = relay;
        this.healthMonitor = healthMonitor;
        this.objectMapper = objectMapper;
        this.broadcastExecutor = broadcastExecutor;
        this.metrics = metrics;
        this.clock = clock;

        OpsProperties.Broadcast broadcast = properties.getBroadcast();
        this.channels = properties.getRelay().getChannels();
        this.sendTimeLimit = broadcast.getSendTimeLimit();
        this.outboundQueueCapacity = broadcast.getOutboundQueueCapacity();
        this.maxSendFailures = broadcast.getMaxSendFailures();
        this.maxConnections = broadcast.getMaxConnections();
    }

    @PostConstruct
    void subscribeToRelay() {
        for (BroadcastTopic topic : BroadcastTopic.values()) {
            relay.subscribe(topic.channel(channels), (channel, message) -> relayToClients(topic, message));
        }
    }

    // ---------------------------------------------------------------------
    // WebSocket lifecycle
    // ---------------------------------------------------------------------

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        ClientConnection client = new ClientConnection(session, outboundQueueCapacity, clock.instant());

        // 등록 전에 opening 프레임을 먼저 쌓아 relay 프레임보다 앞서도록 보장
        Map<String, Object> established = new LinkedHashMap<>();
        established.put("client_id", client.id());
        established.put("subscriptions", topicNames(client));
        preload(client, frame("connection_established", established));
        preload(client, frame("initial_status", initialStatus()));

        int connections = register(client);
        if (connections < 0) {
            log.warn(
                    "event={} sessionId={} connections={} max={}",
                    LogEvent.CLIENT_REJECTED,
                    session.getId(),
                    clients.size(),
                    maxConnections
            );
            session.close(CloseStatus.POLICY_VIOLATION.withReason("too many connections"));
            return;
        }

        log.info(
                "event={} sessionId={} remote={} connections={}",
                LogEvent.CLIENT_CONNECTED,
                client.id(),
                session.getRemoteAddress(),
                connections
        );

        scheduleDrain(client);
    }

    /**
     * 연결 수 상한 검사와 등록을 한 번에 수행
     * @return 등록 후 연결 수, 상한 초과면 -1
     */
    private int register(ClientConnection client) {
        synchronized (registrationLock) {
            if (clients.size() >= maxConnections) {
                return -1;
            }
            clients.put(client.id(), client);
            return clients.size();
        }
    }

    private void preload(ClientConnection client, String payload) {
        if (payload != null && !client.enqueue(payload)) {
            log.warn("event=OPENING_FRAME_DROPPED sessionId={} capacity={}", client.id(), outboundQueueCapacity);
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ClientConnection client = clients.get(session.getId());
        if (client == null) {
            return;
        }

        JsonNode request;
        try {
            request = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            dispatch(client, frame("error", Map.of("message", "invalid JSON")));
            return;
        }

        String type = request.path("type").asText("");

        switch (type) {
            case "subscribe" -> {
                List<BroadcastTopic> topics = topicsOf(request, List.of(BroadcastTopic.HEALTH));
                client.subscribe(topics);
                dispatch(client, frame("subscription_confirmed", Map.of("subscriptions", topicNames(client))));
            }
            case "unsubscribe" -> {
                client.unsubscribe(topicsOf(request, List.of()));
                dispatch(client, frame("unsubscription_confirmed", Map.of("subscriptions", topicNames(client))));
            }
            case "ping" -> dispatch(client, frame("pong", null));
            default -> {
                log.debug("event=CLIENT_MESSAGE_IGNORED sessionId={} type={}", client.id(), type);
                dispatch(client, frame("error", Map.of("message", "unknown message type: " + type)));
            }
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        ClientConnection client = clients.remove(session.getId());
        if (client != null) {
            log.warn(
                    "event={} sessionId={} reason=transport_error message={}",
                    LogEvent.CLIENT_DISCONNECTED,
                    session.getId(),
                    exception.getMessage()
            );
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ClientConnection client = clients.remove(session.getId());
        if (client != null) {
            log.info(
                    "event={} sessionId={} code={} connections={}",
                    LogEvent.CLIENT_DISCONNECTED,
                    session.getId(),
                    status.getCode(),
                    clients.size()
            );
        }
    }

    // ---------------------------------------------------------------------
    // fan-out
    // ---------------------------------------------------------------------

    /**
     * Relay 메시지 1건을 구독 중인 모든 클라이언트에 전송
     * @return 전송을 시작한 클라이언트 수
     */
    public int relayToClients(BroadcastTopic topic, String message) {
        JsonNode data;
        try {
            data = objectMapper.readTree(message);
        } catch (JsonProcessingException e) {
            data = TextNode.valueOf(message);
        }
        return broadcast(topic, frame(topic.frameType(), data));
    }

    int broadcast(BroadcastTopic topic, String payload) {
        if (payload == null) {
            return 0;
        }
        int dispatched = 0;
        for (ClientConnection client : clients.values()) {
            if (client.isSubscribed(topic)) {
                dispatch(client, payload);
                dispatched++;
            }
        }
        return dispatched;
    }

    /**
     * 클라이언트 outbound 큐에 프레임 추가 후 전송 작업 예약
     * - 호출 스레드(Relay 구독 / 요청 처리)는 소켓 쓰기를 기다리지 않음
     */
    private void dispatch(ClientConnection client, String payload) {
        if (payload == null) {
            return;
        }
        if (client.isStalled(sendTimeLimit)) {
            metrics.broadcastSendFailure();
            prune(client, "send_timeout", "send exceeded " + sendTimeLimit.toMillis() + "ms");
            return;
        }
        if (!client.enqueue(payload)) {
            metrics.broadcastSendFailure();
            prune(client, "outbound_queue_full", "capacity " + outboundQueueCapacity);
            return;
        }
        scheduleDrain(client);
    }

    private void scheduleDrain(ClientConnection client) {
        if (!client.tryStartDrain()) {
            return;
        }
        try {
            broadcastExecutor.execute(() -> drain(client));
        } catch (RejectedExecutionException e) {
            // 종료 중
            client.finishDrain();
            log.debug("event=BROADCAST_REJECTED sessionId={}", client.id());
        }
    }

    private void drain(ClientConnection client) {
        try {
            String payload;
            while (isConnected(client) && (payload = client.nextFrame()) != null) {
                sendTo(client, payload);
            }
        } finally {
            client.finishDrain();
        }

        // finishDrain 직전에 들어온 프레임
        if (isConnected(client) && client.hasPendingFrames()) {
            scheduleDrain(client);
        }
    }

    private void sendTo(ClientConnection client, String payload) {
        try {
            client.send(payload);
        } catch (IOException | RuntimeException e) {
            metrics.broadcastSendFailure();
            int failures = client.recordFailure();
            log.debug("event=BROADCAST_SEND_FAILED sessionId={} failures={} message={}",
                    client.id(), failures, e.getMessage());
            if (failures >= maxSendFailures) {
                prune(client, "send_failures", e.getMessage());
            }
        }
    }

    private boolean isConnected(ClientConnection client) {
        return clients.get(client.id()) == client;
    }

    private void prune(ClientConnection client, String reason, String detail) {
        if (!clients.remove(client.id(), client)) {
            return;
        }
        client.discardPendingFrames();

        log.warn(
                "event={} sessionId={} reason={} detail={} connections={}",
                LogEvent.CLIENT_PRUNED,
                client.id(),
                reason,
                detail,
                clients.size()
        );

        // 멈춘 소켓의 close는 블로킹될 수 있으므로 호출 스레드에서 분리
        try {
            broadcastExecutor.execute(() -> close(client));
        } catch (RejectedExecutionException e) {
            close(client);
        }
    }

    private void close(ClientConnection client) {
        try {
            client.session().close(CloseStatus.SESSION_NOT_RELIABLE);
        } catch (IOException | RuntimeException e) {
            log.debug("event=CLIENT_CLOSE_FAILED sessionId={} message={}", client.id(), e.getMessage());
        }
    }

    // ---------------------------------------------------------------------
    // frames
    // ---------------------------------------------------------------------

    private String frame(String type, Object data) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", type);
        frame.put("data", data);
        frame.put("timestamp", clock.instant().toString());
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            log.error("event=FRAME_SERIALIZATION_FAILED type={} message={}", type, e.getMessage(), e);
            return null;
        }
    }

    private Map<String, Object> initialStatus() {
        Map<String, Object> services = new LinkedHashMap<>();
        healthMonitor.snapshot().forEach(record -> services.put(record.name(), HealthUpdates.toStatus(record)));

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("summary", healthMonitor.summary());
        status.put("services", services);
        return status;
    }

    private static List<BroadcastTopic> topicsOf(JsonNode request, List<BroadcastTopic> defaults) {
        JsonNode subscriptions = request.get("subscriptions");
        if (subscriptions == null || !subscriptions.isArray()) {
            return defaults;
        }
        List<BroadcastTopic> topics = new ArrayList<>();
        // 알 수 없는 토픽은 무시
        subscriptions.forEach(node -> BroadcastTopic.fromTopicName(node.asText()).ifPresent(topics::add));
        return topics;
    }

    private static List<String> topicNames(ClientConnection client) {
        return client.subscriptions().stream()
                .sorted()
                .map(BroadcastTopic::topicName)
                .toList();
    }

    public int connectionCount() {
        return clients.size();
    }
}
