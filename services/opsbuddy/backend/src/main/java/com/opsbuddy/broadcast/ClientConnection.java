package com.opsbuddy.broadcast;

import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 실시간 클라이언트 1개 (소켓 수명과 동일)
 *
 * - 프레임은 bounded outbound 큐에 쌓이고, 큐당 전송 작업은 최대 1개 (single writer, 발행 순서 유지)
 * - 연결 직후 모든 토픽 구독
 */
final class ClientConnection {

    private final WebSocketSession session;
    private final Instant connectedAt;
    private final Set<BroadcastTopic> subscriptions = ConcurrentHashMap.newKeySet();

    private final BlockingQueue<String> outbound;
    private final AtomicBoolean draining = new AtomicBoolean();
    private final AtomicInteger consecutiveFailures = new AtomicInteger();

    // 진행 중인 sendMessage 시작 시각 (0: 전송 중 아님)
    private volatile long sendStartedNanos;

    ClientConnection(WebSocketSession session, int outboundCapacity, Instant connectedAt) {
        this.session = session;
        this.connectedAt = connectedAt;
        this.outbound = new ArrayBlockingQueue<>(outboundCapacity);
        this.subscriptions.addAll(EnumSet.allOf(BroadcastTopic.class));
    }

    String id() {
        return session.getId();
    }

    WebSocketSession session() {
        return session;
    }

    Instant connectedAt() {
        return connectedAt;
    }

    boolean isSubscribed(BroadcastTopic topic) {
        return subscriptions.contains(topic);
    }

    void subscribe(Collection<BroadcastTopic> topics) {
        subscriptions.addAll(topics);
    }

    void unsubscribe(Collection<BroadcastTopic> topics) {
        subscriptions.removeAll(topics);
    }

    Set<BroadcastTopic> subscriptions() {
        return Set.copyOf(subscriptions);
    }

    /**
     * @return 큐가 가득 차 넣지 못했으면 false
     */
    boolean enqueue(String payload) {
        return outbound.offer(payload);
    }

    String nextFrame() {
        return outbound.poll();
    }

    boolean hasPendingFrames() {
        return !outbound.isEmpty();
    }

    void discardPendingFrames() {
        outbound.clear();
    }

    /**
     * 전송 작업 점유 (이미 다른 작업이 전송 중이면 false)
     */
    boolean tryStartDrain() {
        return draining.compareAndSet(false, true);
    }

    void finishDrain() {
        draining.set(false);
    }

    /**
     * 현재 진행 중인 전송이 limit보다 오래 걸리고 있는지
     */
    boolean isStalled(Duration limit) {
        long started = sendStartedNanos;
        return started != 0 && System.nanoTime() - started > limit.toNanos();
    }

    void send(String payload) throws IOException {
        sendStartedNanos = System.nanoTime();
        try {
            session.sendMessage(new TextMessage(payload));
            consecutiveFailures.set(0);
        } finally {
            sendStartedNanos = 0;
        }
    }

    int recordFailure() {
        return consecutiveFailures.incrementAndGet();
    }
}
