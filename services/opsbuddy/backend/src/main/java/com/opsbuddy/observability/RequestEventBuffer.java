package com.opsbuddy.observability;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * 최근 게이트웨이 요청 이벤트를 저장하는 메모리 Ring Buffer
 * - 최대 200건 유지, 최신 순 조회
 */
@Component
public class RequestEventBuffer {

    private static final int MAX_SIZE = 200;

    private final ConcurrentLinkedDeque<RequestEvent> buffer =
            new ConcurrentLinkedDeque<>();

    public synchronized void add(RequestEvent event) {
        buffer.addFirst(event);

        // MAX_SIZE를 초과하는 순간 즉시 제거
        while (buffer.size() > MAX_SIZE) {
            buffer.removeLast();
        }
    }

    public List<RequestEvent> getRecent(int limit) {
        return buffer.stream().limit(Math.max(0, limit)).toList();
    }

    public int size() {
        return buffer.size();
    }
}
