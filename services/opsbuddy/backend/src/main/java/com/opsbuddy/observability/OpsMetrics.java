package com.opsbuddy.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 게이트웨이 / 모니터 / 탐지기 / 브로드캐스트 공통 계측 지점
 * - Counter / Timer 정의는 MetricsConfig 담당
 */
@Component
@RequiredArgsConstructor
public class OpsMetrics {

    // 업스트림으로 전달되어 < 500 응답을 받은 요청
    private final Counter gatewayForwardedCounter;

    // CircuitBreaker OPEN으로 업스트림 호출 없이 차단된 요청
    private final Counter circuitRejectedCounter;

    // timeout / 연결 실패 / 5xx
    private final Counter upstreamFailureCounter;

    private final Counter incidentEmittedCounter;

    private final Counter broadcastSendFailureCounter;

    private final Timer healthProbeTimer;

    public void forwarded() {
        gatewayForwardedCounter.increment();
    }

    public void circuitRejected() {
        circuitRejectedCounter.increment();
    }

    public void upstreamFailure() {
        upstreamFailureCounter.increment();
    }

    public void incidentEmitted() {
        incidentEmittedCounter.increment();
    }

    public void broadcastSendFailure() {
        broadcastSendFailureCounter.increment();
    }

    public void probeCompleted(Duration elapsed) {
        healthProbeTimer.record(elapsed);
    }
}
