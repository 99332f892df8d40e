package com.ryuqq.circuitbreaker.core.spi;

import com.ryuqq.circuitbreaker.core.config.CircuitBreakerConfig;
import com.ryuqq.circuitbreaker.core.event.CircuitBreakerEvent;
import com.ryuqq.circuitbreaker.core.event.CircuitBreakerEventType;
import com.ryuqq.circuitbreaker.core.metrics.CircuitBreakerMetrics;
import com.ryuqq.circuitbreaker.core.outcome.CallOutcome;
import com.ryuqq.circuitbreaker.core.permit.CallPermit;
import com.ryuqq.circuitbreaker.core.permit.PermitResult;
import com.ryuqq.circuitbreaker.core.state.CircuitBreakerState;

/**
 * Circuit Breaker SPI.
 *
 * <p>외부 호출의 최근 결과를 추적하고, 실패율 또는 느린 호출 비율이 임계값에 도달하면
 * 빠르게 실패(Fail-Fast)하여 장애가 전체 시스템으로 전파되는 것을 방지합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreaker cb = ...;
 *
 * PermitResult decision = cb.permitCall();
 * if (decision instanceof Rejected rejected) {
 *     throw rejected.toException();
 * }
 * CallPermit permit = ((Permitted) decision).permit();
 *
 * long start = System.nanoTime();
 * try {
 *     Result result = externalApi.call();
 *     cb.recordResult(permit, CallOutcome.success(elapsedMs(start)));
 *     return result;
 * } catch (Exception e) {
 *     cb.recordResult(permit, CallOutcome.failure(elapsedMs(start), e));
 *     throw e;
 * }
 * }</pre>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * 호출 허용 여부 판단.
     *
     * <ul>
     *   <li>CLOSED, DISABLED, METRICS_ONLY: 허용</li>
     *   <li>FORCED_OPEN: 거부</li>
     *   <li>OPEN: 대기 시간이 지났으면 HALF_OPEN으로 전이 후 재판단, 아니면 거부</li>
     *   <li>HALF_OPEN: 허용 호출 수가 남아 있으면 허용</li>
     * </ul>
     *
     * @return Permitted (허가 토큰 포함) 또는 Rejected
     */
    PermitResult permitCall();

    /**
     * 허용된 호출의 결과 기록.
     *
     * @param permit permitCall()이 발급한 허가 토큰
     * @param outcome 호출 결과
     * @throws com.ryuqq.circuitbreaker.core.exception.ProtocolViolationException 토큰이 null이거나,
     *         다른 Circuit Breaker가 발급했거나, 이미 사용된 경우
     * @throws IllegalArgumentException outcome이 null인 경우
     */
    void recordResult(CallPermit permit, CallOutcome outcome);

    /**
     * 부수 효과 없이 현재 호출이 허용되는지 확인.
     *
     * <p>상태 전이, HALF_OPEN 허가 수 증가, 이벤트 발행을 하지 않습니다.</p>
     *
     * @return permitCall()이 지금 허용할 것으로 예상되면 true
     */
    boolean isPermittingCalls();

    void transitionToClosedState();

    void transitionToOpenState();

    void transitionToHalfOpenState();

    void transitionToForcedOpenState();

    void transitionToDisabledState();

    void transitionToMetricsOnlyState();

    /**
     * CLOSED 상태로 초기화.
     *
     * <p>두 윈도우와 모든 카운터를 비우고 RESET 이벤트를 발행합니다
     * (STATE_TRANSITION 이벤트는 발행하지 않음).</p>
     */
    void reset();

    CircuitBreakerState getState();

    /**
     * 현재 상태의 메트릭.
     *
     * @return 메트릭 스냅샷
     */
    CircuitBreakerMetrics getMetrics();

    String getName();

    CircuitBreakerConfig getConfig();

    /**
     * 이 Circuit Breaker의 이벤트 버스.
     *
     * @return 이벤트 버스
     */
    EventBus<CircuitBreakerEventType, CircuitBreakerEvent> getEventBus();
}
