package com.ryuqq.circuitbreaker.core.noop;

import com.ryuqq.circuitbreaker.core.config.CircuitBreakerConfig;
import com.ryuqq.circuitbreaker.core.event.CircuitBreakerEvent;
import com.ryuqq.circuitbreaker.core.event.CircuitBreakerEventType;
import com.ryuqq.circuitbreaker.core.event.EventFilter;
import com.ryuqq.circuitbreaker.core.event.EventSink;
import com.ryuqq.circuitbreaker.core.event.Subscription;
import com.ryuqq.circuitbreaker.core.exception.ProtocolViolationException;
import com.ryuqq.circuitbreaker.core.metrics.CircuitBreakerMetrics;
import com.ryuqq.circuitbreaker.core.outcome.CallOutcome;
import com.ryuqq.circuitbreaker.core.permit.CallPermit;
import com.ryuqq.circuitbreaker.core.permit.PermitResult;
import com.ryuqq.circuitbreaker.core.permit.Permitted;
import com.ryuqq.circuitbreaker.core.spi.CircuitBreaker;
import com.ryuqq.circuitbreaker.core.spi.EventBus;
import com.ryuqq.circuitbreaker.core.state.CircuitBreakerState;
import com.ryuqq.circuitbreaker.core.window.WindowSnapshot;

/**
 * Circuit Breaker NoOp 구현.
 *
 * <p>모든 요청을 항상 허용하며, 상태 추적과 이벤트 발행을 하지 않습니다.
 * 보호 없이 실행하고자 할 때 같은 호출 코드를 유지한 채 끼워 넣을 수 있습니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>permitCall(): 항상 Permitted 반환</li>
 *   <li>recordResult(): 토큰 검증만 하고 기록하지 않음</li>
 *   <li>transitionToXxxState(), reset(): 아무 동작 안 함</li>
 *   <li>getState(): 항상 CLOSED 반환</li>
 *   <li>getMetrics(): 항상 빈 메트릭 반환</li>
 * </ul>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public final class NoOpCircuitBreaker implements CircuitBreaker {

    private static final Subscription INACTIVE = new Subscription() {
        @Override
        public void cancel() {
            // NoOp
        }

        @Override
        public boolean isActive() {
            return false;
        }
    };

    private final String name;
    private final CircuitBreakerConfig config;
    private final EventBus<CircuitBreakerEventType, CircuitBreakerEvent> eventBus = new NoOpEventBus();

    public NoOpCircuitBreaker(String name) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        this.name = name;
        this.config = CircuitBreakerConfig.ofDefaults();
    }

    @Override
    public PermitResult permitCall() {
        return new Permitted(CallPermit.issue(this, 0L, CircuitBreakerState.CLOSED));
    }

    @Override
    public void recordResult(CallPermit permit, CallOutcome outcome) {
        if (permit == null || !permit.isIssuedBy(this)) {
            throw new ProtocolViolationException("permit was not issued by circuit breaker '" + name + "'");
        }
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        if (!permit.consume()) {
            throw new ProtocolViolationException("permit already used: " + permit);
        }
    }

    @Override
    public boolean isPermittingCalls() {
        return true;
    }

    @Override
    public void transitionToClosedState() {
        // NoOp
    }

    @Override
    public void transitionToOpenState() {
        // NoOp
    }

    @Override
    public void transitionToHalfOpenState() {
        // NoOp
    }

    @Override
    public void transitionToForcedOpenState() {
        // NoOp
    }

    @Override
    public void transitionToDisabledState() {
        // NoOp
    }

    @Override
    public void transitionToMetricsOnlyState() {
        // NoOp
    }

    @Override
    public void reset() {
        // NoOp
    }

    @Override
    public CircuitBreakerState getState() {
        return CircuitBreakerState.CLOSED;
    }

    @Override
    public CircuitBreakerMetrics getMetrics() {
        return CircuitBreakerMetrics.of(WindowSnapshot.EMPTY, config.effectiveMinimumNumberOfCalls(), 0L);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public CircuitBreakerConfig getConfig() {
        return config;
    }

    @Override
    public EventBus<CircuitBreakerEventType, CircuitBreakerEvent> getEventBus() {
        return eventBus;
    }

    private static final class NoOpEventBus implements EventBus<CircuitBreakerEventType, CircuitBreakerEvent> {

        @Override
        public Subscription subscribe(EventSink<? super CircuitBreakerEvent> sink,
                                      EventFilter<CircuitBreakerEventType> filter) {
            if (sink == null || filter == null) {
                throw new IllegalArgumentException("sink and filter cannot be null");
            }
            return INACTIVE;
        }

        @Override
        public void publish(CircuitBreakerEvent event) {
            // NoOp
        }

        @Override
        public int subscriberCount() {
            return 0;
        }
    }
}
