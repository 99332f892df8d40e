package com.ryuqq.circuitbreaker.core.event;

import com.ryuqq.circuitbreaker.core.state.StateTransition;

import java.time.ZonedDateTime;

/**
 * 상태 전이 이벤트.
 *
 * @param circuitBreakerName Circuit Breaker 이름
 * @param creationTime 생성 시각
 * @param stateTransition 전이 (from → to)
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public record StateTransitionEvent(
    String circuitBreakerName,
    ZonedDateTime creationTime,
    StateTransition stateTransition
) implements CircuitBreakerEvent {

    public StateTransitionEvent {
        if (circuitBreakerName == null || creationTime == null) {
            throw new IllegalArgumentException("circuitBreakerName and creationTime cannot be null");
        }
        if (stateTransition == null) {
            throw new IllegalArgumentException("stateTransition cannot be null");
        }
    }

    @Override
    public CircuitBreakerEventType eventType() {
        return CircuitBreakerEventType.STATE_TRANSITION;
    }
}
