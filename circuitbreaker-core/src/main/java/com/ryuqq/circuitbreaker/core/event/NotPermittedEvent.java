package com.ryuqq.circuitbreaker.core.event;

import java.time.ZonedDateTime;

/**
 * 호출 거부 이벤트.
 *
 * @param circuitBreakerName Circuit Breaker 이름
 * @param creationTime 생성 시각
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public record NotPermittedEvent(
    String circuitBreakerName,
    ZonedDateTime creationTime
) implements CircuitBreakerEvent {

    public NotPermittedEvent {
        if (circuitBreakerName == null || creationTime == null) {
            throw new IllegalArgumentException("circuitBreakerName and creationTime cannot be null");
        }
    }

    @Override
    public CircuitBreakerEventType eventType() {
        return CircuitBreakerEventType.NOT_PERMITTED;
    }
}
