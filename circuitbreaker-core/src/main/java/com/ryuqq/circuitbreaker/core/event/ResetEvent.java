package com.ryuqq.circuitbreaker.core.event;

import java.time.ZonedDateTime;

/**
 * reset() 이벤트. 상태 전이 이벤트와 별개로 발행됩니다.
 *
 * @param circuitBreakerName Circuit Breaker 이름
 * @param creationTime 생성 시각
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public record ResetEvent(
    String circuitBreakerName,
    ZonedDateTime creationTime
) implements CircuitBreakerEvent {

    public ResetEvent {
        if (circuitBreakerName == null || creationTime == null) {
            throw new IllegalArgumentException("circuitBreakerName and creationTime cannot be null");
        }
    }

    @Override
    public CircuitBreakerEventType eventType() {
        return CircuitBreakerEventType.RESET;
    }
}
