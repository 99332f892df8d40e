package com.ryuqq.circuitbreaker.core.event;

import java.time.ZonedDateTime;

/**
 * 실패율 임계값 도달 이벤트.
 *
 * @param circuitBreakerName Circuit Breaker 이름
 * @param creationTime 생성 시각
 * @param failureRate 임계값에 도달한 실패율 (%)
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public record FailureRateExceededEvent(
    String circuitBreakerName,
    ZonedDateTime creationTime,
    float failureRate
) implements CircuitBreakerEvent {

    public FailureRateExceededEvent {
        if (circuitBreakerName == null || creationTime == null) {
            throw new IllegalArgumentException("circuitBreakerName and creationTime cannot be null");
        }
    }

    @Override
    public CircuitBreakerEventType eventType() {
        return CircuitBreakerEventType.FAILURE_RATE_EXCEEDED;
    }
}
