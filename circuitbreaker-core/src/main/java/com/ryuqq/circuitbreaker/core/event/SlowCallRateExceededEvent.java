package com.ryuqq.circuitbreaker.core.event;

import java.time.ZonedDateTime;

/**
 * 느린 호출 비율 임계값 도달 이벤트.
 *
 * @param circuitBreakerName Circuit Breaker 이름
 * @param creationTime 생성 시각
 * @param slowCallRate 임계값에 도달한 느린 호출 비율 (%)
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public record SlowCallRateExceededEvent(
    String circuitBreakerName,
    ZonedDateTime creationTime,
    float slowCallRate
) implements CircuitBreakerEvent {

    public SlowCallRateExceededEvent {
        if (circuitBreakerName == null || creationTime == null) {
            throw new IllegalArgumentException("circuitBreakerName and creationTime cannot be null");
        }
    }

    @Override
    public CircuitBreakerEventType eventType() {
        return CircuitBreakerEventType.SLOW_CALL_RATE_EXCEEDED;
    }
}
