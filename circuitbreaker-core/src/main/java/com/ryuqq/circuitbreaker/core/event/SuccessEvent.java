package com.ryuqq.circuitbreaker.core.event;

import java.time.Duration;
import java.time.ZonedDateTime;

/**
 * 호출 성공 이벤트.
 *
 * @param circuitBreakerName Circuit Breaker 이름
 * @param creationTime 생성 시각
 * @param elapsedDuration 실행 시간
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public record SuccessEvent(
    String circuitBreakerName,
    ZonedDateTime creationTime,
    Duration elapsedDuration
) implements CircuitBreakerEvent {

    public SuccessEvent {
        if (circuitBreakerName == null || creationTime == null) {
            throw new IllegalArgumentException("circuitBreakerName and creationTime cannot be null");
        }
    }

    @Override
    public CircuitBreakerEventType eventType() {
        return CircuitBreakerEventType.SUCCESS;
    }
}
