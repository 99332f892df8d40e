package com.ryuqq.circuitbreaker.core.event;

import java.time.Duration;
import java.time.ZonedDateTime;

/**
 * 실패로 기록된 호출 이벤트.
 *
 * @param circuitBreakerName Circuit Breaker 이름
 * @param creationTime 생성 시각
 * @param elapsedDuration 실행 시간
 * @param error 작업이 던진 오류
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public record ErrorEvent(
    String circuitBreakerName,
    ZonedDateTime creationTime,
    Duration elapsedDuration,
    Throwable error
) implements CircuitBreakerEvent {

    public ErrorEvent {
        if (circuitBreakerName == null || creationTime == null) {
            throw new IllegalArgumentException("circuitBreakerName and creationTime cannot be null");
        }
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
    }

    @Override
    public CircuitBreakerEventType eventType() {
        return CircuitBreakerEventType.ERROR;
    }
}
