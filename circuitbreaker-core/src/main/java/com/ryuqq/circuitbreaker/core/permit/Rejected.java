package com.ryuqq.circuitbreaker.core.permit;

import com.ryuqq.circuitbreaker.core.exception.CallNotPermittedException;
import com.ryuqq.circuitbreaker.core.state.CircuitBreakerState;

/**
 * 호출 거부.
 *
 * @param circuitBreakerName 거부한 Circuit Breaker 이름
 * @param state 거부 시점의 상태
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public record Rejected(String circuitBreakerName, CircuitBreakerState state) implements PermitResult {

    public Rejected {
        if (circuitBreakerName == null) {
            throw new IllegalArgumentException("circuitBreakerName cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
    }

    /**
     * 호출자에게 전달할 예외로 변환.
     *
     * @return CallNotPermittedException
     */
    public CallNotPermittedException toException() {
        return new CallNotPermittedException(circuitBreakerName, state);
    }
}
