package com.ryuqq.circuitbreaker.core.exception;

import com.ryuqq.circuitbreaker.core.state.CircuitBreakerState;

/**
 * Circuit Breaker가 호출을 허용하지 않음.
 *
 * <p>보호 대상 작업은 실행되지 않았습니다. 작업 자체의 예외와 구분되므로
 * 호출자는 이 예외에 대해서만 fallback을 적용할 수 있습니다.</p>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public class CallNotPermittedException extends RuntimeException {

    private final String circuitBreakerName;
    private final CircuitBreakerState state;

    public CallNotPermittedException(String circuitBreakerName, CircuitBreakerState state) {
        super(String.format("CircuitBreaker '%s' is %s and does not permit further calls",
            circuitBreakerName, state));
        this.circuitBreakerName = circuitBreakerName;
        this.state = state;
    }

    public String getCircuitBreakerName() {
        return circuitBreakerName;
    }

    /**
     * 거부 시점의 상태.
     *
     * @return OPEN, FORCED_OPEN 또는 HALF_OPEN
     */
    public CircuitBreakerState getState() {
        return state;
    }
}
