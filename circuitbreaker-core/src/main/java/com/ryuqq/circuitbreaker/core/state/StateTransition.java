package com.ryuqq.circuitbreaker.core.state;

/**
 * 상태 전이 (from → to).
 *
 * <p>수동 전이는 어떤 상태에서 어떤 상태로든 허용되므로 검증 규칙은 없고,
 * 전이 이벤트에 담길 값만 표현합니다.</p>
 *
 * @param from 이전 상태
 * @param to 다음 상태
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public record StateTransition(
    CircuitBreakerState from,
    CircuitBreakerState to
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public StateTransition {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
    }

    public static StateTransition between(CircuitBreakerState from, CircuitBreakerState to) {
        return new StateTransition(from, to);
    }

    @Override
    public String toString() {
        return from + " → " + to;
    }
}
