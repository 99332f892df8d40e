package com.ryuqq.circuitbreaker.core.window;

import com.ryuqq.circuitbreaker.core.config.CircuitBreakerConfig;

import java.time.Clock;

/**
 * 설정에 맞는 {@link OutcomeWindow} 생성.
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public final class OutcomeWindows {

    private OutcomeWindows() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * CLOSED 상태용 윈도우 생성.
     *
     * @param config 설정
     * @param clock TIME_BASED 윈도우의 시간 소스
     * @return slidingWindowType/slidingWindowSize에 맞는 윈도우
     */
    public static OutcomeWindow forClosedState(CircuitBreakerConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return switch (config.slidingWindowType()) {
            case COUNT_BASED -> new CountBasedOutcomeWindow(config.slidingWindowSize());
            case TIME_BASED -> new TimeBasedOutcomeWindow(config.slidingWindowSize(), clock);
        };
    }

    /**
     * HALF_OPEN 상태용 윈도우 생성.
     *
     * <p>HALF_OPEN에서는 허용된 호출 수만큼만 결과가 들어오므로
     * 항상 permittedCallsInHalfOpen 크기의 COUNT_BASED 윈도우를 사용합니다.</p>
     *
     * @param config 설정
     * @return permittedCallsInHalfOpen 크기의 윈도우
     */
    public static OutcomeWindow forHalfOpenState(CircuitBreakerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return new CountBasedOutcomeWindow(config.permittedCallsInHalfOpen());
    }
}
