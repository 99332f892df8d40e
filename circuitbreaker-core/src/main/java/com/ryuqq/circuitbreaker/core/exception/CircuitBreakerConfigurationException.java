package com.ryuqq.circuitbreaker.core.exception;

/**
 * 잘못된 Circuit Breaker 설정값.
 *
 * <p>설정 생성 시점에만 발생하며, 호출 시점에는 발생하지 않습니다.
 * 이 예외가 발생하면 설정 객체는 생성되지 않습니다.</p>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public class CircuitBreakerConfigurationException extends IllegalArgumentException {

    public CircuitBreakerConfigurationException(String message) {
        super(message);
    }
}
