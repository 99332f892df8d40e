package com.ryuqq.circuitbreaker.core.exception;

/**
 * 호출 허가 프로토콜 위반.
 *
 * <p>{@code recordResult()}가 유효한 {@link com.ryuqq.circuitbreaker.core.permit.CallPermit} 없이
 * 호출된 경우 발생합니다 (null, 다른 Circuit Breaker가 발급한 허가, 이미 사용된 허가).
 * 프로그래밍 오류이므로 조용히 무시하지 않습니다.</p>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public class ProtocolViolationException extends IllegalStateException {

    public ProtocolViolationException(String message) {
        super(message);
    }
}
