package com.ryuqq.circuitbreaker.core.permit;

/**
 * 호출 허용.
 *
 * @param permit recordResult()에 전달할 허가 토큰
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public record Permitted(CallPermit permit) implements PermitResult {

    public Permitted {
        if (permit == null) {
            throw new IllegalArgumentException("permit cannot be null");
        }
    }
}
