package com.ryuqq.circuitbreaker.core.outcome;

/**
 * 분류된 호출 결과.
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public enum CallResult {
    SUCCESS,
    FAILURE,
    IGNORED
}
