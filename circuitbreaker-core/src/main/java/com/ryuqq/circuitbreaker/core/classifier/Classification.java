package com.ryuqq.circuitbreaker.core.classifier;

/**
 * 오류 분류 결과.
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public enum Classification {

    /**
     * 실패로 기록 (실패율 계산에 포함).
     */
    FAILURE,

    /**
     * 무시 (윈도우 및 실패율 계산에서 제외, IGNORED_ERROR 이벤트만 발행).
     */
    IGNORED,

    /**
     * 어느 조건에도 해당하지 않음 (성공으로 기록).
     */
    NOT_MATCHED
}
