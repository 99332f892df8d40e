package com.ryuqq.circuitbreaker.core.config;

/**
 * 슬라이딩 윈도우 유형.
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public enum SlidingWindowType {

    /**
     * 최근 N건의 호출 결과를 집계 (링 버퍼).
     */
    COUNT_BASED,

    /**
     * 최근 N초 동안의 호출 결과를 초 단위 버킷으로 집계.
     */
    TIME_BASED
}
