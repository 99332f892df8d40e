package com.ryuqq.circuitbreaker.core.event;

/**
 * Circuit Breaker 이벤트 종류.
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public enum CircuitBreakerEventType {

    /** 호출 성공 (분류기가 실패로 보지 않은 오류 포함). */
    SUCCESS,

    /** 실패로 기록된 호출. */
    ERROR,

    /** 무시된 오류 (윈도우에 기록되지 않음). */
    IGNORED_ERROR,

    /** 호출 거부. */
    NOT_PERMITTED,

    /** 상태 전이. */
    STATE_TRANSITION,

    /** reset() 호출. */
    RESET,

    /** 실패율 임계값 도달. */
    FAILURE_RATE_EXCEEDED,

    /** 느린 호출 비율 임계값 도달. */
    SLOW_CALL_RATE_EXCEEDED
}
