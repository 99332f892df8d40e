package com.ryuqq.circuitbreaker.registry.event;

/**
 * Registry 이벤트 종류.
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public enum RegistryEventType {

    /**
     * Circuit Breaker 생성 및 등록.
     */
    ADDED,

    /**
     * Circuit Breaker 제거.
     */
    REMOVED,

    /**
     * 기존 Circuit Breaker 교체.
     */
    REPLACED
}
