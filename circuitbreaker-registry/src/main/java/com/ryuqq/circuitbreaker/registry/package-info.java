/**
 * Circuit Breaker Registry.
 *
 * <p>이름 있는 Circuit Breaker와 설정을 관리합니다.</p>
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.circuitbreaker.registry.CircuitBreakerRegistry} - Registry 인터페이스</li>
 *   <li>{@link com.ryuqq.circuitbreaker.registry.InMemoryCircuitBreakerRegistry} - ConcurrentHashMap 기반 구현</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.circuitbreaker.registry;
