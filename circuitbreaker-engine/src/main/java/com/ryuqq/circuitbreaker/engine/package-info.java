/**
 * Circuit Breaker 엔진 구현.
 *
 * <p>이 패키지는 Core SPI의 기본 구현을 제공합니다.</p>
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.circuitbreaker.engine.CircuitBreakerStateMachine} - 상태 머신 (윈도우 기록, 임계값 평가, 전이)</li>
 *   <li>{@link com.ryuqq.circuitbreaker.engine.InMemoryEventBus} - 비블로킹 이벤트 fan-out</li>
 *   <li>{@link com.ryuqq.circuitbreaker.engine.TransitionScheduler} - 시간 기반 전이 예약 (daemon 스레드)</li>
 *   <li>{@link com.ryuqq.circuitbreaker.engine.CircuitBreakerExecutor} - 보호 호출 실행기</li>
 * </ul>
 *
 * <p><strong>의존성:</strong></p>
 * <pre>
 * circuitbreaker-engine
 *   ↓ depends on
 * circuitbreaker-core (SPI, 모델)
 * slf4j-api (로깅)
 * </pre>
 *
 * @since 1.0.0
 */
package com.ryuqq.circuitbreaker.engine;
