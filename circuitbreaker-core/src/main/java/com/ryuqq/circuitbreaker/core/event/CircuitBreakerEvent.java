package com.ryuqq.circuitbreaker.core.event;

/**
 * Circuit Breaker 이벤트.
 *
 * <p>Sealed interface로 정의되어 모든 이벤트 타입이 컴파일 타임에 고정됩니다.</p>
 *
 * <ul>
 *   <li>{@link SuccessEvent}, {@link ErrorEvent}, {@link IgnoredErrorEvent}: 호출 결과</li>
 *   <li>{@link NotPermittedEvent}: 호출 거부</li>
 *   <li>{@link StateTransitionEvent}, {@link ResetEvent}: 상태 변경</li>
 *   <li>{@link FailureRateExceededEvent}, {@link SlowCallRateExceededEvent}: 임계값 도달</li>
 * </ul>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public sealed interface CircuitBreakerEvent extends Event<CircuitBreakerEventType>
    permits SuccessEvent, ErrorEvent, IgnoredErrorEvent, NotPermittedEvent,
            StateTransitionEvent, ResetEvent, FailureRateExceededEvent, SlowCallRateExceededEvent {

    /**
     * 이벤트를 발생시킨 Circuit Breaker 이름.
     *
     * @return 이름
     */
    String circuitBreakerName();
}
