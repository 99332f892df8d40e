package com.ryuqq.circuitbreaker.core.spi;

import com.ryuqq.circuitbreaker.core.event.Event;
import com.ryuqq.circuitbreaker.core.event.EventFilter;
import com.ryuqq.circuitbreaker.core.event.EventSink;
import com.ryuqq.circuitbreaker.core.event.Subscription;

/**
 * Event Bus SPI.
 *
 * <p>Circuit Breaker와 Registry가 각각 하나씩 소유하는 fan-out 디스패처입니다.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Synchronous: publish()는 호출 스레드에서 필터를 통과한 모든 구독자에게 전달</li>
 *   <li>Non-blocking: 구독자 용량이 가득 차면 그 구독자에 대해서만 이벤트를 버림 (대기 금지)</li>
 *   <li>Isolation: 한 구독자의 예외가 발행자나 다른 구독자에게 전파되지 않음</li>
 *   <li>Thread-safe: 구독/해지/발행을 여러 스레드에서 동시에 호출 가능</li>
 * </ul>
 *
 * <p>구독자는 발행 스레드에서 실행됩니다. 구독자 안에서 같은 Circuit Breaker를 동기 호출하지 마세요.
 * 이벤트를 큐에 넣고 다른 스레드에서 처리하는 {@code BoundedQueueEventSink}를 권장합니다.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * BoundedQueueEventSink<CircuitBreakerEvent> sink = new BoundedQueueEventSink<>(16);
 * Subscription subscription = bus.subscribe(sink,
 *     EventFilter.excluding(CircuitBreakerEventType.SUCCESS));
 * ...
 * subscription.cancel();
 * }</pre>
 *
 * @param <T> 이벤트 종류
 * @param <E> 이벤트 타입
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public interface EventBus<T extends Enum<T>, E extends Event<T>> {

    /**
     * 구독 등록.
     *
     * @param sink 이벤트 수신자
     * @param filter 구독 필터
     * @return 구독 핸들
     * @throws IllegalArgumentException sink 또는 filter가 null인 경우
     */
    Subscription subscribe(EventSink<? super E> sink, EventFilter<T> filter);

    /**
     * 필터 없이 구독 등록.
     *
     * @param sink 이벤트 수신자
     * @return 구독 핸들
     */
    default Subscription subscribe(EventSink<? super E> sink) {
        return subscribe(sink, EventFilter.all());
    }

    /**
     * 이벤트 발행 (동기, 비블로킹).
     *
     * @param event 이벤트
     * @throws IllegalArgumentException event가 null인 경우
     */
    void publish(E event);

    /**
     * 활성 구독자 수.
     *
     * @return 구독자 수
     */
    int subscriberCount();
}
