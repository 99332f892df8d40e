package com.ryuqq.circuitbreaker.core.event;

/**
 * 이벤트 수신자.
 *
 * <p>{@link #offer(Object)}는 절대 블로킹하면 안 됩니다. 수용 용량이 가득 찬 경우
 * false를 반환하고 해당 이벤트는 이 수신자에게서 유실됩니다.</p>
 *
 * @param <E> 이벤트 타입
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 * @see BoundedQueueEventSink
 */
@FunctionalInterface
public interface EventSink<E> {

    /**
     * 이벤트 전달 (비블로킹).
     *
     * @param event 이벤트
     * @return 수용했으면 true, 용량 초과로 버렸으면 false
     */
    boolean offer(E event);
}
