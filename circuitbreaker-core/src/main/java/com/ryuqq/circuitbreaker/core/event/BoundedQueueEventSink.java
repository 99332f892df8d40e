package com.ryuqq.circuitbreaker.core.event;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 고정 용량 큐 기반 {@link EventSink}.
 *
 * <p>큐가 가득 차면 새 이벤트를 버립니다 (drop-on-full). 발행자는 절대 대기하지 않으므로,
 * 소비자는 전달을 가정하지 말고 {@link #poll(long, TimeUnit)}처럼 타임아웃을 두고 꺼내야 합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * BoundedQueueEventSink<CircuitBreakerEvent> sink = new BoundedQueueEventSink<>(16);
 * breaker.getEventBus().subscribe(sink, EventFilter.only(CircuitBreakerEventType.STATE_TRANSITION));
 *
 * CircuitBreakerEvent event = sink.poll(100, TimeUnit.MILLISECONDS); // 없으면 null
 * }</pre>
 *
 * @param <E> 이벤트 타입
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public final class BoundedQueueEventSink<E> implements EventSink<E> {

    private final BlockingQueue<E> queue;
    private final AtomicLong droppedCount = new AtomicLong();

    /**
     * @param capacity 큐 용량
     * @throws IllegalArgumentException capacity가 양수가 아닌 경우
     */
    public BoundedQueueEventSink(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, but was: " + capacity);
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    @Override
    public boolean offer(E event) {
        boolean accepted = queue.offer(event);
        if (!accepted) {
            droppedCount.incrementAndGet();
        }
        return accepted;
    }

    /**
     * 이벤트 1건을 꺼냄 (타임아웃 대기).
     *
     * @param timeout 최대 대기 시간
     * @param unit 시간 단위
     * @return 이벤트, 타임아웃이면 null
     * @throws InterruptedException 대기 중 인터럽트 발생
     */
    public E poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    /**
     * 대기 없이 쌓인 이벤트를 모두 꺼냄.
     *
     * @return 꺼낸 이벤트 (도착 순서)
     */
    public List<E> drain() {
        List<E> events = new ArrayList<>();
        queue.drainTo(events);
        return events;
    }

    public int size() {
        return queue.size();
    }

    /**
     * 용량 초과로 버려진 이벤트 수.
     */
    public long droppedCount() {
        return droppedCount.get();
    }
}
