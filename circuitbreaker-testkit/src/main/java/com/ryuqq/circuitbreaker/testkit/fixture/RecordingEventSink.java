package com.ryuqq.circuitbreaker.testkit.fixture;

import com.ryuqq.circuitbreaker.core.event.EventSink;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Unbounded sink that keeps every event it receives, in arrival order.
 *
 * <p>Publication is synchronous, so events are visible as soon as the call that produced them returns.</p>
 *
 * @param <E> event type
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public final class RecordingEventSink<E> implements EventSink<E> {

    private final List<E> events = new CopyOnWriteArrayList<>();

    @Override
    public boolean offer(E event) {
        events.add(event);
        return true;
    }

    /**
     * Returns a copy of all received events.
     *
     * @return events in arrival order
     */
    public List<E> events() {
        return List.copyOf(events);
    }

    /**
     * Returns the received events of one type.
     *
     * @param type event class
     * @return matching events in arrival order
     */
    public <X extends E> List<X> eventsOf(Class<X> type) {
        List<X> matching = new ArrayList<>();
        for (E event : events) {
            if (type.isInstance(event)) {
                matching.add(type.cast(event));
            }
        }
        return matching;
    }

    public int size() {
        return events.size();
    }

    public void clear() {
        events.clear();
    }
}
