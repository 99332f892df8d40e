package com.ryuqq.circuitbreaker.engine;

import com.ryuqq.circuitbreaker.core.event.BoundedQueueEventSink;
import com.ryuqq.circuitbreaker.core.event.CircuitBreakerEvent;
import com.ryuqq.circuitbreaker.core.event.CircuitBreakerEventType;
import com.ryuqq.circuitbreaker.core.event.EventFilter;
import com.ryuqq.circuitbreaker.core.event.EventSink;
import com.ryuqq.circuitbreaker.core.event.ResetEvent;
import com.ryuqq.circuitbreaker.core.event.Subscription;
import com.ryuqq.circuitbreaker.core.event.SuccessEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * InMemoryEventBus 유닛 테스트.
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
class InMemoryEventBusTest {

    private static final ZonedDateTime NOW = ZonedDateTime.of(2024, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);

    private InMemoryEventBus<CircuitBreakerEventType, CircuitBreakerEvent> bus;

    @BeforeEach
    void setUp() {
        bus = new InMemoryEventBus<>("test");
    }

    @Test
    void publish_필터를_통과한_구독자에게만_전달() {
        // given
        List<CircuitBreakerEvent> all = new ArrayList<>();
        List<CircuitBreakerEvent> resetsOnly = new ArrayList<>();
        bus.subscribe(event -> all.add(event));
        bus.subscribe(event -> resetsOnly.add(event), EventFilter.only(CircuitBreakerEventType.RESET));

        // when
        bus.publish(new SuccessEvent("test", NOW, Duration.ofMillis(3)));
        bus.publish(new ResetEvent("test", NOW));

        // then
        assertThat(all).hasSize(2);
        assertThat(resetsOnly).singleElement().isInstanceOf(ResetEvent.class);
    }

    @Test
    void publish_가득_찬_구독자는_해당_이벤트만_유실() {
        // given
        BoundedQueueEventSink<CircuitBreakerEvent> small = new BoundedQueueEventSink<>(1);
        BoundedQueueEventSink<CircuitBreakerEvent> large = new BoundedQueueEventSink<>(10);
        bus.subscribe(small);
        bus.subscribe(large);

        // when
        for (int i = 0; i < 3; i++) {
            bus.publish(new ResetEvent("test", NOW));
        }

        // then
        assertThat(small.size()).isEqualTo(1);
        assertThat(large.size()).isEqualTo(3);
        assertThat(bus.droppedEventCount()).isEqualTo(2);
    }

    @Test
    @SuppressWarnings("unchecked")
    void publish_예외를_던지는_구독자는_건너뛰고_다음_구독자에게_전달() {
        // given
        EventSink<CircuitBreakerEvent> broken = mock(EventSink.class);
        when(broken.offer(any())).thenThrow(new IllegalStateException("broken"));
        List<CircuitBreakerEvent> received = new ArrayList<>();
        bus.subscribe(broken);
        bus.subscribe(event -> received.add(event));
        ResetEvent event = new ResetEvent("test", NOW);

        // when
        bus.publish(event);

        // then
        verify(broken).offer(event);
        assertThat(received).containsExactly(event);
    }

    @Test
    void cancel_이후_전달되지_않고_멱등() {
        // given
        List<CircuitBreakerEvent> received = new ArrayList<>();
        Subscription subscription = bus.subscribe(event -> received.add(event));

        // when
        subscription.cancel();
        subscription.cancel();
        bus.publish(new ResetEvent("test", NOW));

        // then
        assertThat(subscription.isActive()).isFalse();
        assertThat(received).isEmpty();
        assertThat(bus.subscriberCount()).isZero();
    }

    @Test
    void null_인자는_거부() {
        assertThatThrownBy(() -> bus.publish(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> bus.subscribe(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> bus.subscribe(event -> true, null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InMemoryEventBus<CircuitBreakerEventType, CircuitBreakerEvent>(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
