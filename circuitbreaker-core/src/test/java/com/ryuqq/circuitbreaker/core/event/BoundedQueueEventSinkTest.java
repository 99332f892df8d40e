package com.ryuqq.circuitbreaker.core.event;

import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BoundedQueueEventSink 유닛 테스트.
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
class BoundedQueueEventSinkTest {

    @Test
    void 용량이_가득_차면_대기하지_않고_버림() {
        // given
        BoundedQueueEventSink<String> sink = new BoundedQueueEventSink<>(2);

        // when
        boolean first = sink.offer("a");
        boolean second = sink.offer("b");
        boolean third = sink.offer("c");

        // then
        assertThat(first).isTrue();
        assertThat(second).isTrue();
        assertThat(third).isFalse();
        assertThat(sink.size()).isEqualTo(2);
        assertThat(sink.droppedCount()).isEqualTo(1);
        assertThat(sink.drain()).containsExactly("a", "b");
    }

    @Test
    void poll은_타임아웃까지_기다린_후_null() throws InterruptedException {
        BoundedQueueEventSink<String> sink = new BoundedQueueEventSink<>(1);

        assertThat(sink.poll(10, TimeUnit.MILLISECONDS)).isNull();

        sink.offer("event");
        assertThat(sink.poll(10, TimeUnit.MILLISECONDS)).isEqualTo("event");
    }

    @Test
    void 용량이_양수가_아니면_예외() {
        assertThatThrownBy(() -> new BoundedQueueEventSink<String>(0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
