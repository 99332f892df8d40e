package com.ryuqq.circuitbreaker.core.metrics;

import com.ryuqq.circuitbreaker.core.window.WindowSnapshot;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * CircuitBreakerMetrics 유닛 테스트.
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
class CircuitBreakerMetricsTest {

    @Test
    void 최소_호출_수_미만이면_비율은_마이너스1_호출_수는_그대로() {
        // given
        WindowSnapshot snapshot = new WindowSnapshot(3, 2, 1);

        // when
        CircuitBreakerMetrics metrics = CircuitBreakerMetrics.of(snapshot, 5, 7);

        // then
        assertThat(metrics.totalCalls()).isEqualTo(3);
        assertThat(metrics.failedCalls()).isEqualTo(2);
        assertThat(metrics.slowCalls()).isEqualTo(1);
        assertThat(metrics.successfulCalls()).isEqualTo(1);
        assertThat(metrics.notPermittedCalls()).isEqualTo(7);
        assertThat(metrics.failureRate()).isEqualTo(-1f);
        assertThat(metrics.slowCallRate()).isEqualTo(-1f);
    }

    @Test
    void 최소_호출_수_이상이면_비율_계산() {
        CircuitBreakerMetrics metrics = CircuitBreakerMetrics.of(new WindowSnapshot(4, 1, 2), 4, 0);

        assertThat(metrics.failureRate()).isEqualTo(25f);
        assertThat(metrics.slowCallRate()).isEqualTo(50f);
    }

    @Test
    void 호출이_없으면_비율은_마이너스1() {
        CircuitBreakerMetrics metrics = CircuitBreakerMetrics.of(WindowSnapshot.EMPTY, 1, 0);

        assertThat(metrics.totalCalls()).isZero();
        assertThat(metrics.failureRate()).isEqualTo(-1f);
    }
}
