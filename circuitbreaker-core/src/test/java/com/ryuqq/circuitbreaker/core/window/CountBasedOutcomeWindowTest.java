package com.ryuqq.circuitbreaker.core.window;

import com.ryuqq.circuitbreaker.core.outcome.CallResult;
import com.ryuqq.circuitbreaker.core.outcome.ClassifiedOutcome;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CountBasedOutcomeWindow 유닛 테스트.
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
class CountBasedOutcomeWindowTest {

    private static final ClassifiedOutcome SUCCESS = new ClassifiedOutcome(CallResult.SUCCESS, false, 1);
    private static final ClassifiedOutcome FAILURE = new ClassifiedOutcome(CallResult.FAILURE, false, 1);
    private static final ClassifiedOutcome SLOW_SUCCESS = new ClassifiedOutcome(CallResult.SUCCESS, true, 500);
    private static final ClassifiedOutcome IGNORED = new ClassifiedOutcome(CallResult.IGNORED, false, 1);

    @Test
    void 빈_윈도우는_비율_마이너스1() {
        CountBasedOutcomeWindow window = new CountBasedOutcomeWindow(5);

        WindowSnapshot snapshot = window.snapshot();

        assertThat(snapshot.totalCalls()).isZero();
        assertThat(snapshot.failureRate()).isEqualTo(-1f);
        assertThat(snapshot.slowCallRate()).isEqualTo(-1f);
    }

    @Test
    void 기록한_결과를_집계() {
        // given
        CountBasedOutcomeWindow window = new CountBasedOutcomeWindow(10);

        // when
        window.record(FAILURE);
        window.record(SUCCESS);
        window.record(SLOW_SUCCESS);
        window.record(FAILURE);

        // then
        WindowSnapshot snapshot = window.snapshot();
        assertThat(snapshot.totalCalls()).isEqualTo(4);
        assertThat(snapshot.failedCalls()).isEqualTo(2);
        assertThat(snapshot.slowCalls()).isEqualTo(1);
        assertThat(snapshot.successfulCalls()).isEqualTo(2);
        assertThat(snapshot.failureRate()).isEqualTo(50f);
        assertThat(snapshot.slowCallRate()).isEqualTo(25f);
    }

    @Test
    void 가득_차면_가장_오래된_결과를_밀어냄() {
        // given
        CountBasedOutcomeWindow window = new CountBasedOutcomeWindow(3);
        window.record(FAILURE);
        window.record(FAILURE);
        window.record(SUCCESS);

        // when
        window.record(SUCCESS);
        window.record(SUCCESS);

        // then
        WindowSnapshot snapshot = window.snapshot();
        assertThat(snapshot.totalCalls()).isEqualTo(3);
        assertThat(snapshot.failedCalls()).isZero();
        assertThat(snapshot.failureRate()).isZero();
    }

    @Test
    void 전체_호출_수는_윈도우_크기와_기록_수의_최솟값() {
        CountBasedOutcomeWindow window = new CountBasedOutcomeWindow(7);
        assertThat(window.windowSize()).isEqualTo(7);

        for (int recorded = 1; recorded <= 20; recorded++) {
            window.record(recorded % 3 == 0 ? FAILURE : SUCCESS);
            assertThat(window.snapshot().totalCalls()).isEqualTo(Math.min(window.windowSize(), recorded));
        }
    }

    @Test
    void 무시된_결과는_기록하지_않음() {
        CountBasedOutcomeWindow window = new CountBasedOutcomeWindow(3);

        window.record(IGNORED);
        window.record(IGNORED);

        assertThat(window.snapshot()).isEqualTo(WindowSnapshot.EMPTY);
    }

    @Test
    void reset_후_빈_윈도우() {
        CountBasedOutcomeWindow window = new CountBasedOutcomeWindow(3);
        window.record(FAILURE);
        window.record(SLOW_SUCCESS);

        window.reset();
        window.record(SUCCESS);

        assertThat(window.snapshot()).isEqualTo(new WindowSnapshot(1, 0, 0));
    }

    @Test
    void 크기가_양수가_아니면_예외() {
        assertThatThrownBy(() -> new CountBasedOutcomeWindow(0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
