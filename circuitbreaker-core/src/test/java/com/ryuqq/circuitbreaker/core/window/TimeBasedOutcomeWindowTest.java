package com.ryuqq.circuitbreaker.core.window;

import com.ryuqq.circuitbreaker.core.outcome.CallResult;
import com.ryuqq.circuitbreaker.core.outcome.ClassifiedOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * TimeBasedOutcomeWindow 유닛 테스트.
 *
 * <p>수동으로 진행하는 시계로 버킷 만료를 검증합니다.</p>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
class TimeBasedOutcomeWindowTest {

    private static final ClassifiedOutcome SUCCESS = new ClassifiedOutcome(CallResult.SUCCESS, false, 1);
    private static final ClassifiedOutcome FAILURE = new ClassifiedOutcome(CallResult.FAILURE, false, 1);
    private static final ClassifiedOutcome SLOW_FAILURE = new ClassifiedOutcome(CallResult.FAILURE, true, 900);

    private SteppingClock clock;
    private TimeBasedOutcomeWindow window;

    @BeforeEach
    void setUp() {
        clock = new SteppingClock(1_700_000_000_000L);
        window = new TimeBasedOutcomeWindow(3, clock);
    }

    @Test
    void 같은_초의_결과는_하나의_버킷에_집계() {
        window.record(FAILURE);
        clock.advanceMillis(500);
        window.record(SUCCESS);

        WindowSnapshot snapshot = window.snapshot();
        assertThat(snapshot.totalCalls()).isEqualTo(2);
        assertThat(snapshot.failureRate()).isEqualTo(50f);
    }

    @Test
    void 윈도우를_벗어난_초는_트래픽_없이도_만료() {
        // given: t=0s FAILURE, t=1s SUCCESS
        window.record(FAILURE);
        clock.advanceMillis(1_000);
        window.record(SUCCESS);

        // when: t=3s, t=0s 버킷만 만료
        clock.advanceMillis(2_000);
        WindowSnapshot afterFirstExpiry = window.snapshot();

        // then
        assertThat(afterFirstExpiry.totalCalls()).isEqualTo(1);
        assertThat(afterFirstExpiry.failedCalls()).isZero();

        // when: t=4s, 모두 만료
        clock.advanceMillis(1_000);

        // then
        assertThat(window.snapshot()).isEqualTo(WindowSnapshot.EMPTY);
    }

    @Test
    void 윈도우_크기_이상의_공백이면_모든_버킷_초기화() {
        window.record(SLOW_FAILURE);
        window.record(FAILURE);

        clock.advanceMillis(60_000);
        window.record(SUCCESS);

        assertThat(window.snapshot()).isEqualTo(new WindowSnapshot(1, 0, 0));
    }

    @Test
    void 링을_여러_바퀴_돌아도_합계가_일관됨() {
        for (int second = 0; second < 10; second++) {
            window.record(FAILURE);
            window.record(SUCCESS);
            clock.advanceMillis(1_000);
        }

        // 마지막 기록 후 1초 경과: 최근 3초 중 2초 분량만 남음
        WindowSnapshot snapshot = window.snapshot();
        assertThat(snapshot.totalCalls()).isEqualTo(4);
        assertThat(snapshot.failedCalls()).isEqualTo(2);
    }

    @Test
    void reset_후_빈_윈도우() {
        window.record(FAILURE);
        window.reset();

        assertThat(window.snapshot()).isEqualTo(WindowSnapshot.EMPTY);
        assertThat(window.windowSizeInSeconds()).isEqualTo(3);
    }

    private static final class SteppingClock extends Clock {
        private long millis;

        SteppingClock(long millis) {
            this.millis = millis;
        }

        void advanceMillis(long delta) {
            millis += delta;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis);
        }

        @Override
        public long millis() {
            return millis;
        }
    }
}
