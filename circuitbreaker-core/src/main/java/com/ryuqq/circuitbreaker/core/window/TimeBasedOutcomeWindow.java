package com.ryuqq.circuitbreaker.core.window;

import com.ryuqq.circuitbreaker.core.outcome.ClassifiedOutcome;

import java.time.Clock;

/**
 * 최근 N초의 호출 결과를 집계하는 시간 기반 윈도우.
 *
 * <p>1초 단위 버킷 N개를 링 버퍼로 관리합니다. 기록/스냅샷 시점에
 * 현재 epoch second까지 윈도우를 전진시키며, 윈도우를 벗어난 버킷은
 * 그때 비우고 누적 합계에서 뺍니다 (lazy expiry).</p>
 *
 * <p><strong>전진 규칙:</strong></p>
 * <ul>
 *   <li>같은 초 (또는 시계가 뒤로 간 경우): head 버킷에 기록</li>
 *   <li>경과 초 &lt; N: 경과한 만큼 버킷을 하나씩 비우며 전진</li>
 *   <li>경과 초 &gt;= N: 전체 버킷 초기화</li>
 * </ul>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public final class TimeBasedOutcomeWindow implements OutcomeWindow {

    private final Clock clock;
    private final long[] epochSeconds;
    private final int[] totalCalls;
    private final int[] failedCalls;
    private final int[] slowCalls;
    private int headIndex;

    private int sumTotal;
    private int sumFailed;
    private int sumSlow;

    /**
     * @param windowSizeInSeconds 윈도우 길이 (초)
     * @param clock 시간 소스
     * @throws IllegalArgumentException windowSizeInSeconds가 양수가 아니거나 clock이 null인 경우
     */
    public TimeBasedOutcomeWindow(int windowSizeInSeconds, Clock clock) {
        if (windowSizeInSeconds <= 0) {
            throw new IllegalArgumentException(
                "windowSizeInSeconds must be positive, but was: " + windowSizeInSeconds);
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
        this.epochSeconds = new long[windowSizeInSeconds];
        this.totalCalls = new int[windowSizeInSeconds];
        this.failedCalls = new int[windowSizeInSeconds];
        this.slowCalls = new int[windowSizeInSeconds];
        this.headIndex = 0;
        this.epochSeconds[headIndex] = currentEpochSecond();
    }

    @Override
    public void record(ClassifiedOutcome outcome) {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        if (outcome.isIgnored()) {
            return;
        }

        advanceTo(currentEpochSecond());

        totalCalls[headIndex]++;
        sumTotal++;
        if (outcome.isFailure()) {
            failedCalls[headIndex]++;
            sumFailed++;
        }
        if (outcome.slow()) {
            slowCalls[headIndex]++;
            sumSlow++;
        }
    }

    @Override
    public WindowSnapshot snapshot() {
        advanceTo(currentEpochSecond());
        return new WindowSnapshot(sumTotal, sumFailed, sumSlow);
    }

    @Override
    public void reset() {
        for (int i = 0; i < epochSeconds.length; i++) {
            clearBucket(i);
        }
        headIndex = 0;
        epochSeconds[headIndex] = currentEpochSecond();
    }

    public int windowSizeInSeconds() {
        return epochSeconds.length;
    }

    private void advanceTo(long nowSecond) {
        long headSecond = epochSeconds[headIndex];
        if (nowSecond <= headSecond) {
            return;
        }

        long elapsed = nowSecond - headSecond;
        if (elapsed >= epochSeconds.length) {
            for (int i = 0; i < epochSeconds.length; i++) {
                clearBucket(i);
            }
            epochSeconds[headIndex] = nowSecond;
            return;
        }

        for (long step = 1; step <= elapsed; step++) {
            headIndex = (headIndex + 1) % epochSeconds.length;
            clearBucket(headIndex);
            epochSeconds[headIndex] = headSecond + step;
        }
    }

    private void clearBucket(int index) {
        sumTotal -= totalCalls[index];
        sumFailed -= failedCalls[index];
        sumSlow -= slowCalls[index];
        totalCalls[index] = 0;
        failedCalls[index] = 0;
        slowCalls[index] = 0;
    }

    private long currentEpochSecond() {
        return Math.floorDiv(clock.millis(), 1000L);
    }
}
