package com.ryuqq.circuitbreaker.core.window;

import com.ryuqq.circuitbreaker.core.outcome.ClassifiedOutcome;

import java.util.Arrays;

/**
 * 최근 N건의 호출 결과를 집계하는 링 버퍼 윈도우.
 *
 * <p>쓰기 커서가 가리키는 슬롯을 덮어쓰며, 밀려나는 샘플은 집계에서 빼고
 * 새 샘플은 더합니다 (Subtract-on-Evict). 기록과 스냅샷 모두 O(1)입니다.</p>
 *
 * <p><strong>불변식:</strong> totalCalls는 항상 windowSize 이하이며,
 * 마지막 reset 이후 무시되지 않은 최근 호출 수와 같습니다.</p>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public final class CountBasedOutcomeWindow implements OutcomeWindow {

    private static final byte EMPTY = -1;
    private static final byte FAILED = 1;
    private static final byte SLOW = 1 << 1;

    private final byte[] slots;
    private int cursor;
    private int totalCalls;
    private int failedCalls;
    private int slowCalls;

    /**
     * @param windowSize 보관할 최대 호출 수
     * @throws IllegalArgumentException windowSize가 양수가 아닌 경우
     */
    public CountBasedOutcomeWindow(int windowSize) {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize must be positive, but was: " + windowSize);
        }
        this.slots = new byte[windowSize];
        Arrays.fill(slots, EMPTY);
    }

    @Override
    public void record(ClassifiedOutcome outcome) {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        if (outcome.isIgnored()) {
            return;
        }

        evict(slots[cursor]);

        byte sample = 0;
        if (outcome.isFailure()) {
            sample |= FAILED;
        }
        if (outcome.slow()) {
            sample |= SLOW;
        }
        slots[cursor] = sample;
        add(sample);

        cursor = (cursor + 1) % slots.length;
    }

    @Override
    public WindowSnapshot snapshot() {
        return new WindowSnapshot(totalCalls, failedCalls, slowCalls);
    }

    @Override
    public void reset() {
        Arrays.fill(slots, EMPTY);
        cursor = 0;
        totalCalls = 0;
        failedCalls = 0;
        slowCalls = 0;
    }

    public int windowSize() {
        return slots.length;
    }

    private void evict(byte sample) {
        if (sample == EMPTY) {
            return;
        }
        totalCalls--;
        if ((sample & FAILED) != 0) {
            failedCalls--;
        }
        if ((sample & SLOW) != 0) {
            slowCalls--;
        }
    }

    private void add(byte sample) {
        totalCalls++;
        if ((sample & FAILED) != 0) {
            failedCalls++;
        }
        if ((sample & SLOW) != 0) {
            slowCalls++;
        }
    }
}
