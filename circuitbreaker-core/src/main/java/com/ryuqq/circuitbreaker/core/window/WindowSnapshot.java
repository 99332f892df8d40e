package com.ryuqq.circuitbreaker.core.window;

/**
 * 윈도우 집계 스냅샷 (특정 시점의 불변 값).
 *
 * <p>샘플이 하나도 없으면 비율은 0이 아니라 {@code -1}입니다.
 * "데이터 없음"과 "실패 0%"를 구분하기 위함입니다.</p>
 *
 * @param totalCalls 무시되지 않은 전체 호출 수
 * @param failedCalls 실패 호출 수
 * @param slowCalls 느린 호출 수 (성공/실패 무관)
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public record WindowSnapshot(
    int totalCalls,
    int failedCalls,
    int slowCalls
) {

    public static final WindowSnapshot EMPTY = new WindowSnapshot(0, 0, 0);

    public WindowSnapshot {
        if (totalCalls < 0 || failedCalls < 0 || slowCalls < 0) {
            throw new IllegalArgumentException("call counts cannot be negative");
        }
        if (failedCalls > totalCalls || slowCalls > totalCalls) {
            throw new IllegalArgumentException(
                "failedCalls and slowCalls cannot exceed totalCalls (total: " + totalCalls
                    + ", failed: " + failedCalls + ", slow: " + slowCalls + ")"
            );
        }
    }

    public int successfulCalls() {
        return totalCalls - failedCalls;
    }

    /**
     * 실패율 (%).
     *
     * @return 100 * failedCalls / totalCalls, 샘플이 없으면 -1
     */
    public float failureRate() {
        return rate(failedCalls);
    }

    /**
     * 느린 호출 비율 (%).
     *
     * @return 100 * slowCalls / totalCalls, 샘플이 없으면 -1
     */
    public float slowCallRate() {
        return rate(slowCalls);
    }

    private float rate(int count) {
        if (totalCalls == 0) {
            return -1.0f;
        }
        return count * 100.0f / totalCalls;
    }
}
