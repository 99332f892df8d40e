package com.ryuqq.circuitbreaker.core.metrics;

import com.ryuqq.circuitbreaker.core.window.WindowSnapshot;

/**
 * Circuit Breaker 메트릭 스냅샷.
 *
 * <p>저장되지 않고 조회 시점의 윈도우에서 계산되는 값입니다.
 * 호출 수는 항상 그대로 보고하지만, 비율은 호출 수가 최소 호출 수에
 * 못 미치면 {@code -1} ("아직 의미 없음")로 보고합니다.</p>
 *
 * @param totalCalls 무시되지 않은 전체 호출 수
 * @param failedCalls 실패 호출 수
 * @param slowCalls 느린 호출 수
 * @param notPermittedCalls 마지막 상태 전이 이후 거부된 호출 수
 * @param failureRate 실패율 (%), 또는 -1
 * @param slowCallRate 느린 호출 비율 (%), 또는 -1
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public record CircuitBreakerMetrics(
    int totalCalls,
    int failedCalls,
    int slowCalls,
    long notPermittedCalls,
    float failureRate,
    float slowCallRate
) {

    /**
     * 윈도우 스냅샷에서 메트릭 생성.
     *
     * @param snapshot 윈도우 스냅샷
     * @param minimumNumberOfCalls 비율을 보고하기 위한 최소 호출 수
     * @param notPermittedCalls 거부된 호출 수
     * @return 메트릭
     */
    public static CircuitBreakerMetrics of(WindowSnapshot snapshot, int minimumNumberOfCalls, long notPermittedCalls) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        boolean meaningful = snapshot.totalCalls() > 0 && snapshot.totalCalls() >= minimumNumberOfCalls;
        return new CircuitBreakerMetrics(
            snapshot.totalCalls(),
            snapshot.failedCalls(),
            snapshot.slowCalls(),
            notPermittedCalls,
            meaningful ? snapshot.failureRate() : -1.0f,
            meaningful ? snapshot.slowCallRate() : -1.0f
        );
    }

    public int successfulCalls() {
        return totalCalls - failedCalls;
    }
}
