package com.ryuqq.circuitbreaker.core.window;

import com.ryuqq.circuitbreaker.core.outcome.ClassifiedOutcome;

/**
 * 호출 결과 슬라이딩 윈도우.
 *
 * <p>최근 호출 결과를 유한한 범위에서 집계합니다.</p>
 *
 * <ul>
 *   <li>{@link CountBasedOutcomeWindow}: 최근 N건</li>
 *   <li>{@link TimeBasedOutcomeWindow}: 최근 N초</li>
 * </ul>
 *
 * <p><strong>스레드 안전성:</strong> 구현체는 동기화하지 않습니다.
 * 윈도우를 소유한 Circuit Breaker가 자신의 상태와 함께 하나의 락으로 보호해야 합니다.</p>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public interface OutcomeWindow {

    /**
     * 호출 결과 1건 기록.
     *
     * <p>IGNORED 결과는 기록하지 않습니다 (no-op).</p>
     *
     * @param outcome 분류된 호출 결과
     * @throws IllegalArgumentException outcome이 null인 경우
     */
    void record(ClassifiedOutcome outcome);

    /**
     * 현재 집계 스냅샷.
     *
     * @return 스냅샷
     */
    WindowSnapshot snapshot();

    /**
     * 모든 샘플 제거.
     */
    void reset();
}
