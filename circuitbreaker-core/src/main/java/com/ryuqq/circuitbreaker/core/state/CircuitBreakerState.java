package com.ryuqq.circuitbreaker.core.state;

/**
 * Circuit Breaker 상태.
 *
 * <p><strong>자동 상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (실패율 또는 느린 호출 비율 임계값 도달)
 * OPEN (차단)
 *   │
 *   ▼ (waitDurationInOpen 경과)
 * HALF_OPEN (반개방)
 *   │
 *   ├─► 허용 호출 결과가 임계값 미만 → CLOSED
 *   └─► 임계값 이상 (또는 maxWaitDurationInHalfOpen 경과) → OPEN
 * </pre>
 *
 * <p>FORCED_OPEN, DISABLED, METRICS_ONLY는 수동 전이로만 진입/이탈합니다.</p>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태. 모든 호출을 허용하고 실패율을 추적합니다.
     */
    CLOSED,

    /**
     * 차단 상태. 대기 시간이 지나기 전까지 모든 호출을 거부합니다.
     */
    OPEN,

    /**
     * 반개방 상태. 제한된 수의 호출만 허용하여 복구 여부를 확인합니다.
     */
    HALF_OPEN,

    /**
     * 강제 차단. 자동 전이 없이 모든 호출을 거부하며 호출 이벤트를 발행하지 않습니다.
     */
    FORCED_OPEN,

    /**
     * 비활성. 자동 전이 없이 모든 호출을 허용하며 메트릭과 호출 이벤트를 남기지 않습니다.
     */
    DISABLED,

    /**
     * 메트릭 전용. 모든 호출을 허용하고 메트릭과 이벤트는 수집하지만 전이하지 않습니다.
     */
    METRICS_ONLY;

    /**
     * 호출별 이벤트(SUCCESS, ERROR, IGNORED_ERROR, NOT_PERMITTED) 발행 여부.
     *
     * @return FORCED_OPEN, DISABLED가 아닌 경우 true
     */
    public boolean publishesCallEvents() {
        return switch (this) {
            case CLOSED, OPEN, HALF_OPEN, METRICS_ONLY -> true;
            case FORCED_OPEN, DISABLED -> false;
        };
    }

    /**
     * 호출 결과를 윈도우에 기록하는 상태인지 확인.
     *
     * @return CLOSED, HALF_OPEN, METRICS_ONLY인 경우 true
     */
    public boolean recordsOutcomes() {
        return switch (this) {
            case CLOSED, HALF_OPEN, METRICS_ONLY -> true;
            case OPEN, FORCED_OPEN, DISABLED -> false;
        };
    }
}
