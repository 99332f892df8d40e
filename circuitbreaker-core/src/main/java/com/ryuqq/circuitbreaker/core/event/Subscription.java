package com.ryuqq.circuitbreaker.core.event;

/**
 * 이벤트 구독 핸들.
 *
 * <p>구독자는 버스를 직접 참조하지 않고 이 핸들로만 구독을 해지합니다.</p>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public interface Subscription {

    /**
     * 구독 해지. 여러 번 호출해도 안전합니다 (멱등).
     */
    void cancel();

    /**
     * @return 해지되지 않았으면 true
     */
    boolean isActive();
}
