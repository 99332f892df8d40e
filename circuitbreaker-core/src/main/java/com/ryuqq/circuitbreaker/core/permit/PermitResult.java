package com.ryuqq.circuitbreaker.core.permit;

/**
 * 호출 허가 판단 결과.
 *
 * <p>거부는 예외가 아니라 정상적인 결과값입니다.</p>
 * <ul>
 *   <li>{@link Permitted}: 호출 허용, {@link CallPermit} 포함</li>
 *   <li>{@link Rejected}: 호출 거부 (OPEN, FORCED_OPEN, HALF_OPEN 허용 수 소진)</li>
 * </ul>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public sealed interface PermitResult permits Permitted, Rejected {

    /**
     * 호출이 허용되었는지 확인.
     *
     * @return 허용 여부
     */
    default boolean isPermitted() {
        return this instanceof Permitted;
    }
}
