package com.ryuqq.circuitbreaker.core.outcome;

/**
 * 설정에 따라 분류된 호출 결과.
 *
 * <p>느린 호출 여부는 성공/실패와 독립적으로 판단됩니다.</p>
 *
 * @param result SUCCESS, FAILURE, IGNORED 중 하나
 * @param slow slowCallDurationThreshold 이상 걸렸는지 여부
 * @param elapsedMs 실행 시간 (밀리초)
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public record ClassifiedOutcome(
    CallResult result,
    boolean slow,
    long elapsedMs
) {

    public ClassifiedOutcome {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        if (elapsedMs < 0) {
            throw new IllegalArgumentException("elapsedMs cannot be negative, but was: " + elapsedMs);
        }
    }

    public boolean isFailure() {
        return result == CallResult.FAILURE;
    }

    public boolean isIgnored() {
        return result == CallResult.IGNORED;
    }
}
