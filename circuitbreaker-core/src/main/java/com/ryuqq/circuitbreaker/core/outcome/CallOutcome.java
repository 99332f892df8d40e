package com.ryuqq.circuitbreaker.core.outcome;

/**
 * 보호 대상 작업의 실행 결과 (분류 전).
 *
 * <p>작업을 감싸는 호출자가 실행 시간과 함께 생성하여
 * {@code recordResult()}로 전달합니다.</p>
 *
 * @param succeeded 오류 없이 완료되었는지 여부
 * @param elapsedMs 실행 시간 (밀리초)
 * @param error 작업이 던진 오류 (succeeded가 true이면 null)
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public record CallOutcome(
    boolean succeeded,
    long elapsedMs,
    Throwable error
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException elapsedMs가 음수이거나, 성공/오류 여부와 error가 일치하지 않는 경우
     */
    public CallOutcome {
        if (elapsedMs < 0) {
            throw new IllegalArgumentException("elapsedMs cannot be negative, but was: " + elapsedMs);
        }
        if (succeeded && error != null) {
            throw new IllegalArgumentException("successful outcome cannot carry an error");
        }
        if (!succeeded && error == null) {
            throw new IllegalArgumentException("failed outcome must carry an error");
        }
    }

    public static CallOutcome success(long elapsedMs) {
        return new CallOutcome(true, elapsedMs, null);
    }

    public static CallOutcome failure(long elapsedMs, Throwable error) {
        return new CallOutcome(false, elapsedMs, error);
    }
}
