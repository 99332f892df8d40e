package com.ryuqq.circuitbreaker.core.classifier;

/**
 * 오류 분류 SPI.
 *
 * <p>보호 대상 작업이 던진 오류를 실패/무시/미해당으로 분류합니다.
 * 엔진은 이 인터페이스에만 의존하며, 구체적인 예외 계층 구조를 알지 못합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ErrorClassifier classifier = error -> error instanceof TimeoutException
 *     ? Classification.FAILURE
 *     : Classification.NOT_MATCHED;
 * }</pre>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 * @see ExceptionClassifier
 */
@FunctionalInterface
public interface ErrorClassifier {

    /**
     * 오류 분류.
     *
     * @param error 보호 대상 작업이 던진 오류 (null 아님)
     * @return 분류 결과 (null 반환 금지)
     */
    Classification classify(Throwable error);
}
