package com.ryuqq.circuitbreaker.core.config;

import com.ryuqq.circuitbreaker.core.classifier.Classification;
import com.ryuqq.circuitbreaker.core.classifier.ErrorClassifier;
import com.ryuqq.circuitbreaker.core.classifier.ExceptionClassifier;
import com.ryuqq.circuitbreaker.core.exception.CircuitBreakerConfigurationException;
import com.ryuqq.circuitbreaker.core.outcome.CallOutcome;
import com.ryuqq.circuitbreaker.core.outcome.CallResult;
import com.ryuqq.circuitbreaker.core.outcome.ClassifiedOutcome;

/**
 * Circuit Breaker 설정 (불변 record).
 *
 * <p>생성 시점에 모든 값을 검증하며, 범위를 벗어난 값은
 * {@link CircuitBreakerConfigurationException}으로 거부됩니다.
 * 설정을 바꾸려면 새 Circuit Breaker를 생성해야 합니다.</p>
 *
 * <p><strong>설정 항목 (기본값):</strong></p>
 * <ul>
 *   <li>failureRateThreshold: 실패율 임계값 % (50)</li>
 *   <li>slowCallRateThreshold: 느린 호출 비율 임계값 % (100)</li>
 *   <li>slowCallDurationThresholdMs: 느린 호출 기준 시간 (60000ms)</li>
 *   <li>permittedCallsInHalfOpen: HALF_OPEN 상태 허용 호출 수 (10)</li>
 *   <li>maxWaitDurationInHalfOpenMs: HALF_OPEN 최대 대기 시간, 0이면 무제한 (0)</li>
 *   <li>slidingWindowType: 윈도우 유형 (COUNT_BASED)</li>
 *   <li>slidingWindowSize: 윈도우 크기, 호출 수 또는 초 (100)</li>
 *   <li>minimumNumberOfCalls: 실패율 계산 최소 호출 수 (10)</li>
 *   <li>waitDurationInOpenMs: OPEN 유지 시간 (60000ms)</li>
 *   <li>automaticTransitionFromOpenToHalfOpen: 타이머 기반 자동 전이 (false)</li>
 *   <li>errorClassifier: 오류 분류기 (모든 오류를 실패로 분류)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreakerConfig config = CircuitBreakerConfig.ofDefaults()
 *     .withFailureRateThreshold(25)
 *     .withSlidingWindow(SlidingWindowType.TIME_BASED, 60)
 *     .withWaitDurationInOpenMs(30_000);
 * }</pre>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 * @param failureRateThreshold 실패율 임계값 (0~100)
 * @param slowCallRateThreshold 느린 호출 비율 임계값 (0~100)
 * @param slowCallDurationThresholdMs 느린 호출 기준 시간 (밀리초, 0 이상)
 * @param permittedCallsInHalfOpen HALF_OPEN 허용 호출 수 (1 이상)
 * @param maxWaitDurationInHalfOpenMs HALF_OPEN 최대 대기 시간 (밀리초, 0 이상, 0은 무제한)
 * @param slidingWindowType 윈도우 유형 (null 불가)
 * @param slidingWindowSize 윈도우 크기 (1 이상)
 * @param minimumNumberOfCalls 최소 호출 수 (1 이상)
 * @param waitDurationInOpenMs OPEN 유지 시간 (밀리초, 0 이상)
 * @param automaticTransitionFromOpenToHalfOpen 자동 전이 여부
 * @param errorClassifier 오류 분류기 (null 불가)
 */
public record CircuitBreakerConfig(
    float failureRateThreshold,
    float slowCallRateThreshold,
    long slowCallDurationThresholdMs,
    int permittedCallsInHalfOpen,
    long maxWaitDurationInHalfOpenMs,
    SlidingWindowType slidingWindowType,
    int slidingWindowSize,
    int minimumNumberOfCalls,
    long waitDurationInOpenMs,
    boolean automaticTransitionFromOpenToHalfOpen,
    ErrorClassifier errorClassifier
) {

    public static final float DEFAULT_FAILURE_RATE_THRESHOLD = 50;
    public static final float DEFAULT_SLOW_CALL_RATE_THRESHOLD = 100;
    public static final long DEFAULT_SLOW_CALL_DURATION_THRESHOLD_MS = 60_000L;
    public static final int DEFAULT_PERMITTED_CALLS_IN_HALF_OPEN = 10;
    public static final int DEFAULT_SLIDING_WINDOW_SIZE = 100;
    public static final int DEFAULT_MINIMUM_NUMBER_OF_CALLS = 10;
    public static final long DEFAULT_WAIT_DURATION_IN_OPEN_MS = 60_000L;

    /**
     * 기본 설정 생성자.
     */
    public CircuitBreakerConfig() {
        this(
            DEFAULT_FAILURE_RATE_THRESHOLD,
            DEFAULT_SLOW_CALL_RATE_THRESHOLD,
            DEFAULT_SLOW_CALL_DURATION_THRESHOLD_MS,
            DEFAULT_PERMITTED_CALLS_IN_HALF_OPEN,
            0L,
            SlidingWindowType.COUNT_BASED,
            DEFAULT_SLIDING_WINDOW_SIZE,
            DEFAULT_MINIMUM_NUMBER_OF_CALLS,
            DEFAULT_WAIT_DURATION_IN_OPEN_MS,
            false,
            ExceptionClassifier.defaults()
        );
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws CircuitBreakerConfigurationException 범위를 벗어난 값인 경우
     */
    public CircuitBreakerConfig {
        if (Float.isNaN(failureRateThreshold) || failureRateThreshold < 0 || failureRateThreshold > 100) {
            throw new CircuitBreakerConfigurationException(
                "failureRateThreshold must be between 0 and 100 (current: " + failureRateThreshold + ")"
            );
        }
        if (Float.isNaN(slowCallRateThreshold) || slowCallRateThreshold < 0 || slowCallRateThreshold > 100) {
            throw new CircuitBreakerConfigurationException(
                "slowCallRateThreshold must be between 0 and 100 (current: " + slowCallRateThreshold + ")"
            );
        }
        if (slowCallDurationThresholdMs < 0) {
            throw new CircuitBreakerConfigurationException(
                "slowCallDurationThresholdMs cannot be negative (current: " + slowCallDurationThresholdMs + ")"
            );
        }
        if (permittedCallsInHalfOpen < 1) {
            throw new CircuitBreakerConfigurationException(
                "permittedCallsInHalfOpen must be positive (current: " + permittedCallsInHalfOpen + ")"
            );
        }
        if (maxWaitDurationInHalfOpenMs < 0) {
            throw new CircuitBreakerConfigurationException(
                "maxWaitDurationInHalfOpenMs cannot be negative (current: " + maxWaitDurationInHalfOpenMs + ")"
            );
        }
        if (slidingWindowType == null) {
            throw new CircuitBreakerConfigurationException("slidingWindowType cannot be null");
        }
        if (slidingWindowSize < 1) {
            throw new CircuitBreakerConfigurationException(
                "slidingWindowSize must be positive (current: " + slidingWindowSize + ")"
            );
        }
        if (minimumNumberOfCalls < 1) {
            throw new CircuitBreakerConfigurationException(
                "minimumNumberOfCalls must be positive (current: " + minimumNumberOfCalls + ")"
            );
        }
        if (waitDurationInOpenMs < 0) {
            throw new CircuitBreakerConfigurationException(
                "waitDurationInOpenMs cannot be negative (current: " + waitDurationInOpenMs + ")"
            );
        }
        if (errorClassifier == null) {
            throw new CircuitBreakerConfigurationException("errorClassifier cannot be null");
        }
    }

    /**
     * 기본 설정.
     *
     * @return 모든 항목이 기본값인 설정
     */
    public static CircuitBreakerConfig ofDefaults() {
        return new CircuitBreakerConfig();
    }

    /**
     * CLOSED 상태에서 임계값 평가에 필요한 실제 최소 호출 수.
     *
     * <p>COUNT_BASED 윈도우는 windowSize보다 많은 호출을 담을 수 없으므로
     * min(minimumNumberOfCalls, slidingWindowSize)를 사용합니다.</p>
     *
     * @return 실제 최소 호출 수
     */
    public int effectiveMinimumNumberOfCalls() {
        return switch (slidingWindowType) {
            case COUNT_BASED -> Math.min(minimumNumberOfCalls, slidingWindowSize);
            case TIME_BASED -> minimumNumberOfCalls;
        };
    }

    /**
     * 느린 호출 여부.
     *
     * @param elapsedMs 실행 시간 (밀리초)
     * @return elapsedMs >= slowCallDurationThresholdMs
     */
    public boolean isSlow(long elapsedMs) {
        return elapsedMs >= slowCallDurationThresholdMs;
    }

    /**
     * 호출 결과 분류.
     *
     * <p>오류가 없으면 SUCCESS, 분류기가 IGNORED로 판단하면 IGNORED,
     * FAILURE로 판단하면 FAILURE, 그 외에는 SUCCESS입니다.</p>
     *
     * @param outcome 분류할 호출 결과
     * @return 분류된 결과
     * @throws IllegalArgumentException outcome이 null이거나 분류기가 null을 반환한 경우
     */
    public ClassifiedOutcome classify(CallOutcome outcome) {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        boolean slow = isSlow(outcome.elapsedMs());
        if (outcome.succeeded()) {
            return new ClassifiedOutcome(CallResult.SUCCESS, slow, outcome.elapsedMs());
        }

        Classification classification = errorClassifier.classify(outcome.error());
        if (classification == null) {
            throw new IllegalArgumentException("errorClassifier returned null for " + outcome.error());
        }
        CallResult result = switch (classification) {
            case IGNORED -> CallResult.IGNORED;
            case FAILURE -> CallResult.FAILURE;
            case NOT_MATCHED -> CallResult.SUCCESS;
        };
        return new ClassifiedOutcome(result, slow, outcome.elapsedMs());
    }

    public CircuitBreakerConfig withFailureRateThreshold(float failureRateThreshold) {
        return new CircuitBreakerConfig(failureRateThreshold, slowCallRateThreshold, slowCallDurationThresholdMs,
            permittedCallsInHalfOpen, maxWaitDurationInHalfOpenMs, slidingWindowType, slidingWindowSize,
            minimumNumberOfCalls, waitDurationInOpenMs, automaticTransitionFromOpenToHalfOpen, errorClassifier);
    }

    public CircuitBreakerConfig withSlowCallRateThreshold(float slowCallRateThreshold) {
        return new CircuitBreakerConfig(failureRateThreshold, slowCallRateThreshold, slowCallDurationThresholdMs,
            permittedCallsInHalfOpen, maxWaitDurationInHalfOpenMs, slidingWindowType, slidingWindowSize,
            minimumNumberOfCalls, waitDurationInOpenMs, automaticTransitionFromOpenToHalfOpen, errorClassifier);
    }

    public CircuitBreakerConfig withSlowCallDurationThresholdMs(long slowCallDurationThresholdMs) {
        return new CircuitBreakerConfig(failureRateThreshold, slowCallRateThreshold, slowCallDurationThresholdMs,
            permittedCallsInHalfOpen, maxWaitDurationInHalfOpenMs, slidingWindowType, slidingWindowSize,
            minimumNumberOfCalls, waitDurationInOpenMs, automaticTransitionFromOpenToHalfOpen, errorClassifier);
    }

    public CircuitBreakerConfig withPermittedCallsInHalfOpen(int permittedCallsInHalfOpen) {
        return new CircuitBreakerConfig(failureRateThreshold, slowCallRateThreshold, slowCallDurationThresholdMs,
            permittedCallsInHalfOpen, maxWaitDurationInHalfOpenMs, slidingWindowType, slidingWindowSize,
            minimumNumberOfCalls, waitDurationInOpenMs, automaticTransitionFromOpenToHalfOpen, errorClassifier);
    }

    public CircuitBreakerConfig withMaxWaitDurationInHalfOpenMs(long maxWaitDurationInHalfOpenMs) {
        return new CircuitBreakerConfig(failureRateThreshold, slowCallRateThreshold, slowCallDurationThresholdMs,
            permittedCallsInHalfOpen, maxWaitDurationInHalfOpenMs, slidingWindowType, slidingWindowSize,
            minimumNumberOfCalls, waitDurationInOpenMs, automaticTransitionFromOpenToHalfOpen, errorClassifier);
    }

    /**
     * 윈도우 유형과 크기를 함께 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withSlidingWindow(SlidingWindowType slidingWindowType, int slidingWindowSize) {
        return new CircuitBreakerConfig(failureRateThreshold, slowCallRateThreshold, slowCallDurationThresholdMs,
            permittedCallsInHalfOpen, maxWaitDurationInHalfOpenMs, slidingWindowType, slidingWindowSize,
            minimumNumberOfCalls, waitDurationInOpenMs, automaticTransitionFromOpenToHalfOpen, errorClassifier);
    }

    public CircuitBreakerConfig withSlidingWindowType(SlidingWindowType slidingWindowType) {
        return withSlidingWindow(slidingWindowType, slidingWindowSize);
    }

    public CircuitBreakerConfig withSlidingWindowSize(int slidingWindowSize) {
        return withSlidingWindow(slidingWindowType, slidingWindowSize);
    }

    public CircuitBreakerConfig withMinimumNumberOfCalls(int minimumNumberOfCalls) {
        return new CircuitBreakerConfig(failureRateThreshold, slowCallRateThreshold, slowCallDurationThresholdMs,
            permittedCallsInHalfOpen, maxWaitDurationInHalfOpenMs, slidingWindowType, slidingWindowSize,
            minimumNumberOfCalls, waitDurationInOpenMs, automaticTransitionFromOpenToHalfOpen, errorClassifier);
    }

    public CircuitBreakerConfig withWaitDurationInOpenMs(long waitDurationInOpenMs) {
        return new CircuitBreakerConfig(failureRateThreshold, slowCallRateThreshold, slowCallDurationThresholdMs,
            permittedCallsInHalfOpen, maxWaitDurationInHalfOpenMs, slidingWindowType, slidingWindowSize,
            minimumNumberOfCalls, waitDurationInOpenMs, automaticTransitionFromOpenToHalfOpen, errorClassifier);
    }

    public CircuitBreakerConfig withAutomaticTransitionFromOpenToHalfOpen(boolean enabled) {
        return new CircuitBreakerConfig(failureRateThreshold, slowCallRateThreshold, slowCallDurationThresholdMs,
            permittedCallsInHalfOpen, maxWaitDurationInHalfOpenMs, slidingWindowType, slidingWindowSize,
            minimumNumberOfCalls, waitDurationInOpenMs, enabled, errorClassifier);
    }

    public CircuitBreakerConfig withErrorClassifier(ErrorClassifier errorClassifier) {
        return new CircuitBreakerConfig(failureRateThreshold, slowCallRateThreshold, slowCallDurationThresholdMs,
            permittedCallsInHalfOpen, maxWaitDurationInHalfOpenMs, slidingWindowType, slidingWindowSize,
            minimumNumberOfCalls, waitDurationInOpenMs, automaticTransitionFromOpenToHalfOpen, errorClassifier);
    }
}
