package com.ryuqq.circuitbreaker.core.classifier;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * 예외 타입 목록과 Predicate 기반 {@link ErrorClassifier} 구현.
 *
 * <p><strong>분류 규칙:</strong></p>
 * <ol>
 *   <li>ignoreExceptions 타입의 인스턴스이거나 ignoreWhen 조건에 맞으면 IGNORED (항상 우선)</li>
 *   <li>recordExceptions/recordWhen이 하나도 지정되지 않았으면 모든 오류가 FAILURE</li>
 *   <li>지정된 경우, 타입 목록의 인스턴스이거나 recordWhen 조건에 맞으면 FAILURE</li>
 *   <li>그 외 NOT_MATCHED (성공으로 기록)</li>
 * </ol>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ErrorClassifier classifier = ExceptionClassifier.builder()
 *     .recordExceptions(IOException.class, TimeoutException.class)
 *     .ignoreExceptions(IllegalArgumentException.class)
 *     .build();
 * }</pre>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public final class ExceptionClassifier implements ErrorClassifier {

    private static final ExceptionClassifier DEFAULTS = builder().build();

    private final List<Class<? extends Throwable>> recordExceptions;
    private final List<Class<? extends Throwable>> ignoreExceptions;
    private final Predicate<Throwable> recordWhen;
    private final Predicate<Throwable> ignoreWhen;

    private ExceptionClassifier(Builder builder) {
        this.recordExceptions = List.copyOf(builder.recordExceptions);
        this.ignoreExceptions = List.copyOf(builder.ignoreExceptions);
        this.recordWhen = builder.recordWhen;
        this.ignoreWhen = builder.ignoreWhen;
    }

    /**
     * 모든 오류를 실패로 분류하는 기본 분류기.
     *
     * @return 기본 분류기
     */
    public static ExceptionClassifier defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Classification classify(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        if (isInstanceOfAny(error, ignoreExceptions) || (ignoreWhen != null && ignoreWhen.test(error))) {
            return Classification.IGNORED;
        }
        if (recordExceptions.isEmpty() && recordWhen == null) {
            return Classification.FAILURE;
        }
        if (isInstanceOfAny(error, recordExceptions) || (recordWhen != null && recordWhen.test(error))) {
            return Classification.FAILURE;
        }
        return Classification.NOT_MATCHED;
    }

    private static boolean isInstanceOfAny(Throwable error, List<Class<? extends Throwable>> types) {
        for (Class<? extends Throwable> type : types) {
            if (type.isInstance(error)) {
                return true;
            }
        }
        return false;
    }

    /**
     * {@link ExceptionClassifier} 빌더.
     */
    public static final class Builder {

        private final List<Class<? extends Throwable>> recordExceptions = new ArrayList<>();
        private final List<Class<? extends Throwable>> ignoreExceptions = new ArrayList<>();
        private Predicate<Throwable> recordWhen;
        private Predicate<Throwable> ignoreWhen;

        private Builder() {
        }

        /**
         * 실패로 기록할 예외 타입 (하위 타입 포함).
         */
        @SafeVarargs
        public final Builder recordExceptions(Class<? extends Throwable>... types) {
            for (Class<? extends Throwable> type : types) {
                if (type == null) {
                    throw new IllegalArgumentException("recordExceptions cannot contain null");
                }
                recordExceptions.add(type);
            }
            return this;
        }

        /**
         * 무시할 예외 타입 (하위 타입 포함).
         */
        @SafeVarargs
        public final Builder ignoreExceptions(Class<? extends Throwable>... types) {
            for (Class<? extends Throwable> type : types) {
                if (type == null) {
                    throw new IllegalArgumentException("ignoreExceptions cannot contain null");
                }
                ignoreExceptions.add(type);
            }
            return this;
        }

        public Builder recordWhen(Predicate<Throwable> predicate) {
            if (predicate == null) {
                throw new IllegalArgumentException("recordWhen predicate cannot be null");
            }
            this.recordWhen = predicate;
            return this;
        }

        public Builder ignoreWhen(Predicate<Throwable> predicate) {
            if (predicate == null) {
                throw new IllegalArgumentException("ignoreWhen predicate cannot be null");
            }
            this.ignoreWhen = predicate;
            return this;
        }

        public ExceptionClassifier build() {
            return new ExceptionClassifier(this);
        }
    }
}
