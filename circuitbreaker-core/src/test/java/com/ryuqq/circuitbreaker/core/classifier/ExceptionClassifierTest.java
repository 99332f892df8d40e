package com.ryuqq.circuitbreaker.core.classifier;

import org.junit.jupiter.api.Test;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ExceptionClassifier 유닛 테스트.
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
class ExceptionClassifierTest {

    @Test
    void 기본_분류기는_모든_오류를_실패로_분류() {
        ErrorClassifier classifier = ExceptionClassifier.defaults();

        assertThat(classifier.classify(new RuntimeException())).isEqualTo(Classification.FAILURE);
        assertThat(classifier.classify(new IOException())).isEqualTo(Classification.FAILURE);
        assertThat(classifier.classify(new Error())).isEqualTo(Classification.FAILURE);
    }

    @Test
    void recordExceptions_지정시_하위_타입도_실패() {
        ErrorClassifier classifier = ExceptionClassifier.builder()
            .recordExceptions(IOException.class)
            .build();

        assertThat(classifier.classify(new FileNotFoundException())).isEqualTo(Classification.FAILURE);
        assertThat(classifier.classify(new IllegalStateException())).isEqualTo(Classification.NOT_MATCHED);
    }

    @Test
    void recordWhen_조건에_맞으면_실패() {
        ErrorClassifier classifier = ExceptionClassifier.builder()
            .recordWhen(error -> error.getMessage() != null && error.getMessage().startsWith("5"))
            .build();

        assertThat(classifier.classify(new RuntimeException("503"))).isEqualTo(Classification.FAILURE);
        assertThat(classifier.classify(new RuntimeException("404"))).isEqualTo(Classification.NOT_MATCHED);
    }

    @Test
    void ignore는_record보다_우선() {
        // given
        ErrorClassifier classifier = ExceptionClassifier.builder()
            .recordExceptions(IOException.class)
            .ignoreExceptions(FileNotFoundException.class)
            .build();

        // when & then
        assertThat(classifier.classify(new FileNotFoundException())).isEqualTo(Classification.IGNORED);
        assertThat(classifier.classify(new IOException())).isEqualTo(Classification.FAILURE);
    }

    @Test
    void ignoreWhen_조건에_맞으면_무시() {
        ErrorClassifier classifier = ExceptionClassifier.builder()
            .ignoreWhen(error -> error instanceof TimeoutException)
            .build();

        assertThat(classifier.classify(new TimeoutException())).isEqualTo(Classification.IGNORED);
        assertThat(classifier.classify(new RuntimeException())).isEqualTo(Classification.FAILURE);
    }

    @Test
    void null_인자는_거부() {
        assertThatThrownBy(() -> ExceptionClassifier.defaults().classify(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ExceptionClassifier.builder().recordWhen(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ExceptionClassifier.builder().ignoreExceptions(IOException.class, null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
