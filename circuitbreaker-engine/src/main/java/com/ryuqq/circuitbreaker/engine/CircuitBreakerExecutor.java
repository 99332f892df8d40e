package com.ryuqq.circuitbreaker.engine;

import com.ryuqq.circuitbreaker.core.exception.CallNotPermittedException;
import com.ryuqq.circuitbreaker.core.outcome.CallOutcome;
import com.ryuqq.circuitbreaker.core.permit.CallPermit;
import com.ryuqq.circuitbreaker.core.permit.PermitResult;
import com.ryuqq.circuitbreaker.core.permit.Permitted;
import com.ryuqq.circuitbreaker.core.permit.Rejected;
import com.ryuqq.circuitbreaker.core.spi.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Circuit Breaker 보호 호출 실행기.
 *
 * <p>permitCall → 실행 시간 측정 → recordResult 흐름을 감싸서,
 * 호출자가 허가 토큰을 직접 다루지 않아도 되게 합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. permitCall()
 *    - Rejected → CallNotPermittedException (작업은 실행하지 않음)
 * 2. 작업 실행 (System.nanoTime으로 실행 시간 측정)
 * 3. recordResult(permit, success | failure)
 * 4. 작업 결과 반환, 또는 작업이 던진 예외를 그대로 다시 던짐
 * </pre>
 *
 * <p>호출자는 {@link CallNotPermittedException}으로 거부와 작업 자체의 실패를 구분합니다.
 * 실패 기록 자체가 실패해도 작업의 예외가 그대로 전파되며, 기록 오류는 suppressed로 붙습니다.</p>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public final class CircuitBreakerExecutor {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerExecutor.class);

    private final CircuitBreaker circuitBreaker;

    /**
     * 생성자.
     *
     * @param circuitBreaker 보호에 사용할 Circuit Breaker
     * @throws IllegalArgumentException circuitBreaker가 null인 경우
     */
    public CircuitBreakerExecutor(CircuitBreaker circuitBreaker) {
        if (circuitBreaker == null) {
            throw new IllegalArgumentException("circuitBreaker cannot be null");
        }
        this.circuitBreaker = circuitBreaker;
    }

    /**
     * Callable 보호 실행.
     *
     * @param callable 작업
     * @return 작업 결과
     * @throws CallNotPermittedException 호출이 거부된 경우
     * @throws Exception 작업이 던진 예외
     */
    public <T> T executeCallable(Callable<T> callable) throws Exception {
        if (callable == null) {
            throw new IllegalArgumentException("callable cannot be null");
        }
        CallPermit permit = acquirePermit();
        long start = System.nanoTime();
        T result;
        try {
            result = callable.call();
        } catch (Throwable e) {
            recordFailure(permit, start, e);
            throw e;
        }
        circuitBreaker.recordResult(permit, CallOutcome.success(elapsedMs(start)));
        return result;
    }

    /**
     * Supplier 보호 실행.
     *
     * @param supplier 작업
     * @return 작업 결과
     * @throws CallNotPermittedException 호출이 거부된 경우
     */
    public <T> T executeSupplier(Supplier<T> supplier) {
        if (supplier == null) {
            throw new IllegalArgumentException("supplier cannot be null");
        }
        CallPermit permit = acquirePermit();
        long start = System.nanoTime();
        T result;
        try {
            result = supplier.get();
        } catch (RuntimeException | Error e) {
            recordFailure(permit, start, e);
            throw e;
        }
        circuitBreaker.recordResult(permit, CallOutcome.success(elapsedMs(start)));
        return result;
    }

    /**
     * Runnable 보호 실행.
     *
     * @param runnable 작업
     * @throws CallNotPermittedException 호출이 거부된 경우
     */
    public void executeRunnable(Runnable runnable) {
        if (runnable == null) {
            throw new IllegalArgumentException("runnable cannot be null");
        }
        executeSupplier(() -> {
            runnable.run();
            return null;
        });
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    private CallPermit acquirePermit() {
        PermitResult decision = circuitBreaker.permitCall();
        if (decision instanceof Rejected rejected) {
            log.debug("Call rejected by circuit breaker '{}' in state {}", rejected.circuitBreakerName(), rejected.state());
            throw rejected.toException();
        }
        return ((Permitted) decision).permit();
    }

    /**
     * 실패 기록. 기록 중 발생한 예외는 작업의 예외에 suppressed로 붙이고 삼키지 않습니다.
     */
    private void recordFailure(CallPermit permit, long startNanos, Throwable error) {
        try {
            circuitBreaker.recordResult(permit, CallOutcome.failure(elapsedMs(startNanos), error));
        } catch (RuntimeException recordingFailure) {
            log.warn("Failed to record failure for circuit breaker '{}'", circuitBreaker.getName(), recordingFailure);
            error.addSuppressed(recordingFailure);
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
