package com.ryuqq.circuitbreaker.core.permit;

import com.ryuqq.circuitbreaker.core.state.CircuitBreakerState;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 호출 허가 토큰.
 *
 * <p>{@code permitCall()}이 허용한 호출에만 발급되며, {@code recordResult()}에 반드시 전달해야 합니다.
 * 토큰은 발급한 Circuit Breaker에서 한 번만 사용할 수 있습니다.</p>
 *
 * <p><strong>세대(generation):</strong> 발급 시점의 상태 전이 세대입니다.
 * 그 사이 상태가 바뀌었다면 결과는 이벤트로만 보고되고 새 상태의 윈도우에는 기록되지 않습니다.</p>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public final class CallPermit {

    private final Object issuer;
    private final long generation;
    private final CircuitBreakerState issuedIn;
    private final AtomicBoolean consumed = new AtomicBoolean(false);

    private CallPermit(Object issuer, long generation, CircuitBreakerState issuedIn) {
        this.issuer = issuer;
        this.generation = generation;
        this.issuedIn = issuedIn;
    }

    /**
     * 허가 토큰 발급.
     *
     * @param issuer 발급한 Circuit Breaker
     * @param generation 발급 시점의 상태 전이 세대
     * @param issuedIn 발급 시점의 상태
     * @return 허가 토큰
     * @throws IllegalArgumentException issuer 또는 issuedIn이 null인 경우
     */
    public static CallPermit issue(Object issuer, long generation, CircuitBreakerState issuedIn) {
        if (issuer == null) {
            throw new IllegalArgumentException("issuer cannot be null");
        }
        if (issuedIn == null) {
            throw new IllegalArgumentException("issuedIn cannot be null");
        }
        return new CallPermit(issuer, generation, issuedIn);
    }

    /**
     * 주어진 Circuit Breaker가 발급한 토큰인지 확인.
     */
    public boolean isIssuedBy(Object candidate) {
        return issuer == candidate;
    }

    /**
     * 토큰 사용 처리 (원자적).
     *
     * @return 처음 사용이면 true, 이미 사용된 토큰이면 false
     */
    public boolean consume() {
        return consumed.compareAndSet(false, true);
    }

    public boolean isConsumed() {
        return consumed.get();
    }

    public long getGeneration() {
        return generation;
    }

    public CircuitBreakerState getIssuedIn() {
        return issuedIn;
    }

    @Override
    public String toString() {
        return "CallPermit{generation=" + generation + ", issuedIn=" + issuedIn + ", consumed=" + consumed.get() + '}';
    }
}
