package com.ryuqq.circuitbreaker.engine;

import com.ryuqq.circuitbreaker.core.config.CircuitBreakerConfig;
import com.ryuqq.circuitbreaker.core.event.CircuitBreakerEvent;
import com.ryuqq.circuitbreaker.core.event.CircuitBreakerEventType;
import com.ryuqq.circuitbreaker.core.event.ErrorEvent;
import com.ryuqq.circuitbreaker.core.event.FailureRateExceededEvent;
import com.ryuqq.circuitbreaker.core.event.IgnoredErrorEvent;
import com.ryuqq.circuitbreaker.core.event.NotPermittedEvent;
import com.ryuqq.circuitbreaker.core.event.ResetEvent;
import com.ryuqq.circuitbreaker.core.event.SlowCallRateExceededEvent;
import com.ryuqq.circuitbreaker.core.event.StateTransitionEvent;
import com.ryuqq.circuitbreaker.core.event.SuccessEvent;
import com.ryuqq.circuitbreaker.core.exception.ProtocolViolationException;
import com.ryuqq.circuitbreaker.core.metrics.CircuitBreakerMetrics;
import com.ryuqq.circuitbreaker.core.outcome.CallOutcome;
import com.ryuqq.circuitbreaker.core.outcome.ClassifiedOutcome;
import com.ryuqq.circuitbreaker.core.permit.CallPermit;
import com.ryuqq.circuitbreaker.core.permit.PermitResult;
import com.ryuqq.circuitbreaker.core.permit.Permitted;
import com.ryuqq.circuitbreaker.core.permit.Rejected;
import com.ryuqq.circuitbreaker.core.spi.CircuitBreaker;
import com.ryuqq.circuitbreaker.core.spi.EventBus;
import com.ryuqq.circuitbreaker.core.state.CircuitBreakerState;
import com.ryuqq.circuitbreaker.core.state.StateTransition;
import com.ryuqq.circuitbreaker.core.window.OutcomeWindow;
import com.ryuqq.circuitbreaker.core.window.OutcomeWindows;
import com.ryuqq.circuitbreaker.core.window.WindowSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Circuit Breaker 상태 머신 (기본 구현).
 *
 * <p>최근 호출 결과를 슬라이딩 윈도우에 기록하고, 실패율 또는 느린 호출 비율이
 * 임계값에 도달하면 OPEN으로 전이하여 호출을 차단합니다.</p>
 *
 * <p><strong>동시성 모델:</strong></p>
 * <ul>
 *   <li>상태 락: 상태, 두 윈도우, 카운터를 보호. 읽기 → 기록 → 평가 → 전이가 하나의 임계 구역</li>
 *   <li>발행 락: 상태 락을 놓기 전에 획득하여 이벤트가 커밋 순서대로 발행됨</li>
 *   <li>이벤트 발행은 상태 락 밖에서 수행 (구독자가 느려도 다른 스레드의 판단을 막지 않음)</li>
 * </ul>
 *
 * <p><strong>세대(generation):</strong></p>
 * <ul>
 *   <li>모든 전이와 reset()마다 1 증가</li>
 *   <li>이전 세대 허가 토큰의 결과는 이벤트만 발행하고 윈도우에는 기록하지 않음</li>
 *   <li>예약된 시간 전이는 예약 시점 세대와 현재 세대가 같을 때만 실행</li>
 * </ul>
 *
 * <p>구독자는 이벤트를 받은 스레드에서 이 Circuit Breaker를 다시 호출하면 안 됩니다.
 * {@link com.ryuqq.circuitbreaker.core.event.BoundedQueueEventSink}로 받아 다른 스레드에서 처리하세요.</p>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public final class CircuitBreakerStateMachine implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerStateMachine.class);

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final TransitionScheduler scheduler;
    private final InMemoryEventBus<CircuitBreakerEventType, CircuitBreakerEvent> eventBus;

    private final ReentrantLock stateLock = new ReentrantLock();
    private final ReentrantLock publicationLock = new ReentrantLock();

    // 아래 필드는 모두 stateLock으로 보호
    private final OutcomeWindow closedWindow;
    private final OutcomeWindow halfOpenWindow;
    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private long generation;
    private long openedAtMs;
    private long halfOpenEnteredAtMs;
    private int halfOpenPermitsIssued;
    private long notPermittedCalls;
    private WindowSnapshot frozenClosedSnapshot = WindowSnapshot.EMPTY;
    private boolean failureRateAlarmRaised;
    private boolean slowCallRateAlarmRaised;
    private ScheduledFuture<?> pendingTransition;

    /**
     * 시스템 시계와 공유 스케줄러를 사용하는 생성자.
     *
     * @param name 이름
     * @param config 설정
     */
    public CircuitBreakerStateMachine(String name, CircuitBreakerConfig config) {
        this(name, config, Clock.systemUTC(), TransitionScheduler.shared());
    }

    /**
     * 시계를 주입하는 생성자.
     *
     * @param name 이름
     * @param config 설정
     * @param clock 시계 (대기 시간, 시간 기반 윈도우, 이벤트 시각)
     */
    public CircuitBreakerStateMachine(String name, CircuitBreakerConfig config, Clock clock) {
        this(name, config, clock, TransitionScheduler.shared());
    }

    /**
     * 생성자.
     *
     * @param name 이름
     * @param config 설정
     * @param clock 시계
     * @param scheduler 시간 전이 스케줄러
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public CircuitBreakerStateMachine(String name, CircuitBreakerConfig config, Clock clock, TransitionScheduler scheduler) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        this.name = name;
        this.config = config;
        this.clock = clock;
        this.scheduler = scheduler;
        this.eventBus = new InMemoryEventBus<>(name);
        this.closedWindow = OutcomeWindows.forClosedState(config, clock);
        this.halfOpenWindow = OutcomeWindows.forHalfOpenState(config);
    }

    @Override
    public PermitResult permitCall() {
        return commit(pending -> {
            long now = clock.millis();
            return switch (state) {
                case CLOSED, DISABLED, METRICS_ONLY -> permit();
                case FORCED_OPEN -> reject(pending);
                case OPEN -> permitFromOpen(now, pending);
                case HALF_OPEN -> permitFromHalfOpen(now, pending);
            };
        });
    }

    @Override
    public void recordResult(CallPermit permit, CallOutcome outcome) {
        if (permit == null) {
            throw new ProtocolViolationException("recordResult requires the permit returned by permitCall()");
        }
        if (!permit.isIssuedBy(this)) {
            throw new ProtocolViolationException("permit was not issued by circuit breaker '" + name + "'");
        }
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        ClassifiedOutcome classified;
        try {
            classified = config.classify(outcome);
        } catch (RuntimeException e) {
            if (permit.consume()) {
                releasePermit(permit);
            }
            throw e;
        }
        if (!permit.consume()) {
            throw new ProtocolViolationException("permit already used for circuit breaker '" + name + "'");
        }

        commit(pending -> {
            if (state.publishesCallEvents()) {
                pending.add(callEvent(classified, outcome));
            }
            if (permit.getGeneration() != generation) {
                log.debug("Circuit breaker '{}' ignored stale {} result (permit from {}, now {})",
                    name, classified.result(), permit.getIssuedIn(), state);
                return null;
            }
            if (!state.recordsOutcomes()) {
                log.debug("Circuit breaker '{}' not recording in {}", name, state);
                return null;
            }
            switch (state) {
                case CLOSED -> onClosedResult(classified, pending);
                case HALF_OPEN -> onHalfOpenResult(classified, pending);
                case METRICS_ONLY -> onMetricsOnlyResult(classified, pending);
                default -> throw new IllegalStateException("Unexpected recording state: " + state);
            }
            return null;
        });
    }

    /**
     * 분류기가 실패해 기록하지 못한 토큰의 HALF_OPEN 시도 슬롯을 반환.
     */
    private void releasePermit(CallPermit permit) {
        commit(pending -> {
            log.warn("Circuit breaker '{}' could not classify outcome; permit released without recording", name);
            if (state == CircuitBreakerState.HALF_OPEN
                && permit.getGeneration() == generation
                && halfOpenPermitsIssued > 0) {
                halfOpenPermitsIssued--;
            }
            return null;
        });
    }

    @Override
    public boolean isPermittingCalls() {
        stateLock.lock();
        try {
            long now = clock.millis();
            return switch (state) {
                case CLOSED, DISABLED, METRICS_ONLY -> true;
                case FORCED_OPEN -> false;
                case OPEN -> now - openedAtMs >= config.waitDurationInOpenMs();
                case HALF_OPEN -> !halfOpenWaitExpired(now) && halfOpenPermitsIssued < config.permittedCallsInHalfOpen();
            };
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public void transitionToClosedState() {
        manualTransition(CircuitBreakerState.CLOSED);
    }

    @Override
    public void transitionToOpenState() {
        manualTransition(CircuitBreakerState.OPEN);
    }

    @Override
    public void transitionToHalfOpenState() {
        manualTransition(CircuitBreakerState.HALF_OPEN);
    }

    @Override
    public void transitionToForcedOpenState() {
        manualTransition(CircuitBreakerState.FORCED_OPEN);
    }

    @Override
    public void transitionToDisabledState() {
        manualTransition(CircuitBreakerState.DISABLED);
    }

    @Override
    public void transitionToMetricsOnlyState() {
        manualTransition(CircuitBreakerState.METRICS_ONLY);
    }

    @Override
    public void reset() {
        commit(pending -> {
            cancelPendingTransition();
            state = CircuitBreakerState.CLOSED;
            generation++;
            closedWindow.reset();
            halfOpenWindow.reset();
            halfOpenPermitsIssued = 0;
            notPermittedCalls = 0;
            frozenClosedSnapshot = WindowSnapshot.EMPTY;
            failureRateAlarmRaised = false;
            slowCallRateAlarmRaised = false;
            pending.add(new ResetEvent(name, now()));
            log.info("Circuit breaker '{}' reset", name);
            return null;
        });
    }

    @Override
    public CircuitBreakerState getState() {
        stateLock.lock();
        try {
            return state;
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p>OPEN, FORCED_OPEN, DISABLED에서는 마지막으로 CLOSED(또는 METRICS_ONLY)를
     * 떠날 때 고정된 윈도우 값을 보고합니다.</p>
     */
    @Override
    public CircuitBreakerMetrics getMetrics() {
        stateLock.lock();
        try {
            int closedMinimum = config.effectiveMinimumNumberOfCalls();
            return switch (state) {
                case CLOSED, METRICS_ONLY ->
                    CircuitBreakerMetrics.of(closedWindow.snapshot(), closedMinimum, notPermittedCalls);
                case HALF_OPEN ->
                    CircuitBreakerMetrics.of(halfOpenWindow.snapshot(), config.permittedCallsInHalfOpen(), notPermittedCalls);
                case OPEN, FORCED_OPEN, DISABLED ->
                    CircuitBreakerMetrics.of(frozenClosedSnapshot, closedMinimum, notPermittedCalls);
            };
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public CircuitBreakerConfig getConfig() {
        return config;
    }

    @Override
    public EventBus<CircuitBreakerEventType, CircuitBreakerEvent> getEventBus() {
        return eventBus;
    }

    @Override
    public String toString() {
        return "CircuitBreaker{name='" + name + "', state=" + getState() + '}';
    }

    /**
     * 상태 변경 후 모인 이벤트를 커밋 순서대로 발행.
     *
     * <p>발행 락은 상태 락을 놓기 전에 획득합니다. 작업이 예외를 던지면 발행 락은 잡지 않습니다.</p>
     */
    private <R> R commit(Function<List<CircuitBreakerEvent>, R> action) {
        List<CircuitBreakerEvent> pending = new ArrayList<>(2);
        R result;
        stateLock.lock();
        try {
            result = action.apply(pending);
            publicationLock.lock();
        } finally {
            stateLock.unlock();
        }

        try {
            for (CircuitBreakerEvent event : pending) {
                eventBus.publish(event);
            }
        } finally {
            publicationLock.unlock();
        }
        return result;
    }

    private PermitResult permit() {
        return new Permitted(CallPermit.issue(this, generation, state));
    }

    private PermitResult reject(List<CircuitBreakerEvent> pending) {
        notPermittedCalls++;
        if (state.publishesCallEvents()) {
            pending.add(new NotPermittedEvent(name, now()));
        }
        return new Rejected(name, state);
    }

    private PermitResult permitFromOpen(long now, List<CircuitBreakerEvent> pending) {
        if (now - openedAtMs < config.waitDurationInOpenMs()) {
            return reject(pending);
        }
        transitionTo(CircuitBreakerState.HALF_OPEN, pending);
        return permitFromHalfOpen(now, pending);
    }

    private PermitResult permitFromHalfOpen(long now, List<CircuitBreakerEvent> pending) {
        if (halfOpenWaitExpired(now)) {
            log.info("Circuit breaker '{}' exceeded max wait in HALF_OPEN", name);
            transitionTo(CircuitBreakerState.OPEN, pending);
            return reject(pending);
        }
        if (halfOpenPermitsIssued >= config.permittedCallsInHalfOpen()) {
            return reject(pending);
        }
        halfOpenPermitsIssued++;
        return permit();
    }

    private boolean halfOpenWaitExpired(long now) {
        long maxWait = config.maxWaitDurationInHalfOpenMs();
        return maxWait > 0 && now - halfOpenEnteredAtMs >= maxWait;
    }

    private void onClosedResult(ClassifiedOutcome outcome, List<CircuitBreakerEvent> pending) {
        if (outcome.isIgnored()) {
            return;
        }
        closedWindow.record(outcome);
        WindowSnapshot snapshot = closedWindow.snapshot();
        log.debug("Circuit breaker '{}' recorded {} (total: {}, failed: {}, slow: {})",
            name, outcome.result(), snapshot.totalCalls(), snapshot.failedCalls(), snapshot.slowCalls());

        if (snapshot.totalCalls() < config.effectiveMinimumNumberOfCalls()) {
            return;
        }
        if (raiseExceededEvents(snapshot, pending)) {
            transitionTo(CircuitBreakerState.OPEN, pending);
        }
    }

    private void onHalfOpenResult(ClassifiedOutcome outcome, List<CircuitBreakerEvent> pending) {
        if (outcome.isIgnored()) {
            if (halfOpenPermitsIssued > 0) {
                halfOpenPermitsIssued--;
            }
            return;
        }
        halfOpenWindow.record(outcome);
        WindowSnapshot snapshot = halfOpenWindow.snapshot();
        log.debug("Circuit breaker '{}' recorded trial {} ({}/{})",
            name, outcome.result(), snapshot.totalCalls(), config.permittedCallsInHalfOpen());

        if (snapshot.totalCalls() < config.permittedCallsInHalfOpen()) {
            return;
        }
        if (raiseExceededEvents(snapshot, pending)) {
            transitionTo(CircuitBreakerState.OPEN, pending);
        } else {
            transitionTo(CircuitBreakerState.CLOSED, pending);
        }
    }

    private void onMetricsOnlyResult(ClassifiedOutcome outcome, List<CircuitBreakerEvent> pending) {
        if (outcome.isIgnored()) {
            return;
        }
        closedWindow.record(outcome);
        WindowSnapshot snapshot = closedWindow.snapshot();
        if (snapshot.totalCalls() < config.effectiveMinimumNumberOfCalls()) {
            return;
        }

        // 임계값을 넘는 순간에만 한 번 발행, 비율이 내려가면 다시 무장
        boolean failureExceeded = snapshot.failureRate() >= config.failureRateThreshold();
        if (failureExceeded && !failureRateAlarmRaised) {
            pending.add(new FailureRateExceededEvent(name, now(), snapshot.failureRate()));
        }
        failureRateAlarmRaised = failureExceeded;

        boolean slowExceeded = snapshot.slowCallRate() >= config.slowCallRateThreshold();
        if (slowExceeded && !slowCallRateAlarmRaised) {
            pending.add(new SlowCallRateExceededEvent(name, now(), snapshot.slowCallRate()));
        }
        slowCallRateAlarmRaised = slowExceeded;
    }

    /**
     * 임계값 평가. 초과한 비율마다 이벤트를 추가합니다.
     *
     * @return 하나라도 임계값 이상이면 true
     */
    private boolean raiseExceededEvents(WindowSnapshot snapshot, List<CircuitBreakerEvent> pending) {
        boolean failureExceeded = snapshot.failureRate() >= config.failureRateThreshold();
        boolean slowExceeded = snapshot.slowCallRate() >= config.slowCallRateThreshold();
        if (failureExceeded) {
            log.info("Circuit breaker '{}' failure rate {}% reached threshold {}%",
                name, snapshot.failureRate(), config.failureRateThreshold());
            pending.add(new FailureRateExceededEvent(name, now(), snapshot.failureRate()));
        }
        if (slowExceeded) {
            log.info("Circuit breaker '{}' slow call rate {}% reached threshold {}%",
                name, snapshot.slowCallRate(), config.slowCallRateThreshold());
            pending.add(new SlowCallRateExceededEvent(name, now(), snapshot.slowCallRate()));
        }
        return failureExceeded || slowExceeded;
    }

    private void manualTransition(CircuitBreakerState target) {
        commit(pending -> {
            transitionTo(target, pending);
            return null;
        });
    }

    /**
     * 상태 전이. stateLock을 잡은 상태에서만 호출합니다.
     */
    private void transitionTo(CircuitBreakerState target, List<CircuitBreakerEvent> pending) {
        CircuitBreakerState from = state;
        cancelPendingTransition();
        if (from == CircuitBreakerState.CLOSED || from == CircuitBreakerState.METRICS_ONLY) {
            frozenClosedSnapshot = closedWindow.snapshot();
        }

        state = target;
        generation++;
        notPermittedCalls = 0;
        long now = clock.millis();

        switch (target) {
            case CLOSED, METRICS_ONLY -> {
                closedWindow.reset();
                failureRateAlarmRaised = false;
                slowCallRateAlarmRaised = false;
            }
            case OPEN -> {
                openedAtMs = now;
                halfOpenWindow.reset();
                halfOpenPermitsIssued = 0;
                if (config.automaticTransitionFromOpenToHalfOpen()) {
                    scheduleTransition(CircuitBreakerState.OPEN, CircuitBreakerState.HALF_OPEN, config.waitDurationInOpenMs());
                }
            }
            case HALF_OPEN -> {
                halfOpenEnteredAtMs = now;
                halfOpenWindow.reset();
                halfOpenPermitsIssued = 0;
                if (config.maxWaitDurationInHalfOpenMs() > 0) {
                    scheduleTransition(CircuitBreakerState.HALF_OPEN, CircuitBreakerState.OPEN, config.maxWaitDurationInHalfOpenMs());
                }
            }
            case FORCED_OPEN, DISABLED -> {
                halfOpenWindow.reset();
                halfOpenPermitsIssued = 0;
            }
        }

        StateTransition transition = StateTransition.between(from, target);
        pending.add(new StateTransitionEvent(name, now(), transition));
        log.info("Circuit breaker '{}' changed state: {}", name, transition);
    }

    private void scheduleTransition(CircuitBreakerState expected, CircuitBreakerState target, long delayMs) {
        long scheduledGeneration = generation;
        pendingTransition = scheduler.schedule(
            () -> onScheduledTransition(scheduledGeneration, expected, target), delayMs);
        log.debug("Circuit breaker '{}' scheduled {} -> {} in {}ms", name, expected, target, delayMs);
    }

    private void onScheduledTransition(long scheduledGeneration, CircuitBreakerState expected, CircuitBreakerState target) {
        commit(pending -> {
            if (generation != scheduledGeneration || state != expected) {
                log.debug("Circuit breaker '{}' skipped stale scheduled transition to {}", name, target);
                return null;
            }
            pendingTransition = null;
            transitionTo(target, pending);
            return null;
        });
    }

    private void cancelPendingTransition() {
        if (pendingTransition != null) {
            pendingTransition.cancel(false);
            pendingTransition = null;
        }
    }

    private CircuitBreakerEvent callEvent(ClassifiedOutcome classified, CallOutcome outcome) {
        Duration elapsed = Duration.ofMillis(classified.elapsedMs());
        return switch (classified.result()) {
            case SUCCESS -> new SuccessEvent(name, now(), elapsed);
            case FAILURE -> new ErrorEvent(name, now(), elapsed, outcome.error());
            case IGNORED -> new IgnoredErrorEvent(name, now(), elapsed, outcome.error());
        };
    }

    private ZonedDateTime now() {
        return ZonedDateTime.now(clock);
    }
}
