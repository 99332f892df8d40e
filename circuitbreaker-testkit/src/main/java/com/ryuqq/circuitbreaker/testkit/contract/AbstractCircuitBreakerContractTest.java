package com.ryuqq.circuitbreaker.testkit.contract;

import com.ryuqq.circuitbreaker.core.config.CircuitBreakerConfig;
import com.ryuqq.circuitbreaker.core.event.CircuitBreakerEvent;
import com.ryuqq.circuitbreaker.core.event.StateTransitionEvent;
import com.ryuqq.circuitbreaker.core.outcome.CallOutcome;
import com.ryuqq.circuitbreaker.core.permit.CallPermit;
import com.ryuqq.circuitbreaker.core.permit.PermitResult;
import com.ryuqq.circuitbreaker.core.permit.Permitted;
import com.ryuqq.circuitbreaker.core.spi.CircuitBreaker;
import com.ryuqq.circuitbreaker.core.state.CircuitBreakerState;
import com.ryuqq.circuitbreaker.core.state.StateTransition;
import com.ryuqq.circuitbreaker.engine.CircuitBreakerStateMachine;
import com.ryuqq.circuitbreaker.engine.TransitionScheduler;
import com.ryuqq.circuitbreaker.testkit.fixture.MutableClock;
import com.ryuqq.circuitbreaker.testkit.fixture.RecordingEventSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for circuit breaker Contract Tests.
 *
 * <p>This class provides a manually driven clock, a private transition scheduler and
 * helper methods that run the permit → record protocol.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>MutableClock: wait durations and time-based windows without sleeping</li>
 *   <li>TransitionScheduler: daemon scheduler closed after each test</li>
 *   <li>RecordingEventSink: created per breaker by {@link #subscribe(CircuitBreaker)}</li>
 * </ul>
 *
 * <p>Override {@link #createCircuitBreaker(String, CircuitBreakerConfig)} to run the same
 * contracts against another {@link CircuitBreaker} implementation.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractCircuitBreakerContractTest {
 *     {@literal @}Test
 *     void scenario() {
 *         CircuitBreaker cb = createCircuitBreaker("test", CircuitBreakerConfig.ofDefaults());
 *         recordFailure(cb);
 *         assertState(cb, CircuitBreakerState.CLOSED);
 *     }
 * }
 * </pre>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public abstract class AbstractCircuitBreakerContractTest {

    protected static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    protected MutableClock clock;
    protected TransitionScheduler scheduler;

    @BeforeEach
    void setUpFixtures() {
        clock = MutableClock.startingAt(START);
        scheduler = TransitionScheduler.newDaemonScheduler();
    }

    @AfterEach
    void tearDownFixtures() {
        if (scheduler != null) {
            scheduler.close();
        }
    }

    /**
     * Creates the circuit breaker under test.
     *
     * @param name breaker name
     * @param config configuration
     * @return new breaker bound to {@link #clock} and {@link #scheduler}
     */
    protected CircuitBreaker createCircuitBreaker(String name, CircuitBreakerConfig config) {
        return new CircuitBreakerStateMachine(name, config, clock, scheduler);
    }

    /**
     * Subscribes a recording sink to every event of the breaker.
     *
     * @param circuitBreaker breaker
     * @return sink
     */
    protected RecordingEventSink<CircuitBreakerEvent> subscribe(CircuitBreaker circuitBreaker) {
        RecordingEventSink<CircuitBreakerEvent> sink = new RecordingEventSink<>();
        circuitBreaker.getEventBus().subscribe(sink);
        return sink;
    }

    /**
     * Acquires a permit, failing the test when the call is rejected.
     *
     * @param circuitBreaker breaker
     * @return permit
     */
    protected CallPermit acquire(CircuitBreaker circuitBreaker) {
        PermitResult result = circuitBreaker.permitCall();
        assertTrue(result.isPermitted(),
                String.format("Expected call to be permitted but was rejected in state %s", circuitBreaker.getState()));
        return ((Permitted) result).permit();
    }

    protected void recordSuccess(CircuitBreaker circuitBreaker) {
        circuitBreaker.recordResult(acquire(circuitBreaker), CallOutcome.success(1));
    }

    protected void recordFailure(CircuitBreaker circuitBreaker) {
        recordError(circuitBreaker, new RuntimeException("simulated failure"));
    }

    protected void recordError(CircuitBreaker circuitBreaker, Throwable error) {
        circuitBreaker.recordResult(acquire(circuitBreaker), CallOutcome.failure(1, error));
    }

    /**
     * Records a sequence written as 'S' (success) and 'F' (failure), e.g. {@code "FFSS"}.
     *
     * @param circuitBreaker breaker
     * @param sequence outcome sequence
     */
    protected void recordSequence(CircuitBreaker circuitBreaker, String sequence) {
        for (char outcome : sequence.toCharArray()) {
            switch (outcome) {
                case 'S' -> recordSuccess(circuitBreaker);
                case 'F' -> recordFailure(circuitBreaker);
                default -> throw new IllegalArgumentException("Unknown outcome symbol: " + outcome);
            }
        }
    }

    protected void assertState(CircuitBreaker circuitBreaker, CircuitBreakerState expectedState) {
        CircuitBreakerState actualState = circuitBreaker.getState();
        assertEquals(expectedState, actualState,
                String.format("Expected circuit breaker state %s but was %s for '%s'",
                        expectedState, actualState, circuitBreaker.getName()));
    }

    /**
     * Asserts the exact state transitions received by a sink, in order.
     *
     * @param sink recording sink
     * @param expected expected transitions
     */
    protected void assertTransitions(RecordingEventSink<CircuitBreakerEvent> sink, StateTransition... expected) {
        List<StateTransition> actual = sink.eventsOf(StateTransitionEvent.class).stream()
                .map(StateTransitionEvent::stateTransition)
                .toList();
        assertEquals(List.of(expected), actual, "Unexpected state transition events");
    }
}
