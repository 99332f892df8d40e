package com.ryuqq.circuitbreaker.testkit.contract;

import com.ryuqq.circuitbreaker.core.config.CircuitBreakerConfig;
import com.ryuqq.circuitbreaker.core.event.CircuitBreakerEvent;
import com.ryuqq.circuitbreaker.core.event.NotPermittedEvent;
import com.ryuqq.circuitbreaker.core.permit.PermitResult;
import com.ryuqq.circuitbreaker.core.spi.CircuitBreaker;
import com.ryuqq.circuitbreaker.core.state.CircuitBreakerState;
import com.ryuqq.circuitbreaker.core.state.StateTransition;
import com.ryuqq.circuitbreaker.testkit.fixture.RecordingEventSink;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: OPEN wait duration.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Before the wait elapses: rejected, NOT_PERMITTED published, no window change</li>
 *   <li>After the wait elapses: the next permitCall moves to HALF_OPEN and is permitted</li>
 *   <li>Automatic transition: the scheduler moves to HALF_OPEN without traffic</li>
 * </ul>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
class OpenWaitContractTest extends AbstractCircuitBreakerContractTest {

    @Test
    void testOpenWait_BeforeAndAfterWaitDuration() {
        // Given
        CircuitBreakerConfig config = CircuitBreakerConfig.ofDefaults().withWaitDurationInOpenMs(100);
        CircuitBreaker cb = createCircuitBreaker("open-wait", config);
        cb.transitionToOpenState();
        RecordingEventSink<CircuitBreakerEvent> sink = subscribe(cb);

        // When: 50ms
        clock.advanceMillis(50);
        PermitResult early = cb.permitCall();

        // Then
        assertFalse(early.isPermitted());
        assertState(cb, CircuitBreakerState.OPEN);
        assertEquals(1, sink.eventsOf(NotPermittedEvent.class).size());
        assertFalse(cb.isPermittingCalls());

        // When: 150ms
        clock.advanceMillis(100);
        assertTrue(cb.isPermittingCalls());
        PermitResult late = cb.permitCall();

        // Then
        assertTrue(late.isPermitted());
        assertState(cb, CircuitBreakerState.HALF_OPEN);
        assertTransitions(sink, StateTransition.between(CircuitBreakerState.OPEN, CircuitBreakerState.HALF_OPEN));
    }

    @Test
    void testOpenWait_ProbeDoesNotTransition() {
        CircuitBreakerConfig config = CircuitBreakerConfig.ofDefaults().withWaitDurationInOpenMs(100);
        CircuitBreaker cb = createCircuitBreaker("open-wait", config);
        cb.transitionToOpenState();
        clock.advanceMillis(500);

        assertTrue(cb.isPermittingCalls());
        assertState(cb, CircuitBreakerState.OPEN);
    }

    @Test
    void testOpenWait_AutomaticTransition_WithoutTraffic() throws InterruptedException {
        // Given: the scheduler runs on real time
        CircuitBreakerConfig config = CircuitBreakerConfig.ofDefaults()
                .withWaitDurationInOpenMs(50)
                .withAutomaticTransitionFromOpenToHalfOpen(true);
        CircuitBreaker cb = createCircuitBreaker("auto", config);

        // When
        cb.transitionToOpenState();

        // Then
        long deadline = System.currentTimeMillis() + 5_000;
        while (cb.getState() != CircuitBreakerState.HALF_OPEN && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertState(cb, CircuitBreakerState.HALF_OPEN);
    }

    @Test
    void testOpenWait_LeavingOpenCancelsAutomaticTransition() throws InterruptedException {
        // Given
        CircuitBreakerConfig config = CircuitBreakerConfig.ofDefaults()
                .withWaitDurationInOpenMs(50)
                .withAutomaticTransitionFromOpenToHalfOpen(true);
        CircuitBreaker cb = createCircuitBreaker("auto", config);
        cb.transitionToOpenState();

        // When
        cb.transitionToForcedOpenState();
        Thread.sleep(200);

        // Then
        assertState(cb, CircuitBreakerState.FORCED_OPEN);
    }
}
