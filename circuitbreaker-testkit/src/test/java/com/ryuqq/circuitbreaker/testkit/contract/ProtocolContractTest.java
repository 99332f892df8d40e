package com.ryuqq.circuitbreaker.testkit.contract;

import com.ryuqq.circuitbreaker.core.config.CircuitBreakerConfig;
import com.ryuqq.circuitbreaker.core.event.CircuitBreakerEvent;
import com.ryuqq.circuitbreaker.core.event.ErrorEvent;
import com.ryuqq.circuitbreaker.core.exception.ProtocolViolationException;
import com.ryuqq.circuitbreaker.core.outcome.CallOutcome;
import com.ryuqq.circuitbreaker.core.permit.CallPermit;
import com.ryuqq.circuitbreaker.core.spi.CircuitBreaker;
import com.ryuqq.circuitbreaker.core.state.CircuitBreakerState;
import com.ryuqq.circuitbreaker.testkit.fixture.RecordingEventSink;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: permit protocol.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>null, foreign or reused permits are protocol violations</li>
 *   <li>A permit issued before a transition still reports its event but not into the new window</li>
 * </ul>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
class ProtocolContractTest extends AbstractCircuitBreakerContractTest {

    @Test
    void testProtocol_NullPermit_Violation() {
        CircuitBreaker cb = createCircuitBreaker("protocol", CircuitBreakerConfig.ofDefaults());

        assertThrows(ProtocolViolationException.class, () -> cb.recordResult(null, CallOutcome.success(1)));
    }

    @Test
    void testProtocol_ForeignPermit_Violation() {
        CircuitBreaker first = createCircuitBreaker("first", CircuitBreakerConfig.ofDefaults());
        CircuitBreaker second = createCircuitBreaker("second", CircuitBreakerConfig.ofDefaults());
        CallPermit permit = acquire(first);

        assertThrows(ProtocolViolationException.class, () -> second.recordResult(permit, CallOutcome.success(1)));
        assertEquals(0, second.getMetrics().totalCalls());
    }

    @Test
    void testProtocol_ReusedPermit_Violation() {
        // Given
        CircuitBreaker cb = createCircuitBreaker("protocol", CircuitBreakerConfig.ofDefaults());
        CallPermit permit = acquire(cb);
        cb.recordResult(permit, CallOutcome.success(1));

        // When/Then
        assertThrows(ProtocolViolationException.class, () -> cb.recordResult(permit, CallOutcome.success(1)));
        assertEquals(1, cb.getMetrics().totalCalls());
    }

    @Test
    void testProtocol_NullOutcome_DoesNotConsumePermit() {
        CircuitBreaker cb = createCircuitBreaker("protocol", CircuitBreakerConfig.ofDefaults());
        CallPermit permit = acquire(cb);

        assertThrows(IllegalArgumentException.class, () -> cb.recordResult(permit, null));
        assertDoesNotThrow(() -> cb.recordResult(permit, CallOutcome.success(1)));
    }

    @Test
    void testProtocol_StalePermit_EventOnlyNoWindowChange() {
        // Given
        CircuitBreaker cb = createCircuitBreaker("stale", CircuitBreakerConfig.ofDefaults());
        CallPermit stale = acquire(cb);
        cb.transitionToOpenState();
        cb.transitionToClosedState();
        RecordingEventSink<CircuitBreakerEvent> sink = subscribe(cb);

        // When
        cb.recordResult(stale, CallOutcome.failure(3, new RuntimeException("late")));

        // Then
        assertEquals(1, sink.eventsOf(ErrorEvent.class).size());
        assertEquals(0, cb.getMetrics().totalCalls());
        assertState(cb, CircuitBreakerState.CLOSED);
    }
}
