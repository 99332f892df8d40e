package com.ryuqq.circuitbreaker.testkit.fixture;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Test clock that only moves when told to.
 *
 * <p>Inject it into a circuit breaker to drive wait durations and time-based windows
 * deterministically, without sleeping.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * MutableClock clock = MutableClock.startingAt(Instant.parse("2024-01-01T00:00:00Z"));
 * CircuitBreaker cb = new CircuitBreakerStateMachine("test", config, clock);
 * clock.advanceMillis(150);
 * </pre>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public final class MutableClock extends Clock {

    private final AtomicLong epochMillis;
    private final ZoneId zone;

    private MutableClock(AtomicLong epochMillis, ZoneId zone) {
        this.epochMillis = epochMillis;
        this.zone = zone;
    }

    /**
     * Creates a clock fixed at the given instant (UTC).
     *
     * @param start initial instant
     * @return new clock
     */
    public static MutableClock startingAt(Instant start) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        return new MutableClock(new AtomicLong(start.toEpochMilli()), ZoneOffset.UTC);
    }

    public void advanceMillis(long millis) {
        if (millis < 0) {
            throw new IllegalArgumentException("millis cannot be negative, but was: " + millis);
        }
        epochMillis.addAndGet(millis);
    }

    public void advance(Duration duration) {
        if (duration == null) {
            throw new IllegalArgumentException("duration cannot be null");
        }
        advanceMillis(duration.toMillis());
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    /**
     * Returns a view sharing this clock's time in another zone.
     */
    @Override
    public Clock withZone(ZoneId zone) {
        if (zone == null) {
            throw new IllegalArgumentException("zone cannot be null");
        }
        return new MutableClock(epochMillis, zone);
    }

    @Override
    public long millis() {
        return epochMillis.get();
    }

    @Override
    public Instant instant() {
        return Instant.ofEpochMilli(epochMillis.get());
    }
}
