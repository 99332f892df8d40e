package com.ryuqq.circuitbreaker.registry.event;

import com.ryuqq.circuitbreaker.core.spi.CircuitBreaker;

import java.time.ZonedDateTime;

/**
 * Circuit Breaker 등록 이벤트.
 *
 * @param entryName Registry에 등록된 이름
 * @param creationTime 생성 시각
 * @param addedEntry 등록된 Circuit Breaker
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public record EntryAddedEvent(
    String entryName,
    ZonedDateTime creationTime,
    CircuitBreaker addedEntry
) implements RegistryEvent {

    public EntryAddedEvent {
        if (entryName == null || creationTime == null) {
            throw new IllegalArgumentException("entryName and creationTime cannot be null");
        }
        if (addedEntry == null) {
            throw new IllegalArgumentException("addedEntry cannot be null");
        }
    }

    @Override
    public RegistryEventType eventType() {
        return RegistryEventType.ADDED;
    }
}
