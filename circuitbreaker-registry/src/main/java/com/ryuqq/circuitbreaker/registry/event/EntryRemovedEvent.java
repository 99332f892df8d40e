package com.ryuqq.circuitbreaker.registry.event;

import com.ryuqq.circuitbreaker.core.spi.CircuitBreaker;

import java.time.ZonedDateTime;

/**
 * Circuit Breaker 제거 이벤트.
 *
 * @param entryName Registry에 등록된 이름
 * @param creationTime 생성 시각
 * @param removedEntry 제거된 Circuit Breaker
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public record EntryRemovedEvent(
    String entryName,
    ZonedDateTime creationTime,
    CircuitBreaker removedEntry
) implements RegistryEvent {

    public EntryRemovedEvent {
        if (entryName == null || creationTime == null) {
            throw new IllegalArgumentException("entryName and creationTime cannot be null");
        }
        if (removedEntry == null) {
            throw new IllegalArgumentException("removedEntry cannot be null");
        }
    }

    @Override
    public RegistryEventType eventType() {
        return RegistryEventType.REMOVED;
    }
}
