package com.ryuqq.circuitbreaker.registry.event;

import com.ryuqq.circuitbreaker.core.spi.CircuitBreaker;

import java.time.ZonedDateTime;

/**
 * Circuit Breaker 교체 이벤트.
 *
 * @param entryName Registry에 등록된 이름
 * @param creationTime 생성 시각
 * @param oldEntry 교체된 이전 Circuit Breaker
 * @param newEntry 새 Circuit Breaker
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public record EntryReplacedEvent(
    String entryName,
    ZonedDateTime creationTime,
    CircuitBreaker oldEntry,
    CircuitBreaker newEntry
) implements RegistryEvent {

    public EntryReplacedEvent {
        if (entryName == null || creationTime == null) {
            throw new IllegalArgumentException("entryName and creationTime cannot be null");
        }
        if (oldEntry == null || newEntry == null) {
            throw new IllegalArgumentException("oldEntry and newEntry cannot be null");
        }
    }

    @Override
    public RegistryEventType eventType() {
        return RegistryEventType.REPLACED;
    }
}
