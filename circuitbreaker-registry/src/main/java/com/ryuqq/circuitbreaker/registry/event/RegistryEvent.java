package com.ryuqq.circuitbreaker.registry.event;

import com.ryuqq.circuitbreaker.core.event.Event;

/**
 * Registry 이벤트.
 *
 * <ul>
 *   <li>{@link EntryAddedEvent}: 등록</li>
 *   <li>{@link EntryRemovedEvent}: 제거</li>
 *   <li>{@link EntryReplacedEvent}: 교체 (이전 + 새 Circuit Breaker)</li>
 * </ul>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public sealed interface RegistryEvent extends Event<RegistryEventType>
    permits EntryAddedEvent, EntryRemovedEvent, EntryReplacedEvent {

    /**
     * Registry에 등록된 이름.
     *
     * @return 이름
     */
    String entryName();
}
