package com.ryuqq.circuitbreaker.core.event;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * 구독자별 이벤트 필터.
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>include가 비어 있지 않으면 include에 있는 종류만 통과 (exclude는 완전히 무시)</li>
 *   <li>include가 비어 있으면 exclude에 없는 종류는 모두 통과</li>
 * </ul>
 *
 * @param include 포함할 이벤트 종류 (비어 있으면 전체)
 * @param exclude 제외할 이벤트 종류
 * @param <T> 이벤트 종류
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public record EventFilter<T extends Enum<T>>(
    Set<T> include,
    Set<T> exclude
) {

    public EventFilter {
        if (include == null || exclude == null) {
            throw new IllegalArgumentException("include and exclude cannot be null");
        }
        include = Set.copyOf(include);
        exclude = Set.copyOf(exclude);
    }

    /**
     * 모든 이벤트를 통과시키는 필터.
     */
    public static <T extends Enum<T>> EventFilter<T> all() {
        return new EventFilter<T>(Set.<T>of(), Set.<T>of());
    }

    @SafeVarargs
    public static <T extends Enum<T>> EventFilter<T> only(T... types) {
        return new EventFilter<>(toSet(types), Set.of());
    }

    @SafeVarargs
    public static <T extends Enum<T>> EventFilter<T> excluding(T... types) {
        return new EventFilter<>(Set.of(), toSet(types));
    }

    /**
     * 이벤트 종류 통과 여부.
     *
     * @param eventType 이벤트 종류
     * @return 통과하면 true
     */
    public boolean accepts(T eventType) {
        if (!include.isEmpty()) {
            return include.contains(eventType);
        }
        return !exclude.contains(eventType);
    }

    @SafeVarargs
    private static <T extends Enum<T>> Set<T> toSet(T... types) {
        if (types == null) {
            throw new IllegalArgumentException("event types cannot be null");
        }
        Set<T> set = new HashSet<>(Arrays.asList(types));
        if (set.contains(null)) {
            throw new IllegalArgumentException("event types cannot contain null");
        }
        return set;
    }
}
