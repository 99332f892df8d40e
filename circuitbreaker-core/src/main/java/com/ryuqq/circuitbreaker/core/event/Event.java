package com.ryuqq.circuitbreaker.core.event;

import java.time.ZonedDateTime;

/**
 * 이벤트 버스로 전달되는 이벤트.
 *
 * @param <T> 이벤트 종류 (닫힌 enum)
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public interface Event<T extends Enum<T>> {

    /**
     * 이벤트 종류. 구독 필터는 이 값으로 판단합니다.
     *
     * @return 이벤트 종류
     */
    T eventType();

    /**
     * 이벤트 생성 시각.
     *
     * @return 생성 시각
     */
    ZonedDateTime creationTime();
}
