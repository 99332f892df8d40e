/**
 * 슬라이딩 윈도우 패키지.
 *
 * <p>최근 호출 결과를 집계하여 실패율과 느린 호출 비율을 계산합니다.</p>
 *
 * <p><strong>구현체:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.circuitbreaker.core.window.CountBasedOutcomeWindow} - 최근 N개 호출 (링 버퍼, O(1))</li>
 *   <li>{@link com.ryuqq.circuitbreaker.core.window.TimeBasedOutcomeWindow} - 최근 N초 (초 단위 버킷, 지연 만료)</li>
 * </ul>
 *
 * <p>윈도우는 스레드 안전하지 않습니다. 소유한 Circuit Breaker의 락 안에서만 사용합니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.circuitbreaker.core.window;
