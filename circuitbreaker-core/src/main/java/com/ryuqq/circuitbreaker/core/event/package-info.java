/**
 * 이벤트 모델 패키지.
 *
 * <p>Circuit Breaker 이벤트(sealed), 구독 필터, 비블로킹 수신자를 정의합니다.</p>
 *
 * <p><strong>전달 계약:</strong></p>
 * <ul>
 *   <li>발행은 동기적이며 블로킹하지 않음</li>
 *   <li>수신자 용량이 가득 차면 해당 수신자에게서만 이벤트 유실</li>
 *   <li>include 필터가 비어 있지 않으면 exclude는 무시</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.circuitbreaker.core.event;
