/**
 * 호출 허가 판단 결과와 허가 토큰.
 *
 * @since 1.0.0
 */
package com.ryuqq.circuitbreaker.core.permit;
