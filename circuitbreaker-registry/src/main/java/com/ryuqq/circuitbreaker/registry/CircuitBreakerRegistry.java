package com.ryuqq.circuitbreaker.registry;

import com.ryuqq.circuitbreaker.core.config.CircuitBreakerConfig;
import com.ryuqq.circuitbreaker.core.spi.CircuitBreaker;
import com.ryuqq.circuitbreaker.core.spi.EventBus;
import com.ryuqq.circuitbreaker.registry.event.RegistryEvent;
import com.ryuqq.circuitbreaker.registry.event.RegistryEventType;

import java.util.Collection;
import java.util.Optional;

/**
 * 이름 있는 Circuit Breaker와 설정의 Registry.
 *
 * <p>전역 싱글턴이 아니며, 애플리케이션이 생성자로 만들어 필요한 곳에 전달합니다.</p>
 *
 * <p><strong>설정 관리:</strong></p>
 * <ul>
 *   <li>{@value #DEFAULT_CONFIG_NAME}: 생성 시 지정한 기본 설정 (덮어쓸 수 없음)</li>
 *   <li>addConfiguration(): 이름 있는 설정 등록</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreakerRegistry registry = new InMemoryCircuitBreakerRegistry();
 * registry.addConfiguration("slow-backend", CircuitBreakerConfig.ofDefaults()
 *     .withSlowCallDurationThresholdMs(2_000));
 *
 * CircuitBreaker payment = registry.circuitBreaker("payment");
 * CircuitBreaker search = registry.circuitBreaker("search", "slow-backend");
 * }</pre>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public interface CircuitBreakerRegistry {

    /**
     * 기본 설정 이름.
     */
    String DEFAULT_CONFIG_NAME = "default";

    /**
     * 이름 있는 설정 등록.
     *
     * @param configName 설정 이름
     * @param config 설정
     * @throws IllegalArgumentException 인자가 null이거나 configName이 {@value #DEFAULT_CONFIG_NAME}인 경우
     */
    void addConfiguration(String configName, CircuitBreakerConfig config);

    /**
     * 이름으로 설정 조회.
     *
     * @param configName 설정 이름
     * @return 설정 (없으면 empty)
     */
    Optional<CircuitBreakerConfig> getConfiguration(String configName);

    CircuitBreakerConfig getDefaultConfig();

    /**
     * 기본 설정으로 조회 또는 생성.
     *
     * @param name Circuit Breaker 이름
     * @return 기존 인스턴스 또는 새로 생성한 인스턴스
     */
    CircuitBreaker circuitBreaker(String name);

    /**
     * 이름 있는 설정으로 조회 또는 생성.
     *
     * <p>이미 존재하면 설정과 무관하게 기존 인스턴스를 반환합니다.</p>
     *
     * @param name Circuit Breaker 이름
     * @param configName 설정 이름
     * @return Circuit Breaker
     * @throws ConfigurationNotFoundException 생성이 필요한데 설정이 없는 경우
     */
    CircuitBreaker circuitBreaker(String name, String configName);

    /**
     * 주어진 설정으로 조회 또는 생성.
     *
     * @param name Circuit Breaker 이름
     * @param config 설정
     * @return Circuit Breaker
     */
    CircuitBreaker circuitBreaker(String name, CircuitBreakerConfig config);

    Optional<CircuitBreaker> find(String name);

    /**
     * 제거.
     *
     * @param name Circuit Breaker 이름
     * @return 제거된 인스턴스 (없으면 empty)
     */
    Optional<CircuitBreaker> remove(String name);

    /**
     * 교체.
     *
     * <p>name이 이미 등록된 경우에만 교체하며, 새 인스턴스의 이름과 달라도 name으로 저장합니다.</p>
     *
     * @param name 등록 이름
     * @param newCircuitBreaker 새 인스턴스
     * @return 교체된 이전 인스턴스 (등록되지 않은 이름이면 empty)
     */
    Optional<CircuitBreaker> replace(String name, CircuitBreaker newCircuitBreaker);

    Collection<CircuitBreaker> getAllCircuitBreakers();

    /**
     * Registry 이벤트 버스 (ADDED, REMOVED, REPLACED).
     *
     * @return 이벤트 버스
     */
    EventBus<RegistryEventType, RegistryEvent> getEventBus();
}
