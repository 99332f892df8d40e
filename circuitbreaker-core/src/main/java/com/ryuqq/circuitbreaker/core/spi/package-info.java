/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the interfaces that engine modules implement.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.circuitbreaker.core.spi.CircuitBreaker} - permit/record protocol, manual transitions, metrics</li>
 *   <li>{@link com.ryuqq.circuitbreaker.core.spi.EventBus} - non-blocking fan-out of typed events</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>{@code circuitbreaker-engine} provides the state machine and the in-memory bus.
 * {@link com.ryuqq.circuitbreaker.core.noop.NoOpCircuitBreaker} is the pass-through implementation kept in core.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, engine modules provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core has no third-party runtime dependency</li>
 *   <li><strong>Permit Tokens:</strong> a result cannot be recorded without the permit that allowed the call</li>
 * </ul>
 *
 * @since 1.0.0
 * @author CircuitBreaker Team
 */
package com.ryuqq.circuitbreaker.core.spi;
