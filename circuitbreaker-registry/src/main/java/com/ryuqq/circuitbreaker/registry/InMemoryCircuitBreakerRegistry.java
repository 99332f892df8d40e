package com.ryuqq.circuitbreaker.registry;

import com.ryuqq.circuitbreaker.core.config.CircuitBreakerConfig;
import com.ryuqq.circuitbreaker.core.spi.CircuitBreaker;
import com.ryuqq.circuitbreaker.core.spi.EventBus;
import com.ryuqq.circuitbreaker.engine.CircuitBreakerStateMachine;
import com.ryuqq.circuitbreaker.engine.InMemoryEventBus;
import com.ryuqq.circuitbreaker.engine.TransitionScheduler;
import com.ryuqq.circuitbreaker.registry.event.EntryAddedEvent;
import com.ryuqq.circuitbreaker.registry.event.EntryRemovedEvent;
import com.ryuqq.circuitbreaker.registry.event.EntryReplacedEvent;
import com.ryuqq.circuitbreaker.registry.event.RegistryEvent;
import com.ryuqq.circuitbreaker.registry.event.RegistryEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * In-memory implementation of {@link CircuitBreakerRegistry}.
 *
 * <p>Entries and configurations live in {@link ConcurrentHashMap}s. Get-or-create is atomic per name:
 * concurrent callers for the same name always receive the same instance and exactly one
 * {@code ADDED} event is published.</p>
 *
 * <p><strong>Event Publication:</strong></p>
 * <ul>
 *   <li>Events are published after the map operation completes, outside any map lock</li>
 *   <li>ADDED: get-or-create created a new breaker</li>
 *   <li>REMOVED: remove() found an entry</li>
 *   <li>REPLACED: replace() found an entry (old + new)</li>
 * </ul>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public class InMemoryCircuitBreakerRegistry implements CircuitBreakerRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCircuitBreakerRegistry.class);

    private final ConcurrentMap<String, CircuitBreaker> entries;
    private final ConcurrentMap<String, CircuitBreakerConfig> configurations;
    private final InMemoryEventBus<RegistryEventType, RegistryEvent> eventBus;
    private final Clock clock;
    private final TransitionScheduler scheduler;

    /**
     * Creates a registry whose default configuration is {@link CircuitBreakerConfig#ofDefaults()}.
     */
    public InMemoryCircuitBreakerRegistry() {
        this(CircuitBreakerConfig.ofDefaults());
    }

    /**
     * Creates a registry with a custom default configuration.
     *
     * @param defaultConfig configuration used by {@link #circuitBreaker(String)}
     */
    public InMemoryCircuitBreakerRegistry(CircuitBreakerConfig defaultConfig) {
        this(defaultConfig, Clock.systemUTC(), TransitionScheduler.shared());
    }

    /**
     * Creates a registry whose breakers share the given clock and scheduler.
     *
     * @param defaultConfig default configuration
     * @param clock clock handed to every created breaker
     * @param scheduler scheduler handed to every created breaker
     * @throws IllegalArgumentException if any argument is null
     */
    public InMemoryCircuitBreakerRegistry(CircuitBreakerConfig defaultConfig, Clock clock, TransitionScheduler scheduler) {
        if (defaultConfig == null) {
            throw new IllegalArgumentException("defaultConfig cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        this.entries = new ConcurrentHashMap<>();
        this.configurations = new ConcurrentHashMap<>();
        this.configurations.put(DEFAULT_CONFIG_NAME, defaultConfig);
        this.eventBus = new InMemoryEventBus<>("circuit-breaker-registry");
        this.clock = clock;
        this.scheduler = scheduler;
    }

    @Override
    public void addConfiguration(String configName, CircuitBreakerConfig config) {
        if (configName == null) {
            throw new IllegalArgumentException("configName cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (DEFAULT_CONFIG_NAME.equals(configName)) {
            throw new IllegalArgumentException(
                "'" + DEFAULT_CONFIG_NAME + "' is reserved for the default configuration");
        }
        configurations.put(configName, config);
        log.info("Registered circuit breaker configuration '{}'", configName);
    }

    @Override
    public Optional<CircuitBreakerConfig> getConfiguration(String configName) {
        if (configName == null) {
            throw new IllegalArgumentException("configName cannot be null");
        }
        return Optional.ofNullable(configurations.get(configName));
    }

    @Override
    public CircuitBreakerConfig getDefaultConfig() {
        return configurations.get(DEFAULT_CONFIG_NAME);
    }

    @Override
    public CircuitBreaker circuitBreaker(String name) {
        return computeIfAbsent(name, this::getDefaultConfig);
    }

    @Override
    public CircuitBreaker circuitBreaker(String name, String configName) {
        if (configName == null) {
            throw new IllegalArgumentException("configName cannot be null");
        }
        return computeIfAbsent(name, () -> getConfiguration(configName)
            .orElseThrow(() -> new ConfigurationNotFoundException(configName)));
    }

    @Override
    public CircuitBreaker circuitBreaker(String name, CircuitBreakerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return computeIfAbsent(name, () -> config);
    }

    @Override
    public Optional<CircuitBreaker> find(String name) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        return Optional.ofNullable(entries.get(name));
    }

    @Override
    public Optional<CircuitBreaker> remove(String name) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        CircuitBreaker removed = entries.remove(name);
        if (removed != null) {
            log.info("Removed circuit breaker '{}'", name);
            eventBus.publish(new EntryRemovedEvent(name, now(), removed));
        }
        return Optional.ofNullable(removed);
    }

    @Override
    public Optional<CircuitBreaker> replace(String name, CircuitBreaker newCircuitBreaker) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (newCircuitBreaker == null) {
            throw new IllegalArgumentException("newCircuitBreaker cannot be null");
        }
        CircuitBreaker replaced = entries.replace(name, newCircuitBreaker);
        if (replaced != null) {
            log.info("Replaced circuit breaker '{}'", name);
            eventBus.publish(new EntryReplacedEvent(name, now(), replaced, newCircuitBreaker));
        }
        return Optional.ofNullable(replaced);
    }

    @Override
    public Collection<CircuitBreaker> getAllCircuitBreakers() {
        return List.copyOf(entries.values());
    }

    @Override
    public EventBus<RegistryEventType, RegistryEvent> getEventBus() {
        return eventBus;
    }

    private CircuitBreaker computeIfAbsent(String name, Supplier<CircuitBreakerConfig> configSupplier) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        CircuitBreaker existing = entries.get(name);
        if (existing != null) {
            return existing;
        }

        CircuitBreaker[] created = new CircuitBreaker[1];
        CircuitBreaker entry = entries.computeIfAbsent(name, key -> {
            created[0] = new CircuitBreakerStateMachine(key, configSupplier.get(), clock, scheduler);
            return created[0];
        });

        if (created[0] != null) {
            log.info("Created circuit breaker '{}'", name);
            eventBus.publish(new EntryAddedEvent(name, now(), created[0]));
        }
        return entry;
    }

    private ZonedDateTime now() {
        return ZonedDateTime.now(clock);
    }
}
