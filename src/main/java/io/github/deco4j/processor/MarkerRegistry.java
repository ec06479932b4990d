package io.github.deco4j.processor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Registry of marker definitions, keyed by marker name.
 *
 * <p>Registering a name that is already present replaces the earlier definition; the
 * two are never merged. Definitions keep their registration order, which is the order
 * {@link #all()} reports them in. Reads and writes may happen from different threads.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * MarkerRegistry registry = MarkerRegistry.withBuiltins();
 * registry.register(MarkerDefinition.behavior("Audit", BehaviorFactory.joining(), "Audit trail"));
 * }</pre>
 *
 * @see BuiltinMarkers
 * @see MarkerProvider
 */
public final class MarkerRegistry {

    private static final Logger log = LoggerFactory.getLogger(MarkerRegistry.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, MarkerDefinition> definitions = new LinkedHashMap<>();

    /**
     * Creates an empty registry.
     */
    public MarkerRegistry() {
    }

    /**
     * Creates a registry holding the built-in markers.
     */
    public static MarkerRegistry withBuiltins() {
        MarkerRegistry registry = new MarkerRegistry();
        new BuiltinMarkers().registerMarkers(registry);
        return registry;
    }

    /**
     * Creates a registry holding the built-in markers plus every {@link MarkerProvider}
     * found on the class path, applied in service-loader order.
     */
    public static MarkerRegistry loadInstalled() {
        MarkerRegistry registry = withBuiltins();
        for (MarkerProvider provider : ServiceLoader.load(MarkerProvider.class)) {
            if (provider instanceof BuiltinMarkers) {
                continue;
            }
            log.debug("Loading markers from {}", provider.getClass().getName());
            provider.registerMarkers(registry);
        }
        return registry;
    }

    public void register(MarkerDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        lock.writeLock().lock();
        try {
            MarkerDefinition previous = definitions.put(definition.name(), definition);
            if (previous != null) {
                log.debug("Marker overwritten: {}", definition.name());
            } else {
                log.debug("Marker registered: {}", definition.name());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<MarkerDefinition> lookup(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(definitions.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns a snapshot of every definition in registration order.
     */
    public List<MarkerDefinition> all() {
        lock.readLock().lock();
        try {
            return List.copyOf(definitions.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> names() {
        lock.readLock().lock();
        try {
            return Set.copyOf(definitions.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Removes every definition. Intended for test harnesses.
     */
    void reset() {
        lock.writeLock().lock();
        try {
            definitions.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
