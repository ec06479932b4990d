package io.github.deco4j.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-wide table of middleware factories, keyed by behavior marker name.
 *
 * <p>Generated registration code calls {@link #create(String, String)} once per
 * behavior marker. The host application installs the concrete factories (cache,
 * rate limiting, authentication, ...) with {@link #register(String, MiddlewareFactory)}
 * before calling the generated entry point. A marker with no installed factory
 * resolves to {@link Middleware#passThrough()} and is logged at WARN.
 */
public final class Middlewares {

    private static final Logger log = LoggerFactory.getLogger(Middlewares.class);

    private static final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private static final Map<String, MiddlewareFactory> factories = new HashMap<>();

    private Middlewares() {
    }

    /**
     * Installs the factory for a marker, replacing any previous one.
     */
    public static void register(String marker, MiddlewareFactory factory) {
        Objects.requireNonNull(marker, "marker");
        Objects.requireNonNull(factory, "factory");
        lock.writeLock().lock();
        try {
            factories.put(marker, factory);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Middleware factory registered: {}", marker);
    }

    public static boolean isRegistered(String marker) {
        lock.readLock().lock();
        try {
            return factories.containsKey(marker);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Creates the middleware for a marker.
     *
     * @param marker    behavior marker name, e.g. {@code Auth}
     * @param arguments the marker's raw arguments joined with commas, e.g. {@code role=admin}
     * @return the middleware, or a pass-through middleware if no factory is installed
     */
    public static Middleware create(String marker, String arguments) {
        MiddlewareFactory factory;
        lock.readLock().lock();
        try {
            factory = factories.get(marker);
        } finally {
            lock.readLock().unlock();
        }
        if (factory == null) {
            log.warn("No middleware factory registered for @{}; using pass-through", marker);
            return Middleware.passThrough();
        }
        return factory.create(splitArguments(arguments));
    }

    /**
     * Splits a raw argument string on commas, dropping blank entries.
     */
    static List<String> splitArguments(String arguments) {
        List<String> args = new ArrayList<>();
        if (arguments == null || arguments.isEmpty()) {
            return args;
        }
        for (String part : arguments.split(",")) {
            String arg = part.trim();
            if (!arg.isEmpty()) {
                args.add(arg);
            }
        }
        return args;
    }

    /**
     * Removes every installed factory. Intended for test harnesses.
     */
    static void reset() {
        lock.writeLock().lock();
        try {
            factories.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
