package io.github.deco4j.runtime;

import io.github.deco4j.model.GroupInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Routes and websocket handlers registered by a generated entry point.
 *
 * <p>The generated {@code init()} method creates one registry, fills it and returns it
 * to the host program, which mounts the routes on its web-serving framework.
 * Registration and reads may happen concurrently.
 */
public final class RouteRegistry {

    private static final Logger log = LoggerFactory.getLogger(RouteRegistry.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<RouteEntry> routes = new ArrayList<>();
    private final Map<String, Handler> webSocketHandlers = new LinkedHashMap<>();
    private final Map<String, GroupInfo> groups = new LinkedHashMap<>();

    public void registerRoute(RouteEntry entry) {
        Objects.requireNonNull(entry, "entry");
        lock.writeLock().lock();
        try {
            routes.add(entry);
            if (entry.group() != null) {
                groups.put(entry.group().name(), entry.group());
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Route registered: {} {} -> {}", entry.method(), entry.path(), entry.funcName());
    }

    /**
     * Binds a handler to a websocket message type, replacing any previous binding.
     */
    public void registerWebSocketHandler(String messageType, Handler handler) {
        Objects.requireNonNull(messageType, "messageType");
        Objects.requireNonNull(handler, "handler");
        lock.writeLock().lock();
        try {
            webSocketHandlers.put(messageType, handler);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("WebSocket handler registered: {}", messageType);
    }

    public List<RouteEntry> routes() {
        lock.readLock().lock();
        try {
            return List.copyOf(routes);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<RouteEntry> find(String method, String path) {
        lock.readLock().lock();
        try {
            for (RouteEntry route : routes) {
                if (route.method().equals(method) && route.path().equals(path)) {
                    return Optional.of(route);
                }
            }
            return Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Handler> webSocketHandler(String messageType) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(webSocketHandlers.get(messageType));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> webSocketMessageTypes() {
        lock.readLock().lock();
        try {
            return List.copyOf(webSocketHandlers.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the groups referenced by registered routes; the last registration of a name wins.
     */
    public Map<String, GroupInfo> groups() {
        lock.readLock().lock();
        try {
            return Map.copyOf(groups);
        } finally {
            lock.readLock().unlock();
        }
    }
}
