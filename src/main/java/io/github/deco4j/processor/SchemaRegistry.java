package io.github.deco4j.processor;

import io.github.deco4j.model.SchemaMetadata;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Registry of documented data structures found during a scan, keyed by type name.
 * The last registration of a name wins.
 */
public final class SchemaRegistry {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, SchemaMetadata> schemas = new LinkedHashMap<>();

    public void register(SchemaMetadata schema) {
        Objects.requireNonNull(schema, "schema");
        lock.lock();
        try {
            schemas.put(schema.name(), schema);
        } finally {
            lock.unlock();
        }
    }

    public Optional<SchemaMetadata> lookup(String name) {
        lock.lock();
        try {
            return Optional.ofNullable(schemas.get(name));
        } finally {
            lock.unlock();
        }
    }

    public List<SchemaMetadata> all() {
        lock.lock();
        try {
            return List.copyOf(schemas.values());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every schema. Intended for test harnesses.
     */
    void reset() {
        lock.lock();
        try {
            schemas.clear();
        } finally {
            lock.unlock();
        }
    }
}
