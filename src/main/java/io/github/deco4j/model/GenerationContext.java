package io.github.deco4j.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Everything the code generator needs for one run.
 *
 * <p>Built once per run after parsing, handed to every pre-generation hook (which may
 * add imports and metadata), and then consumed exactly once by the generator.
 * Imports are fully qualified type names, deduplicated and kept in insertion order.
 */
public final class GenerationContext {

    private final String packageName;
    private final String className;
    private final List<RouteMetadata> routes;
    private final Set<String> imports = new LinkedHashSet<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private final Instant generatedAt;
    private boolean consumed;

    public GenerationContext(String packageName, String className, List<RouteMetadata> routes, Instant generatedAt) {
        this.packageName = Objects.requireNonNull(packageName, "packageName");
        this.className = Objects.requireNonNull(className, "className");
        this.routes = List.copyOf(routes);
        this.generatedAt = Objects.requireNonNull(generatedAt, "generatedAt");
    }

    public String packageName() {
        return packageName;
    }

    public String className() {
        return className;
    }

    public List<RouteMetadata> routes() {
        return routes;
    }

    public Instant generatedAt() {
        return generatedAt;
    }

    /**
     * Adds an import unless it is already present.
     *
     * @param qualifiedName fully qualified type name
     * @return {@code true} if the import was added
     */
    public boolean addImport(String qualifiedName) {
        Objects.requireNonNull(qualifiedName, "qualifiedName");
        return imports.add(qualifiedName);
    }

    public List<String> imports() {
        return List.copyOf(imports);
    }

    public boolean hasImport(String qualifiedName) {
        return imports.contains(qualifiedName);
    }

    public void putMetadata(String key, Object value) {
        metadata.put(Objects.requireNonNull(key, "key"), value);
    }

    public Map<String, Object> metadata() {
        return Collections.unmodifiableMap(metadata);
    }

    /**
     * Marks the context as consumed by the generator.
     *
     * @throws IllegalStateException if the context was already consumed
     */
    public void consume() {
        if (consumed) {
            throw new IllegalStateException("Generation context for " + packageName + "." + className
                    + " was already consumed");
        }
        consumed = true;
    }

    public boolean isConsumed() {
        return consumed;
    }

    /**
     * Returns the total number of websocket message-type bindings across all routes.
     */
    public int webSocketBindingCount() {
        int count = 0;
        for (RouteMetadata route : routes) {
            count += route.webSocketHandlers().size();
        }
        return count;
    }

    @Override
    public String toString() {
        return "GenerationContext{" + packageName + "." + className + ", routes=" + routes.size()
                + ", imports=" + new ArrayList<>(imports) + "}";
    }
}
