package io.github.deco4j.processor;

import java.util.Objects;
import java.util.Optional;

/**
 * A named marker the extractor recognizes in documentation comments.
 *
 * <p>Markers with a {@link BehaviorFactory} contribute a middleware call to the route;
 * the others only carry documentation or routing metadata.
 *
 * @param name        the marker name as written after {@code @}, e.g. {@code Route}
 * @param arity       the argument-count rule
 * @param factory     the behavior factory, or {@code null} for metadata-only markers
 * @param description human-readable description used in middleware descriptors
 */
public record MarkerDefinition(String name, Arity arity, BehaviorFactory factory, String description) {

    public MarkerDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(arity, "arity");
        if (name.isBlank() || !Character.isJavaIdentifierStart(name.charAt(0))) {
            throw new IllegalArgumentException("Invalid marker name: '" + name + "'");
        }
        for (int i = 1; i < name.length(); i++) {
            if (!Character.isJavaIdentifierPart(name.charAt(i))) {
                throw new IllegalArgumentException("Invalid marker name: '" + name + "'");
            }
        }
        description = description == null || description.isBlank() ? "Middleware " + name : description;
    }

    /**
     * Creates a metadata-only marker.
     */
    public static MarkerDefinition metadata(String name, Arity arity, String description) {
        return new MarkerDefinition(name, arity, null, description);
    }

    /**
     * Creates a behavior marker that accepts any number of arguments.
     */
    public static MarkerDefinition behavior(String name, BehaviorFactory factory, String description) {
        return new MarkerDefinition(name, Arity.any(), Objects.requireNonNull(factory, "factory"), description);
    }

    public Optional<BehaviorFactory> behavior() {
        return Optional.ofNullable(factory);
    }

    public boolean isBehavior() {
        return factory != null;
    }
}
