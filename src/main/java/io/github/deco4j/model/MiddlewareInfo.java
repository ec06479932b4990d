package io.github.deco4j.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Documentation descriptor of a middleware attached to a route.
 *
 * @param name        the behavior marker name
 * @param args        arguments as a map; positional arguments are stored under {@code value}
 * @param order       position of the middleware in the route's chain, starting at 0
 * @param description human-readable description
 */
public record MiddlewareInfo(String name, Map<String, String> args, int order, String description) {

    public MiddlewareInfo {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(description, "description");
        args = Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }
}
