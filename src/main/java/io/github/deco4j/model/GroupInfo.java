package io.github.deco4j.model;

import java.util.Objects;

/**
 * A named path-prefix and tag bundle shared by several routes.
 *
 * @param name        group name, also used as a tag
 * @param prefix      path prefix applied to member routes
 * @param description human-readable description
 */
public record GroupInfo(String name, String prefix, String description) {

    public GroupInfo {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(prefix, "prefix");
        Objects.requireNonNull(description, "description");
    }
}
