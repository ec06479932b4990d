package io.github.deco4j.model;

import java.util.List;
import java.util.Objects;

/**
 * One occurrence of a marker inside a comment block.
 *
 * @param name the registered marker name, e.g. {@code Route}
 * @param raw  the matched text, e.g. {@code @Route("GET", "/users")}
 * @param args parsed arguments in source order, quotes removed
 */
public record MarkerInstance(String name, String raw, List<String> args) {

    public MarkerInstance {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(raw, "raw");
        args = List.copyOf(args);
    }

    public boolean hasArgs() {
        return !args.isEmpty();
    }
}
