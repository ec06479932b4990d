package io.github.deco4j.model;

import java.util.Objects;

/**
 * A resolved middleware invocation for one behavior marker.
 *
 * <p>{@code marker} and {@code arguments} are the typed form rendered by the code
 * generator; {@code expression} is the equivalent Java source text, kept for hooks
 * and logging.
 *
 * @param marker     the behavior marker name, e.g. {@code Auth}
 * @param arguments  the raw argument string handed to the runtime factory
 * @param expression the Java expression that creates the middleware
 */
public record MiddlewareCall(String marker, String arguments, String expression) {

    public MiddlewareCall {
        Objects.requireNonNull(marker, "marker");
        Objects.requireNonNull(arguments, "arguments");
        Objects.requireNonNull(expression, "expression");
    }
}
