package io.github.deco4j.runtime;

import java.util.List;

/**
 * Creates the middleware for one behavior marker from the marker's raw arguments.
 */
@FunctionalInterface
public interface MiddlewareFactory {

    Middleware create(List<String> args);
}
