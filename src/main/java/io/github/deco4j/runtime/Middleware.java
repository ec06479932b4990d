package io.github.deco4j.runtime;

/**
 * A request-handling wrapper produced by a behavior marker.
 */
@FunctionalInterface
public interface Middleware {

    /**
     * Wraps {@code next}, returning the handler that runs this middleware first.
     */
    Handler wrap(Handler next);

    /**
     * Returns a middleware that delegates straight to the next handler.
     */
    static Middleware passThrough() {
        return next -> next;
    }
}
