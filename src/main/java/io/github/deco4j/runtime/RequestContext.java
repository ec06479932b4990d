package io.github.deco4j.runtime;

import java.util.Map;
import java.util.Optional;

/**
 * Request view handed to handlers and middleware.
 *
 * <p>Implemented by the host web-serving framework adapter.
 */
public interface RequestContext {

    String method();

    String path();

    Optional<String> header(String name);

    /**
     * Mutable per-request attributes shared along the middleware chain.
     */
    Map<String, Object> attributes();
}
