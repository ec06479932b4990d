/**
 * Invocation signatures used by generated registration code.
 * <p>
 * The generated entry point returns a {@link io.github.deco4j.runtime.RouteRegistry}
 * filled with {@link io.github.deco4j.runtime.RouteEntry} values. Middleware chains are
 * created through {@link io.github.deco4j.runtime.Middlewares}, whose factories the host
 * application installs. Concrete behaviors (caching, rate limiting, realtime hubs, ...)
 * are not part of this library.
 */
package io.github.deco4j.runtime;
