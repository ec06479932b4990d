package io.github.deco4j.processor;

import java.nio.file.Path;

/**
 * Summary of a successful generation run.
 *
 * @param outputPath      the generated file
 * @param routeCount      number of HTTP routes registered
 * @param webSocketCount  number of websocket message-type bindings
 * @param middlewareCount number of middleware calls across all routes
 * @param proxyCount      number of routes with a {@code @Proxy} middleware
 */
public record GenerationResult(Path outputPath,
                               int routeCount,
                               int webSocketCount,
                               int middlewareCount,
                               int proxyCount) {
}
