package io.github.deco4j.processor;

import com.google.auto.service.AutoService;

import static io.github.deco4j.processor.MarkerDefinition.behavior;
import static io.github.deco4j.processor.MarkerDefinition.metadata;

/**
 * The markers deco4j understands out of the box.
 *
 * <p><b>Routing and documentation:</b> {@code Route}, {@code Group}, {@code Param},
 * {@code Description}, {@code Summary}, {@code Schema}, {@code Tag}, {@code Response}.
 *
 * <p><b>Behavior:</b> authentication, the cache and rate-limit families, metrics and
 * health checks, CORS, tracing helpers, request validation, proxying, security and
 * websocket upgrade. Each produces one {@code Middlewares.create(...)} call.
 * {@code @Cache} defaults to {@code duration=5m} and {@code @RateLimit} to
 * {@code limit=100,window=1m} when written without arguments.
 */
@AutoService(MarkerProvider.class)
public final class BuiltinMarkers implements MarkerProvider {

    static final String ROUTE = "Route";
    static final String GROUP = "Group";
    static final String PARAM = "Param";
    static final String DESCRIPTION = "Description";
    static final String SUMMARY = "Summary";
    static final String SCHEMA = "Schema";
    static final String TAG = "Tag";
    static final String RESPONSE = "Response";
    static final String WEBSOCKET = "WebSocket";
    static final String PROXY = "Proxy";

    @Override
    public void registerMarkers(MarkerRegistry registry) {
        // Routing and documentation
        registry.register(metadata(ROUTE, Arity.exactly(2), "HTTP method and path"));
        registry.register(metadata(GROUP, Arity.any(), "Route group"));
        registry.register(metadata(PARAM, Arity.any(), "Documented parameter"));
        registry.register(metadata(DESCRIPTION, Arity.any(), "Route description"));
        registry.register(metadata(SUMMARY, Arity.any(), "Route summary"));
        registry.register(metadata(SCHEMA, Arity.any(), "Documented data structure"));
        registry.register(metadata(TAG, Arity.any(), "Route tags"));
        registry.register(metadata(RESPONSE, Arity.atLeast(1), "Documented response"));

        // Authentication and caching
        registry.register(behavior("Auth", BehaviorFactory.joining(), "Authentication and authorization middleware"));
        registry.register(behavior("Cache", BehaviorFactory.withDefaults("duration=5m"), "Response cache middleware"));
        registry.register(behavior("CacheByURL", BehaviorFactory.joining(), "Response cache keyed by URL"));
        registry.register(behavior("CacheByUser", BehaviorFactory.joining(), "Response cache keyed by user"));
        registry.register(behavior("CacheByEndpoint", BehaviorFactory.joining(), "Response cache keyed by endpoint"));
        registry.register(behavior("CacheStats", BehaviorFactory.joining(), "Cache statistics endpoint"));
        registry.register(behavior("InvalidateCache", BehaviorFactory.joining(), "Cache invalidation endpoint"));

        // Rate limiting
        registry.register(behavior("RateLimit", BehaviorFactory.withDefaults("limit=100,window=1m"),
                "Rate limiting middleware"));
        registry.register(behavior("RateLimitByIP", BehaviorFactory.joining(), "Rate limiting per client IP"));
        registry.register(behavior("RateLimitByUser", BehaviorFactory.joining(), "Rate limiting per user"));
        registry.register(behavior("RateLimitByEndpoint", BehaviorFactory.joining(), "Rate limiting per endpoint"));

        // Observability
        registry.register(behavior("Metrics", BehaviorFactory.joining(), "Metrics collection middleware"));
        registry.register(behavior("Prometheus", BehaviorFactory.joining(), "Prometheus metrics endpoint"));
        registry.register(behavior("HealthCheck", BehaviorFactory.joining(), "Health check endpoint"));
        registry.register(behavior("Telemetry", BehaviorFactory.joining(), "Distributed tracing middleware"));
        registry.register(behavior("TraceMiddleware", BehaviorFactory.joining(), "Request tracing middleware"));
        registry.register(behavior("TracingStats", BehaviorFactory.joining(), "Tracing statistics endpoint"));
        registry.register(behavior("HealthCheckWithTracing", BehaviorFactory.joining(), "Traced health check endpoint"));
        registry.register(behavior("InstrumentedHandler", BehaviorFactory.joining(), "Instrumented handler wrapper"));

        // Request validation
        registry.register(behavior("Validate", BehaviorFactory.joining(), "Request validation middleware"));
        registry.register(behavior("ValidateJSON", BehaviorFactory.joining(), "JSON body validation middleware"));
        registry.register(behavior("ValidateQuery", BehaviorFactory.joining(), "Query parameter validation middleware"));
        registry.register(behavior("ValidateParams", BehaviorFactory.joining(), "Path parameter validation middleware"));

        // Networking and security
        registry.register(behavior("CORS", BehaviorFactory.joining(), "Cross-Origin Resource Sharing middleware"));
        registry.register(behavior(PROXY, BehaviorFactory.joining(),
                "Reverse proxy middleware with service discovery and load balancing"));
        registry.register(behavior("Security", BehaviorFactory.joining(), "Network access restriction middleware"));
        registry.register(behavior(WEBSOCKET, BehaviorFactory.joining(), "WebSocket connection upgrade middleware"));
        registry.register(behavior("WebSocketStats", BehaviorFactory.joining(), "WebSocket statistics endpoint"));
    }
}
