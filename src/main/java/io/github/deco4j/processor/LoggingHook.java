package io.github.deco4j.processor;

import io.github.deco4j.model.RouteMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Logs one line per parsed route, at INFO when verbose and at DEBUG otherwise.
 */
public final class LoggingHook implements ParserHook {

    private static final Logger log = LoggerFactory.getLogger(LoggingHook.class);

    private final boolean verbose;

    public LoggingHook(boolean verbose) {
        this.verbose = verbose;
    }

    @Override
    public void apply(List<RouteMetadata> routes) {
        for (RouteMetadata route : routes) {
            String target = route.typeName() + "." + route.functionName();
            if (route.isWebSocketOnly()) {
                emit(route.webSocketHandlers() + " -> " + target + " (websocket)");
            } else {
                emit(route.method() + " " + route.path() + " -> " + target);
            }
        }
    }

    private void emit(String line) {
        if (verbose) {
            log.info(line);
        } else {
            log.debug(line);
        }
    }
}
