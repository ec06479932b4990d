package io.github.deco4j.processor;

import io.github.deco4j.model.RouteMetadata;

import java.util.List;

/**
 * Extension point that runs once parsing has finished, before the generation context exists.
 */
@FunctionalInterface
public interface ParserHook {

    /**
     * Inspects the parsed routes. Throwing aborts the run.
     *
     * @param routes every route found in the scan, in scan order
     */
    void apply(List<RouteMetadata> routes) throws Exception;
}
