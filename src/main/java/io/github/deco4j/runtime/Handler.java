package io.github.deco4j.runtime;

/**
 * A request handler. Generated code references handlers as {@code Type::method}.
 */
@FunctionalInterface
public interface Handler {

    void handle(RequestContext context) throws Exception;
}
