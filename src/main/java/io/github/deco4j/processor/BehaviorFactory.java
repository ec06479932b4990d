package io.github.deco4j.processor;

import io.github.deco4j.model.MiddlewareCall;

import java.util.List;

/**
 * Turns the parsed arguments of a behavior marker into a middleware-call expression.
 *
 * <p>The factory runs at generation time. It never creates the middleware itself; it
 * describes the call that generated code will make to
 * {@link io.github.deco4j.runtime.Middlewares#create(String, String)}.
 */
@FunctionalInterface
public interface BehaviorFactory {

    /**
     * Creates the middleware call for one marker occurrence.
     *
     * @param marker the marker name
     * @param args   the parsed arguments, quotes already stripped
     * @return the call description
     */
    MiddlewareCall create(String marker, List<String> args);

    /**
     * Returns a factory that joins the arguments with commas, or uses {@code defaultArguments}
     * when the marker carries none.
     *
     * @param defaultArguments raw argument string used for an empty argument list
     */
    static BehaviorFactory withDefaults(String defaultArguments) {
        return (marker, args) -> call(marker, args.isEmpty() ? defaultArguments : String.join(",", args));
    }

    /**
     * Returns a factory that joins the arguments with commas.
     */
    static BehaviorFactory joining() {
        return withDefaults("");
    }

    /**
     * Builds the call for a marker with an already joined argument string.
     */
    static MiddlewareCall call(String marker, String arguments) {
        String expression = "Middlewares.create(" + CodeGenUtils.quote(marker) + ", "
                + CodeGenUtils.quote(arguments) + ")";
        return new MiddlewareCall(marker, arguments, expression);
    }
}
