/**
 * The deco4j annotation-to-code compiler.
 *
 * <p>{@link io.github.deco4j.processor.DecoGenerator} scans Java sources for markers such as
 * {@code @Route("GET", "/users")} in documentation comments, validates them, assembles one
 * {@link io.github.deco4j.model.RouteMetadata} per annotated handler, runs the
 * {@link io.github.deco4j.processor.HookPipeline} and renders a registration class with JavaPoet.
 *
 * <p>Markers are defined in a {@link io.github.deco4j.processor.MarkerRegistry}; additional
 * markers can be contributed through {@link io.github.deco4j.processor.MarkerProvider}.
 */
package io.github.deco4j.processor;
