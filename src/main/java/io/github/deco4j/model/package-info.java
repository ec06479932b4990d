/**
 * Data model produced by the deco4j annotation compiler.
 * <p>
 * {@link io.github.deco4j.model.RouteMetadata} and
 * {@link io.github.deco4j.model.SchemaMetadata} are assembled from markers found in
 * documentation comments; {@link io.github.deco4j.model.GenerationContext} carries
 * them through the hook pipeline into the code generator.
 * {@link io.github.deco4j.model.ValidationError} reports declaration-level problems.
 */
package io.github.deco4j.model;
