package io.github.deco4j.model;

/**
 * A documented route parameter declared with {@code @Param}.
 *
 * <p>Sub-arguments that were not supplied keep their zero values
 * (empty strings, {@code false}).
 */
public record ParameterInfo(String name,
                            String type,
                            String location,
                            boolean required,
                            String description,
                            String example) {
}
