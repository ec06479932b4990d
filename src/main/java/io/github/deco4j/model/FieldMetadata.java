package io.github.deco4j.model;

/**
 * A field of a documented data structure.
 *
 * @param name        the field or record component name
 * @param type        the declared type as written in source
 * @param jsonName    the serialized name ({@code @JsonProperty} value, or {@code name})
 * @param description text of the field's own comment
 * @param validation  comma-separated names of the other annotations on the field
 */
public record FieldMetadata(String name, String type, String jsonName, String description, String validation) {
}
