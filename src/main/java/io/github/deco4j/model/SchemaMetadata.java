package io.github.deco4j.model;

import java.util.List;
import java.util.Objects;

/**
 * Documentation metadata for a data structure annotated with {@code @Schema}.
 *
 * <p>Schemas only feed documentation; they are never used for request validation.
 */
public record SchemaMetadata(String name,
                             String packageName,
                             String fileName,
                             String description,
                             List<MarkerInstance> markers,
                             List<FieldMetadata> fields) {

    public SchemaMetadata {
        Objects.requireNonNull(name, "name");
        markers = List.copyOf(markers);
        fields = List.copyOf(fields);
    }
}
