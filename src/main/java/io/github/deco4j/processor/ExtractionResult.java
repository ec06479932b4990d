package io.github.deco4j.processor;

import io.github.deco4j.model.MarkerInstance;
import io.github.deco4j.model.ValidationError;

import java.util.List;

/**
 * Markers and errors extracted from one comment block.
 *
 * <p>A result with errors must not be assembled into metadata.
 */
record ExtractionResult(List<MarkerInstance> markers, List<ValidationError> errors) {

    ExtractionResult {
        markers = List.copyOf(markers);
        errors = List.copyOf(errors);
    }

    boolean isValid() {
        return errors.isEmpty();
    }
}
