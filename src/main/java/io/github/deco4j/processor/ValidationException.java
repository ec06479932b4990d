package io.github.deco4j.processor;

import io.github.deco4j.model.ValidationError;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Every declaration-level error found in a scan, reported together.
 *
 * <p>The message lists one error per line, formatted as {@code file:line - message}.
 */
public class ValidationException extends Exception {

    private final List<ValidationError> errors;

    public ValidationException(List<ValidationError> errors) {
        super(format(errors));
        this.errors = List.copyOf(errors);
    }

    public List<ValidationError> getErrors() {
        return errors;
    }

    private static String format(List<ValidationError> errors) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("A validation exception needs at least one error");
        }
        return errors.stream()
                .map(ValidationError::toString)
                .collect(Collectors.joining("\n"));
    }
}
