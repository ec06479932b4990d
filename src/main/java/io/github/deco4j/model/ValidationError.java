package io.github.deco4j.model;

import java.util.Objects;

/**
 * A declaration-level problem found while extracting markers from a comment block.
 *
 * <p>Validation errors are collected across a whole scan and reported together,
 * so an author can fix every problem in one pass.
 *
 * @param file    the source file name (without directories)
 * @param line    the 1-based source line, or {@code 0} when unknown
 * @param message human-readable description of the problem
 * @param code    machine-readable error code
 */
public record ValidationError(String file, int line, String message, ErrorCode code) {

    public ValidationError {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(code, "code");
    }

    /**
     * Formats the error as {@code file:line - message}, or {@code file - message}
     * when the line is unknown.
     */
    @Override
    public String toString() {
        if (line > 0) {
            return file + ":" + line + " - " + message;
        }
        return file + " - " + message;
    }
}
