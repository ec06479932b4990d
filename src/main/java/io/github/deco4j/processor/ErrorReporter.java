package io.github.deco4j.processor;

import io.github.deco4j.model.ErrorCode;

/**
 * Interface for reporting declaration-level validation errors.
 */
@FunctionalInterface
interface ErrorReporter {
    /**
     * Reports an error on the given comment line.
     *
     * @param line    the source line where the error occurred, or {@code 0} if unknown
     * @param code    the machine-readable error code
     * @param message the error message
     */
    void error(int line, ErrorCode code, String message);
}
