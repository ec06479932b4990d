package io.github.deco4j.processor;

import java.util.Objects;

/**
 * A fatal, pipeline-level failure that aborts a generation run.
 *
 * <p>Unlike {@link ValidationException}, which aggregates problems in annotated sources,
 * a generation exception stops the run at the first failure. Output written before the
 * failure is left as is.
 */
public class GenerationException extends Exception {

    /**
     * What went wrong.
     */
    public enum Reason {
        /** The source directory could not be walked or read. */
        SCAN_FAILED,
        /** A source file is not syntactically valid Java. */
        PARSE_FAILED,
        /** A post-parse or pre-generation hook failed. */
        HOOK_FAILED,
        /** The generated source could not be rendered. */
        RENDER_FAILED,
        /** The generated file could not be written. */
        WRITE_FAILED,
        OUTPUT_MISSING,
        OUTPUT_EMPTY,
        OUTPUT_SYNTAX,
        MISSING_IMPORTS,
        MISSING_ENTRY_POINT,
        MISSING_REGISTRATIONS
    }

    private final Reason reason;

    public GenerationException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public GenerationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public Reason getReason() {
        return reason;
    }
}
