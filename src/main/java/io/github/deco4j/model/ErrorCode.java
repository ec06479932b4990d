package io.github.deco4j.model;

/**
 * Machine-readable codes attached to every {@link ValidationError}.
 */
public enum ErrorCode {
    /** A marker kind that requires arguments was written without an opening parenthesis. */
    MALFORMED_DECORATOR,
    /** A marker line contains an odd number of double quotes. */
    UNMATCHED_QUOTES,
    /** A marker line opens and closes a different number of parentheses. */
    UNMATCHED_PARENTHESES,
    /** An argument list contains an empty token. */
    INVALID_ARGUMENTS,
    /** A marker received a number of arguments its arity rule does not allow. */
    INVALID_ARGUMENT_COUNT,
    /** A routing marker names an HTTP method outside the supported set. */
    INVALID_HTTP_METHOD,
    /** A routing marker path does not start with {@code /}. */
    INVALID_PATH
}
