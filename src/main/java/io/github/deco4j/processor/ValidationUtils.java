package io.github.deco4j.processor;

import io.github.deco4j.model.ErrorCode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Syntax and semantic checks for markers in documentation comments.
 *
 * <p>Provides early detection of annotation mistakes, giving authors an exact file and
 * line instead of generated code that fails to compile or routes that never match.
 *
 * <p><b>Validation Categories:</b>
 *
 * <p><b>Syntax Sanity:</b> applied to every comment line that starts with {@code @} and
 * an upper-case letter
 * <ul>
 *   <li>{@code @Route}, {@code @Response}, {@code @RequestBody} and {@code @Middleware}
 *       lines must contain {@code (}</li>
 *   <li>Double quotes must be balanced</li>
 *   <li>Opening and closing parentheses must be balanced</li>
 * </ul>
 *
 * <p><b>Arguments:</b>
 * <ul>
 *   <li>No argument may be empty once trimmed and unquoted</li>
 *   <li>The argument count must satisfy the marker's {@link Arity}</li>
 * </ul>
 *
 * <p><b>Routes:</b>
 * <ul>
 *   <li>The method must be one of {@code GET POST PUT DELETE PATCH OPTIONS HEAD}</li>
 *   <li>The path must start with {@code /}</li>
 * </ul>
 *
 * <p><b>Example Error Messages:</b>
 * <pre>
 * UserApi.java:12 - Malformed decorator: '@Route GET /users'. Missing parentheses
 * UserApi.java:13 - Invalid HTTP method 'FETCH' in function listUsers. Valid methods: [GET, ...]
 * UserApi.java:14 - @Route requires exactly 2 arguments, found 1
 * </pre>
 */
final class ValidationUtils {

    static final List<String> HTTP_METHODS = List.of("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS", "HEAD");

    private static final Set<String> PARENTHESIZED = Set.of("@Route", "@Response", "@RequestBody", "@Middleware");

    private ValidationUtils() {
    }

    // ==================== SYNTAX SANITY ====================

    /**
     * Checks every marker line of a comment block for obvious syntax errors.
     *
     * <p>Stops at the first problem: one broken line usually makes the rest of the block
     * meaningless, so only that line is reported.
     *
     * @param block    the comment block
     * @param reporter callback for the error
     * @return {@code true} if no problem was found
     */
    static boolean validateSyntax(CommentBlock block, ErrorReporter reporter) {
        List<String> lines = block.lines();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).strip();
            if (!isMarkerLine(line)) {
                continue;
            }
            int lineNumber = block.firstLine() + i;

            if (!line.contains("(") && PARENTHESIZED.stream().anyMatch(line::contains)) {
                reporter.error(lineNumber, ErrorCode.MALFORMED_DECORATOR,
                        "Malformed decorator: '" + line + "'. Missing parentheses");
                return false;
            }
            if (count(line, '"') % 2 != 0) {
                reporter.error(lineNumber, ErrorCode.UNMATCHED_QUOTES, "Unmatched quotes in: '" + line + "'");
                return false;
            }
            if (count(line, '(') != count(line, ')')) {
                reporter.error(lineNumber, ErrorCode.UNMATCHED_PARENTHESES,
                        "Unmatched parentheses in: '" + line + "'");
                return false;
            }
        }
        return true;
    }

    private static boolean isMarkerLine(String line) {
        return line.length() > 1 && line.charAt(0) == '@' && Character.isUpperCase(line.charAt(1));
    }

    private static int count(String s, char c) {
        int n = 0;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == c) {
                n++;
            }
        }
        return n;
    }

    // ==================== ARGUMENTS ====================

    /**
     * Parses a marker's argument text into trimmed, unquoted arguments.
     *
     * <p>Empty argument text means no arguments. Otherwise every comma-separated token
     * must be non-empty after trimming and unquoting, so {@code a,,b} and {@code ""} are errors.
     *
     * @param marker    the marker name, for messages
     * @param arguments the text between the marker's parentheses
     * @param line      the marker's source line
     * @param reporter  callback for errors
     * @return the arguments, or empty if an error was reported
     */
    static Optional<List<String>> parseArguments(String marker, String arguments, int line, ErrorReporter reporter) {
        if (arguments.isBlank()) {
            return Optional.of(List.of());
        }
        List<String> args = new ArrayList<>();
        for (String token : MarkerTokenizer.splitTopLevel(arguments)) {
            String arg = MarkerTokenizer.unquote(token);
            if (arg.isEmpty()) {
                reporter.error(line, ErrorCode.INVALID_ARGUMENTS,
                        "Empty argument found in @" + marker + "(" + arguments + ")");
                return Optional.empty();
            }
            args.add(arg);
        }
        return Optional.of(args);
    }

    /**
     * Checks an argument count against the marker's arity.
     *
     * @return {@code true} if the count is accepted
     */
    static boolean validateArity(MarkerDefinition definition, int count, int line, ErrorReporter reporter) {
        if (definition.arity().accepts(count)) {
            return true;
        }
        reporter.error(line, ErrorCode.INVALID_ARGUMENT_COUNT, "@" + definition.name() + " requires "
                + definition.arity().describe() + " argument" + (definition.arity().min() == 1 ? "" : "s")
                + ", found " + count);
        return false;
    }

    // ==================== ROUTES ====================

    /**
     * Checks the method and path of a {@code @Route}. Both problems are reported when both occur.
     *
     * @param args     exactly two arguments: method and path
     * @param function the handler method name, for messages
     * @return {@code true} if both are valid
     */
    static boolean validateRoute(List<String> args, String function, int line, ErrorReporter reporter) {
        boolean valid = true;
        String method = args.get(0);
        String path = args.get(1);
        if (!HTTP_METHODS.contains(method)) {
            reporter.error(line, ErrorCode.INVALID_HTTP_METHOD, "Invalid HTTP method '" + method
                    + "' in function " + function + ". Valid methods: " + HTTP_METHODS);
            valid = false;
        }
        if (!path.startsWith("/")) {
            reporter.error(line, ErrorCode.INVALID_PATH, "Invalid path '" + path + "' in function "
                    + function + ". Path must start with '/'");
            valid = false;
        }
        return valid;
    }
}
