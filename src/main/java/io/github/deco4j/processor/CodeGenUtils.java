package io.github.deco4j.processor;

import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import io.github.deco4j.model.RouteMetadata;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Shared utilities for code generation in deco4j.
 *
 * <p>Every string taken from annotation text reaches generated source through
 * {@link #quote(String)} (string literals) or {@link #escapeString(String)} (comments).
 * This is the only barrier between free-form annotation text and the generated file,
 * so it must turn any input into text that cannot end a literal or a comment early.
 *
 * <p><b>Escaping Examples:</b>
 * <ul>
 *   <li>{@code say "hi"} → {@code "say \"hi\""}</li>
 *   <li>{@code C:\temp} → {@code "C:\\temp"}</li>
 *   <li>a line break → {@code "\n"}</li>
 *   <li>a BEL control character → {@code "\007"}</li>
 * </ul>
 *
 * @see CodeGenerator
 */
final class CodeGenUtils {

    private static final ClassName LIST = ClassName.get(List.class);
    private static final ClassName MAP = ClassName.get(Map.class);

    private CodeGenUtils() {
    }

    // ==================== STRING UTILITIES ====================

    /**
     * Returns {@code s} as a double-quoted Java string literal.
     *
     * @param s the raw value, {@code null} is treated as empty
     * @return a literal that parses back to exactly {@code s}
     */
    static String quote(String s) {
        return "\"" + escapeString(s == null ? "" : s) + "\"";
    }

    /**
     * Escapes special characters in a string for use in a Java string literal.
     * <p>
     * Handles: {@code \n}, {@code \r}, {@code \t}, {@code \b}, {@code \f}, {@code \\},
     * {@code \"}, {@code \'} and other ISO control characters (as octal escapes).
     * Octal rather than unicode escapes are used for control characters because the
     * compiler translates {@code \}{@code uXXXX} sequences before it tokenizes.
     *
     * @param s the string to escape
     * @return the escaped string (without surrounding quotes)
     */
    static String escapeString(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 8);
        for (char c : s.toCharArray()) {
            sb.append(escapeChar(c));
        }
        return sb.toString();
    }

    /**
     * Escapes a single character for use in a Java literal.
     *
     * @param c the character to escape
     * @return the escaped representation (e.g., '\n' → "\\n")
     */
    static String escapeChar(char c) {
        return switch (c) {
            case '\n' -> "\\n";
            case '\r' -> "\\r";
            case '\t' -> "\\t";
            case '\b' -> "\\b";
            case '\f' -> "\\f";
            case '\\' -> "\\\\";
            case '"' -> "\\\"";
            case '\'' -> "\\'";
            default -> Character.isISOControl(c)
                    ? String.format("\\%03o", (int) c)
                    : String.valueOf(c);
        };
    }

    // ==================== CODE BLOCKS ====================

    /**
     * Renders {@code List.of("a", "b")} for a list of strings.
     */
    static CodeBlock stringList(List<String> values) {
        List<CodeBlock> items = new ArrayList<>();
        for (String value : values) {
            items.add(CodeBlock.of("$L", quote(value)));
        }
        return CodeBlock.of("$T.of($L)", LIST, CodeBlock.join(items, ", "));
    }

    /**
     * Renders {@code Map.ofEntries(Map.entry("k", "v"), ...)} for a string map, or
     * {@code Map.of()} when empty. Entries keep the map's iteration order.
     */
    static CodeBlock stringMap(Map<String, String> values) {
        if (values.isEmpty()) {
            return CodeBlock.of("$T.of()", MAP);
        }
        List<CodeBlock> entries = new ArrayList<>();
        for (Map.Entry<String, String> entry : values.entrySet()) {
            entries.add(CodeBlock.of("$T.entry($L, $L)", MAP, quote(entry.getKey()), quote(entry.getValue())));
        }
        return CodeBlock.of("$T.ofEntries($L)", MAP, CodeBlock.join(entries, ", "));
    }

    /**
     * Returns the JavaPoet name of a route's handler type, nested types included.
     *
     * <p>For {@code typeName = "Api.Users"} in package {@code com.example} this is
     * {@code com.example.Api.Users}.
     */
    static ClassName handlerType(RouteMetadata route) {
        List<String> names = Arrays.asList(route.typeName().split("\\."));
        String[] nested = names.subList(1, names.size()).toArray(new String[0]);
        return ClassName.get(route.packageName(), names.get(0), nested);
    }
}
