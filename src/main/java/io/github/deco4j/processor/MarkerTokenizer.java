package io.github.deco4j.processor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Splits comment text into marker occurrences in a single left-to-right pass.
 *
 * <p>An occurrence is {@code @Name}, optional spaces or tabs, and a parenthesized argument
 * list. The list ends at the matching {@code )}; parentheses inside double-quoted strings
 * do not count. Names are matched exactly, so {@code @Cache(...)} and
 * {@code @CacheByURL(...)} never shadow each other, and names that are not in the known
 * set (including Javadoc block tags such as {@code @param}) are skipped.
 */
final class MarkerTokenizer {

    /**
     * One marker occurrence.
     *
     * @param name      the marker name
     * @param raw       the full matched text, e.g. {@code @Route("GET", "/users")}
     * @param arguments the text between the parentheses
     * @param line      the source line the occurrence starts on
     */
    record Token(String name, String raw, String arguments, int line) {
    }

    private MarkerTokenizer() {
    }

    static List<Token> tokenize(CommentBlock block, Collection<String> knownNames) {
        String text = block.text();
        List<Token> tokens = new ArrayList<>();
        int at = text.indexOf('@');
        while (at >= 0) {
            int nameEnd = at + 1;
            while (nameEnd < text.length() && Character.isJavaIdentifierPart(text.charAt(nameEnd))) {
                nameEnd++;
            }
            String name = text.substring(at + 1, nameEnd);
            int open = skipBlanks(text, nameEnd);
            int next = nameEnd;
            if (!name.isEmpty() && knownNames.contains(name) && open < text.length() && text.charAt(open) == '(') {
                int close = matchingParen(text, open);
                if (close > 0) {
                    tokens.add(new Token(name, text.substring(at, close + 1),
                            text.substring(open + 1, close), block.lineAt(at)));
                    next = close + 1;
                }
            }
            at = text.indexOf('@', Math.max(next, at + 1));
        }
        return tokens;
    }

    /**
     * Splits an argument list on commas that are outside double quotes and nested parentheses.
     * Tokens are trimmed but otherwise untouched.
     */
    static List<String> splitTopLevel(String arguments) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        int depth = 0;
        for (int i = 0; i < arguments.length(); i++) {
            char c = arguments.charAt(i);
            if (quoted) {
                if (c == '\\' && i + 1 < arguments.length()) {
                    current.append(c).append(arguments.charAt(++i));
                    continue;
                }
                quoted = c != '"';
            } else if (c == '"') {
                quoted = true;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (c == ',' && depth == 0) {
                parts.add(current.toString().strip());
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        parts.add(current.toString().strip());
        return parts;
    }

    /**
     * Removes one layer of matching double or single quotes.
     */
    static String unquote(String token) {
        if (token.length() >= 2) {
            char first = token.charAt(0);
            char last = token.charAt(token.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return token.substring(1, token.length() - 1);
            }
        }
        return token;
    }

    private static int skipBlanks(String text, int from) {
        int i = from;
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }

    /**
     * Returns the index of the {@code )} closing the {@code (} at {@code open}, or {@code -1}.
     */
    private static int matchingParen(String text, int open) {
        int depth = 0;
        boolean quoted = false;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quoted) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    quoted = false;
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == '(') {
                depth++;
            } else if (c == ')' && --depth == 0) {
                return i;
            }
        }
        return -1;
    }
}
