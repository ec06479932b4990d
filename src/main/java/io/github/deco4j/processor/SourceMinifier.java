package io.github.deco4j.processor;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.comments.Comment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reduces generated source to its essentials.
 *
 * <p>Comments are removed except build-relevant ones (those mentioning {@code Code generated}
 * or {@code DO NOT EDIT}), runs of blank lines collapse to one, trailing whitespace is trimmed
 * and blank lines inside the import block are dropped. Comments are removed on the JavaParser
 * tree when the source parses, and line by line otherwise.
 */
final class SourceMinifier {

    private static final Logger log = LoggerFactory.getLogger(SourceMinifier.class);

    private static final Pattern BLANK_RUNS = Pattern.compile("\n\\s*\n\\s*\n");
    private static final Pattern TRAILING_WHITESPACE = Pattern.compile("[ \t]+(?=\n)");

    private SourceMinifier() {
    }

    static String minify(String source) {
        String stripped;
        ParseResult<CompilationUnit> result = new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)).parse(source);
        if (result.isSuccessful() && result.getResult().isPresent()) {
            stripped = stripComments(result.getResult().get());
        } else {
            log.debug("Minifying without a syntax tree: {}", result.getProblems());
            stripped = stripLineComments(source);
        }
        return compactImports(collapseBlankLines(stripped));
    }

    static boolean isBuildRelevant(String comment) {
        return comment.contains("Code generated") || comment.contains("DO NOT EDIT");
    }

    private static String stripComments(CompilationUnit unit) {
        for (Comment comment : unit.getAllComments()) {
            if (!isBuildRelevant(comment.getContent())) {
                comment.remove();
            }
        }
        return unit.toString();
    }

    private static String stripLineComments(String source) {
        StringBuilder out = new StringBuilder(source.length());
        for (String line : source.split("\n", -1)) {
            String trimmed = line.strip();
            if (trimmed.startsWith("//") && !isBuildRelevant(trimmed)) {
                continue;
            }
            out.append(line).append('\n');
        }
        return out.toString();
    }

    static String collapseBlankLines(String source) {
        String result = TRAILING_WHITESPACE.matcher(source.replace("\r\n", "\n")).replaceAll("");
        String previous;
        do {
            previous = result;
            result = BLANK_RUNS.matcher(result).replaceAll("\n\n");
        } while (!result.equals(previous));
        return result.strip() + "\n";
    }

    /**
     * Drops blank lines between consecutive import declarations.
     */
    static String compactImports(String source) {
        String[] lines = source.split("\n", -1);
        List<String> out = new ArrayList<>(lines.length);
        for (int i = 0; i < lines.length; i++) {
            if (lines[i].isBlank() && !out.isEmpty() && isImport(out.get(out.size() - 1))
                    && nextNonBlankIsImport(lines, i)) {
                continue;
            }
            out.add(lines[i]);
        }
        return String.join("\n", out);
    }

    private static boolean nextNonBlankIsImport(String[] lines, int from) {
        for (int i = from; i < lines.length; i++) {
            if (!lines[i].isBlank()) {
                return isImport(lines[i]);
            }
        }
        return false;
    }

    private static boolean isImport(String line) {
        return line.startsWith("import ");
    }
}
