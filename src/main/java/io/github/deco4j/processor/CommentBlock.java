package io.github.deco4j.processor;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.comments.LineComment;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The text of a declaration's documentation comment, one entry per source line.
 *
 * <p>Lines are trimmed and Javadoc's leading {@code *} gutter is removed. The first
 * entry corresponds to source line {@code firstLine}, so any offset into {@link #text()}
 * maps back to an exact source line.
 *
 * @param lines     the comment lines
 * @param firstLine the source line of the first entry
 */
record CommentBlock(List<String> lines, int firstLine) {

    CommentBlock {
        lines = List.copyOf(lines);
    }

    /**
     * Creates a block from raw text, e.g. for a comment assembled by hand.
     */
    static CommentBlock of(String text, int firstLine) {
        return new CommentBlock(List.of(text.split("\n", -1)), firstLine);
    }

    /**
     * Returns the comment attached to a declaration as a block.
     *
     * <p>Javadoc and block comments are used as they are. A line comment is extended
     * upward through the run of unattached line comments on the directly preceding lines,
     * since only the last line of a run is attached to the declaration.
     *
     * @param comment the comment attached to the declaration
     * @param unit    the compilation unit holding the declaration
     */
    static CommentBlock from(Comment comment, CompilationUnit unit) {
        int begin = comment.getBegin().map(p -> p.line).orElse(0);
        if (!(comment instanceof LineComment)) {
            List<String> lines = new ArrayList<>();
            for (String line : comment.getContent().split("\r?\n", -1)) {
                lines.add(stripGutter(line));
            }
            return new CommentBlock(lines, begin);
        }

        Map<Integer, String> loose = new TreeMap<>();
        for (Comment candidate : unit.getAllComments()) {
            if (candidate instanceof LineComment && candidate.getCommentedNode().isEmpty()
                    && candidate.getBegin().isPresent()) {
                loose.put(candidate.getBegin().get().line, candidate.getContent().strip());
            }
        }
        List<String> lines = new ArrayList<>();
        lines.add(comment.getContent().strip());
        int first = begin;
        while (loose.containsKey(first - 1)) {
            first--;
            lines.add(0, loose.get(first));
        }
        return new CommentBlock(lines, first);
    }

    String text() {
        return String.join("\n", lines);
    }

    /**
     * Returns the source line holding the character at {@code offset} in {@link #text()}.
     */
    int lineAt(int offset) {
        String text = text();
        int line = firstLine;
        int end = Math.min(offset, text.length());
        for (int i = 0; i < end; i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    private static String stripGutter(String line) {
        String stripped = line.strip();
        if (stripped.startsWith("*")) {
            stripped = stripped.substring(1).strip();
        }
        return stripped;
    }
}
