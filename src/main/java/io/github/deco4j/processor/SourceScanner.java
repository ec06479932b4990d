package io.github.deco4j.processor;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.comments.Comment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static io.github.deco4j.processor.GenerationException.Reason.PARSE_FAILED;
import static io.github.deco4j.processor.GenerationException.Reason.SCAN_FAILED;

/**
 * Walks a source tree, parses every Java file and finds the documented declarations.
 *
 * <p><b>Scan rules:</b>
 * <ul>
 *   <li>Every {@code *.java} file below the root is parsed at the Java 17 language level</li>
 *   <li>Directories whose name starts with {@code .} are skipped, which keeps generated
 *       output in {@code .deco} out of the scan</li>
 *   <li>Files are visited in sorted path order and grouped by declared package</li>
 *   <li>The first file that fails to parse aborts the scan</li>
 * </ul>
 *
 * <p>Methods declared in anonymous or local classes are ignored: generated code has no
 * way to reference them.
 */
final class SourceScanner {

    private static final Logger log = LoggerFactory.getLogger(SourceScanner.class);

    private final JavaParser parser;

    SourceScanner() {
        this.parser = new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
    }

    // ==================== FILE SCANNING ====================

    /**
     * Parses every Java file under {@code root}.
     *
     * @param root the source root
     * @return parsed files grouped by package name, packages in sorted order
     * @throws GenerationException with {@code SCAN_FAILED} if the tree cannot be read,
     *                             or {@code PARSE_FAILED} for the first unparsable file
     */
    Map<String, List<SourceFile>> scan(Path root) throws GenerationException {
        if (!Files.isDirectory(root)) {
            throw new GenerationException(SCAN_FAILED, "Source directory does not exist: " + root);
        }
        Map<String, List<SourceFile>> packages = new TreeMap<>();
        for (Path path : javaFiles(root)) {
            SourceFile file = parse(path);
            packages.computeIfAbsent(file.packageName(), k -> new ArrayList<>()).add(file);
        }
        log.debug("Scanned {}: {} packages", root, packages.size());
        return packages;
    }

    SourceFile parse(Path path) throws GenerationException {
        ParseResult<CompilationUnit> result;
        try {
            result = parser.parse(path);
        } catch (IOException e) {
            throw new GenerationException(SCAN_FAILED, "Cannot read " + path + ": " + e.getMessage(), e);
        }
        Optional<CompilationUnit> unit = result.getResult();
        if (!result.isSuccessful() || unit.isEmpty()) {
            String problems = result.getProblems().stream()
                    .map(Problem::getVerboseMessage)
                    .collect(Collectors.joining("; "));
            throw new GenerationException(PARSE_FAILED, "Failed to parse " + path + ": " + problems);
        }
        String packageName = unit.get().getPackageDeclaration()
                .map(p -> p.getNameAsString())
                .orElse("");
        return new SourceFile(path, packageName, unit.get());
    }

    private static List<Path> javaFiles(Path root) throws GenerationException {
        try (Stream<Path> paths = Files.walk(root)) {
            return paths
                    .filter(p -> Files.isRegularFile(p) && p.getFileName().toString().endsWith(".java"))
                    .filter(p -> !isHidden(root, p))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            throw new GenerationException(SCAN_FAILED, "Cannot walk " + root + ": " + e.getMessage(), e);
        }
    }

    private static boolean isHidden(Path root, Path file) {
        Path relative = root.relativize(file.getParent() == null ? file : file.getParent());
        for (Path part : relative) {
            if (part.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }

    // ==================== DECLARATIONS ====================

    /**
     * Returns the documented declarations of a file whose comment mentions at least one of
     * {@code markerNames}, methods first, both in source order.
     *
     * <p>The mention test is a plain substring check for {@code @Name}. It only decides which
     * comments are worth tokenizing; it never produces metadata on its own.
     */
    List<DocumentedDeclaration> declarations(SourceFile file, Collection<String> markerNames) {
        List<DocumentedDeclaration> found = new ArrayList<>();
        CompilationUnit unit = file.unit();

        for (MethodDeclaration method : unit.findAll(MethodDeclaration.class)) {
            Optional<String> typeName = method.getParentNode().flatMap(SourceScanner::typePath);
            Optional<Comment> comment = method.getComment();
            if (typeName.isEmpty() || comment.isEmpty()) {
                continue;
            }
            CommentBlock block = CommentBlock.from(comment.get(), unit);
            if (mentionsMarker(block.text(), markerNames)) {
                found.add(new DocumentedDeclaration(DocumentedDeclaration.Kind.FUNCTION,
                        method.getNameAsString(), typeName.get(), file.packageName(), file.fileName(),
                        lineOf(method), block, method));
            }
        }

        for (TypeDeclaration<?> type : unit.findAll(TypeDeclaration.class)) {
            Optional<String> typeName = typePath(type);
            Optional<Comment> comment = type.getComment();
            if (typeName.isEmpty() || comment.isEmpty()) {
                continue;
            }
            CommentBlock block = CommentBlock.from(comment.get(), unit);
            if (mentionsMarker(block.text(), markerNames)) {
                found.add(new DocumentedDeclaration(DocumentedDeclaration.Kind.TYPE,
                        type.getNameAsString(), typeName.get(), file.packageName(), file.fileName(),
                        lineOf(type), block, type));
            }
        }
        return found;
    }

    static boolean mentionsMarker(String text, Collection<String> markerNames) {
        if (text.indexOf('@') < 0) {
            return false;
        }
        for (String name : markerNames) {
            if (text.contains("@" + name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns {@code Outer.Inner} for a member type, or empty for types that cannot be
     * named from another compilation unit (local and anonymous classes).
     */
    private static Optional<String> typePath(Node node) {
        List<String> names = new ArrayList<>();
        Node current = node;
        while (current instanceof TypeDeclaration) {
            names.add(0, ((TypeDeclaration<?>) current).getNameAsString());
            Optional<Node> parent = current.getParentNode();
            if (parent.isEmpty()) {
                return Optional.empty();
            }
            current = parent.get();
        }
        if (names.isEmpty() || !(current instanceof CompilationUnit)) {
            return Optional.empty();
        }
        return Optional.of(String.join(".", names));
    }

    private static int lineOf(Node node) {
        return node.getBegin().map(p -> p.line).orElse(0);
    }
}
