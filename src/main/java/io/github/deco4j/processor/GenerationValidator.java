package io.github.deco4j.processor;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.MethodCallExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import static io.github.deco4j.processor.GenerationException.Reason.MISSING_ENTRY_POINT;
import static io.github.deco4j.processor.GenerationException.Reason.MISSING_IMPORTS;
import static io.github.deco4j.processor.GenerationException.Reason.MISSING_REGISTRATIONS;
import static io.github.deco4j.processor.GenerationException.Reason.OUTPUT_EMPTY;
import static io.github.deco4j.processor.GenerationException.Reason.OUTPUT_MISSING;
import static io.github.deco4j.processor.GenerationException.Reason.OUTPUT_SYNTAX;

/**
 * Structural check of a generated file.
 *
 * <p>The file must exist, be non-empty and parse. It must then have at least one import,
 * a method named like the entry point, and inside that method at least one
 * {@value #REGISTRATION_CALL} call. The validator only reads the file.
 */
final class GenerationValidator {

    private static final Logger log = LoggerFactory.getLogger(GenerationValidator.class);

    static final String REGISTRATION_CALL = "registerRoute";

    private final String entryPoint;
    private final JavaParser parser = new JavaParser(new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));

    GenerationValidator(String entryPoint) {
        this.entryPoint = Objects.requireNonNull(entryPoint, "entryPoint");
    }

    void validate(Path file) throws GenerationException {
        if (!Files.isRegularFile(file)) {
            throw new GenerationException(OUTPUT_MISSING, "Generated file not found: " + file);
        }
        String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new GenerationException(OUTPUT_MISSING, "Cannot read generated file " + file, e);
        }
        if (source.isBlank()) {
            throw new GenerationException(OUTPUT_EMPTY, "Generated file is empty: " + file);
        }

        ParseResult<CompilationUnit> result = parser.parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            String problems = result.getProblems().stream()
                    .map(Problem::getVerboseMessage)
                    .collect(Collectors.joining("; "));
            throw new GenerationException(OUTPUT_SYNTAX, "Generated file " + file + " has syntax errors: "
                    + problems);
        }
        CompilationUnit unit = result.getResult().get();

        if (unit.getImports().isEmpty()) {
            throw new GenerationException(MISSING_IMPORTS, "Generated file " + file + " has no imports");
        }
        List<MethodDeclaration> entryPoints = unit.findAll(MethodDeclaration.class,
                m -> m.getNameAsString().equals(entryPoint));
        if (entryPoints.isEmpty()) {
            throw new GenerationException(MISSING_ENTRY_POINT, "Generated file " + file
                    + " has no '" + entryPoint + "' method");
        }
        boolean registers = entryPoints.stream().anyMatch(m -> !m.findAll(MethodCallExpr.class,
                call -> call.getNameAsString().equals(REGISTRATION_CALL)).isEmpty());
        if (!registers) {
            throw new GenerationException(MISSING_REGISTRATIONS, "Method '" + entryPoint + "' in " + file
                    + " makes no " + REGISTRATION_CALL + " call");
        }
        log.debug("Generated file {} passed validation", file);
    }
}
