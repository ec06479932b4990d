package io.github.deco4j.processor;

import io.github.deco4j.model.MarkerInstance;
import io.github.deco4j.model.ValidationError;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Finds and validates the markers in a declaration's comment.
 *
 * <p>Steps, in order:
 * <ol>
 *   <li>Syntax sanity pass; a failure ends extraction for this declaration</li>
 *   <li>Tokenization against the registered marker names</li>
 *   <li>Argument parsing</li>
 *   <li>Arity check per marker</li>
 *   <li>Method and path checks for {@code @Route}</li>
 * </ol>
 * Errors from steps 3 to 5 are collected for every marker rather than stopping at the first.
 */
final class AnnotationExtractor {

    private final MarkerRegistry registry;

    AnnotationExtractor(MarkerRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    ExtractionResult extract(DocumentedDeclaration declaration) {
        return extract(declaration.comment(), declaration.fileName(), declaration.name());
    }

    /**
     * Extracts markers from a comment block.
     *
     * @param block    the comment
     * @param fileName the source file name, for errors
     * @param subject  the declaration name, for messages
     */
    ExtractionResult extract(CommentBlock block, String fileName, String subject) {
        List<ValidationError> errors = new ArrayList<>();
        ErrorReporter reporter = (line, code, message) ->
                errors.add(new ValidationError(fileName, line, message, code));

        if (!ValidationUtils.validateSyntax(block, reporter)) {
            return new ExtractionResult(List.of(), errors);
        }

        List<MarkerInstance> markers = new ArrayList<>();
        for (MarkerTokenizer.Token token : MarkerTokenizer.tokenize(block, registry.names())) {
            Optional<MarkerDefinition> definition = registry.lookup(token.name());
            if (definition.isEmpty()) {
                continue;
            }
            Optional<List<String>> args = ValidationUtils.parseArguments(
                    token.name(), token.arguments(), token.line(), reporter);
            if (args.isEmpty()
                    || !ValidationUtils.validateArity(definition.get(), args.get().size(), token.line(), reporter)) {
                continue;
            }
            if (BuiltinMarkers.ROUTE.equals(token.name()) && args.get().size() == 2
                    && !ValidationUtils.validateRoute(args.get(), subject, token.line(), reporter)) {
                continue;
            }
            markers.add(new MarkerInstance(token.name(), token.raw(), args.get()));
        }
        return new ExtractionResult(markers, errors);
    }
}
