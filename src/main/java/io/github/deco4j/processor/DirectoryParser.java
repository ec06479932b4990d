package io.github.deco4j.processor;

import io.github.deco4j.model.RouteMetadata;
import io.github.deco4j.model.ValidationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Runs scanning, extraction and assembly over a source tree.
 *
 * <p>Validation errors from every declaration are gathered before anything is reported,
 * so one run surfaces every problem. A declaration with errors contributes no metadata.
 * Documented data structures are registered in the {@link SchemaRegistry} as a side effect.
 */
final class DirectoryParser {

    private static final Logger log = LoggerFactory.getLogger(DirectoryParser.class);

    private final MarkerRegistry markers;
    private final SchemaRegistry schemas;
    private final SourceScanner scanner = new SourceScanner();
    private final AnnotationExtractor extractor;
    private final MetadataAssembler assembler;

    DirectoryParser(MarkerRegistry markers, GroupRegistry groups, SchemaRegistry schemas) {
        this.markers = Objects.requireNonNull(markers, "markers");
        this.schemas = Objects.requireNonNull(schemas, "schemas");
        this.extractor = new AnnotationExtractor(markers);
        this.assembler = new MetadataAssembler(markers, groups);
    }

    /**
     * Parses every source file under {@code root}.
     *
     * @return route metadata in package, file and declaration order
     * @throws GenerationException if the tree cannot be scanned or a file cannot be parsed
     * @throws ValidationException if any declaration has marker errors
     */
    List<RouteMetadata> parse(Path root) throws GenerationException, ValidationException {
        Map<String, List<SourceFile>> packages = scanner.scan(root);
        Set<String> names = markers.names();
        List<RouteMetadata> routes = new ArrayList<>();
        List<ValidationError> errors = new ArrayList<>();

        for (Map.Entry<String, List<SourceFile>> entry : packages.entrySet()) {
            log.debug("Parsing package '{}' ({} files)", entry.getKey(), entry.getValue().size());
            for (SourceFile file : entry.getValue()) {
                for (DocumentedDeclaration declaration : scanner.declarations(file, names)) {
                    ExtractionResult result = extractor.extract(declaration);
                    if (!result.isValid()) {
                        errors.addAll(result.errors());
                        continue;
                    }
                    if (declaration.kind() == DocumentedDeclaration.Kind.FUNCTION) {
                        assembler.assembleRoute(declaration, result.markers()).ifPresent(routes::add);
                    } else {
                        assembler.assembleSchema(declaration, result.markers()).ifPresent(schemas::register);
                    }
                }
            }
        }

        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        log.debug("Parsed {} routes from {}", routes.size(), root);
        return routes;
    }
}
