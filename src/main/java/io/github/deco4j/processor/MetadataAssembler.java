package io.github.deco4j.processor;

import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MemberValuePair;
import com.github.javaparser.ast.expr.NormalAnnotationExpr;
import com.github.javaparser.ast.expr.SingleMemberAnnotationExpr;
import io.github.deco4j.model.FieldMetadata;
import io.github.deco4j.model.GroupInfo;
import io.github.deco4j.model.MarkerInstance;
import io.github.deco4j.model.MiddlewareCall;
import io.github.deco4j.model.MiddlewareInfo;
import io.github.deco4j.model.ParameterInfo;
import io.github.deco4j.model.ResponseInfo;
import io.github.deco4j.model.RouteMetadata;
import io.github.deco4j.model.SchemaMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Reduces a declaration's validated markers into one metadata record.
 *
 * <p><b>Per-marker policy:</b>
 * <ul>
 *   <li>{@code @Route}: sets method and path</li>
 *   <li>{@code @Group}: resolves (or creates) the group; the path gets the group prefix and
 *       the group name joins the tags</li>
 *   <li>{@code @Param} and {@code @Response}: accumulate from {@code key=value} arguments</li>
 *   <li>{@code @Description}, {@code @Summary}: last occurrence wins</li>
 *   <li>{@code @Tag}: every argument becomes a tag</li>
 *   <li>Behavior markers: one middleware call and descriptor each, in source order;
 *       {@code @WebSocket} also binds its arguments as message types</li>
 * </ul>
 *
 * <p>The assembler never fails. Arguments that make no sense for a marker end up as
 * absent fields, since syntax and arity were checked during extraction.
 */
final class MetadataAssembler {

    private static final Logger log = LoggerFactory.getLogger(MetadataAssembler.class);

    static final String POSITIONAL_KEY = "value";

    private final MarkerRegistry markers;
    private final GroupRegistry groups;

    MetadataAssembler(MarkerRegistry markers, GroupRegistry groups) {
        this.markers = Objects.requireNonNull(markers, "markers");
        this.groups = Objects.requireNonNull(groups, "groups");
    }

    // ==================== ROUTES ====================

    /**
     * Assembles a function declaration.
     *
     * @return an HTTP route, a websocket-only record, or empty when the markers describe neither
     */
    Optional<RouteMetadata> assembleRoute(DocumentedDeclaration declaration, List<MarkerInstance> instances) {
        RouteMetadata.Builder builder = RouteMetadata.builder(
                        declaration.name(), declaration.typeName(), declaration.packageName())
                .fileName(declaration.fileName())
                .line(declaration.line())
                .markers(instances);
        boolean routed = false;
        GroupInfo group = null;

        for (MarkerInstance marker : instances) {
            List<String> args = marker.args();
            switch (marker.name()) {
                case BuiltinMarkers.ROUTE -> {
                    if (args.size() >= 2) {
                        builder.method(args.get(0)).path(args.get(1));
                        routed = true;
                    }
                }
                case BuiltinMarkers.GROUP -> {
                    if (marker.hasArgs()) {
                        group = groups.resolve(args.get(0), argAt(args, 1), argAt(args, 2));
                    }
                }
                case BuiltinMarkers.PARAM -> parameter(args).ifPresent(builder::addParameter);
                case BuiltinMarkers.RESPONSE -> {
                    Optional<ResponseInfo> response = response(args);
                    if (response.isPresent()) {
                        builder.addResponse(response.get());
                    } else {
                        log.warn("Dropping {} on {}.{}: code and description are required",
                                marker.raw(), declaration.typeName(), declaration.name());
                    }
                }
                case BuiltinMarkers.DESCRIPTION -> builder.description(String.join(", ", args));
                case BuiltinMarkers.SUMMARY -> builder.summary(String.join(", ", args));
                case BuiltinMarkers.TAG -> args.forEach(builder::addTag);
                default -> behavior(marker, builder);
            }
        }

        if (group != null) {
            builder.group(group).addTag(group.name());
            if (routed) {
                builder.path(applyPrefix(group.prefix(), builder.path()));
            }
        }

        RouteMetadata route = builder.build();
        if (route.isHttpRoute() || route.isWebSocketOnly()) {
            return Optional.of(route);
        }
        log.debug("No route produced for {}.{}", declaration.typeName(), declaration.name());
        return Optional.empty();
    }

    private void behavior(MarkerInstance marker, RouteMetadata.Builder builder) {
        Optional<MarkerDefinition> definition = markers.lookup(marker.name());
        if (definition.isEmpty() || !definition.get().isBehavior()) {
            return;
        }
        MiddlewareCall call = definition.get().factory().create(marker.name(), marker.args());
        builder.addMiddleware(call, new MiddlewareInfo(marker.name(), argsToMap(marker.args()),
                builder.middlewareCount(), definition.get().description()));
        if (BuiltinMarkers.WEBSOCKET.equals(marker.name())) {
            marker.args().forEach(builder::addWebSocketHandler);
        }
    }

    /**
     * Joins a group prefix and a path without doubling slashes. Paths that already start
     * with the prefix, and empty paths, are returned unchanged.
     */
    static String applyPrefix(String prefix, String path) {
        if (path.isEmpty() || prefix.isEmpty() || prefix.equals("/")) {
            return path;
        }
        String base = prefix.endsWith("/") ? prefix.substring(0, prefix.length() - 1) : prefix;
        if (!base.startsWith("/")) {
            base = "/" + base;
        }
        if (path.equals(base) || path.startsWith(base + "/")) {
            return path;
        }
        return base + (path.startsWith("/") ? path : "/" + path);
    }

    // ==================== ARGUMENTS ====================

    /**
     * Converts {@code key=value} arguments to an ordered map. Positional arguments are
     * stored under {@value #POSITIONAL_KEY}; the last one wins.
     */
    static Map<String, String> argsToMap(List<String> args) {
        Map<String, String> map = new LinkedHashMap<>();
        for (String arg : args) {
            int eq = arg.indexOf('=');
            if (eq > 0) {
                map.put(arg.substring(0, eq).strip(), MarkerTokenizer.unquote(arg.substring(eq + 1).strip()));
            } else {
                map.put(POSITIONAL_KEY, arg);
            }
        }
        return map;
    }

    private static Optional<ParameterInfo> parameter(List<String> args) {
        Map<String, String> map = argsToMap(args);
        String name = map.getOrDefault("name", "");
        if (name.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ParameterInfo(name,
                map.getOrDefault("type", ""),
                map.getOrDefault("location", ""),
                Boolean.parseBoolean(map.getOrDefault("required", "false")),
                map.getOrDefault("description", ""),
                map.getOrDefault("example", "")));
    }

    private static Optional<ResponseInfo> response(List<String> args) {
        Map<String, String> map = argsToMap(args);
        String code = map.getOrDefault("code", "");
        String description = map.getOrDefault("description", "");
        if (code.isEmpty() || description.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ResponseInfo(code, description,
                map.getOrDefault("type", ""), map.getOrDefault("example", "")));
    }

    private static String argAt(List<String> args, int index) {
        return index < args.size() ? args.get(index) : "";
    }

    // ==================== SCHEMAS ====================

    /**
     * Assembles a type declaration carrying {@code @Schema}.
     *
     * @return the schema, or empty when the type has no {@code @Schema} marker
     */
    Optional<SchemaMetadata> assembleSchema(DocumentedDeclaration declaration, List<MarkerInstance> instances) {
        String description = null;
        String schemaDescription = null;
        boolean schema = false;
        for (MarkerInstance marker : instances) {
            if (BuiltinMarkers.SCHEMA.equals(marker.name())) {
                schema = true;
                if (schemaDescription == null && marker.hasArgs()) {
                    schemaDescription = marker.args().get(0);
                }
            } else if (BuiltinMarkers.DESCRIPTION.equals(marker.name())) {
                description = String.join(", ", marker.args());
            }
        }
        if (!schema) {
            return Optional.empty();
        }
        if (description == null) {
            description = schemaDescription == null ? "" : schemaDescription;
        }
        return Optional.of(new SchemaMetadata(declaration.typeName(), declaration.packageName(),
                declaration.fileName(), description, instances, fields(declaration.node())));
    }

    private static List<FieldMetadata> fields(BodyDeclaration<?> node) {
        List<FieldMetadata> fields = new ArrayList<>();
        if (node instanceof RecordDeclaration) {
            for (Parameter component : ((RecordDeclaration) node).getParameters()) {
                fields.add(field(component.getNameAsString(), component.getTypeAsString(),
                        component.getAnnotations(), component.getComment()));
            }
        }
        if (node instanceof TypeDeclaration) {
            for (FieldDeclaration field : ((TypeDeclaration<?>) node).getFields()) {
                if (field.isStatic()) {
                    continue;
                }
                for (VariableDeclarator variable : field.getVariables()) {
                    fields.add(field(variable.getNameAsString(), variable.getTypeAsString(),
                            field.getAnnotations(), field.getComment()));
                }
            }
        }
        return fields;
    }

    private static FieldMetadata field(String name, String type, NodeList<AnnotationExpr> annotations,
                                       Optional<Comment> comment) {
        String jsonName = name;
        List<String> validation = new ArrayList<>();
        for (AnnotationExpr annotation : annotations) {
            String simpleName = annotation.getName().getIdentifier();
            if ("JsonProperty".equals(simpleName)) {
                jsonName = annotationValue(annotation).orElse(name);
            } else {
                validation.add(simpleName);
            }
        }
        String description = comment
                .map(c -> CommentBlock.of(c.getContent(), 0).lines().stream()
                        .map(line -> line.strip().startsWith("*") ? line.strip().substring(1) : line)
                        .map(String::strip)
                        .filter(line -> !line.isEmpty())
                        .collect(Collectors.joining(" ")))
                .orElse("");
        return new FieldMetadata(name, type, jsonName, description, String.join(",", validation));
    }

    private static Optional<String> annotationValue(AnnotationExpr annotation) {
        Expression value = null;
        if (annotation instanceof SingleMemberAnnotationExpr) {
            value = ((SingleMemberAnnotationExpr) annotation).getMemberValue();
        } else if (annotation instanceof NormalAnnotationExpr) {
            for (MemberValuePair pair : ((NormalAnnotationExpr) annotation).getPairs()) {
                if ("value".equals(pair.getNameAsString())) {
                    value = pair.getValue();
                }
            }
        }
        if (value != null && value.isStringLiteralExpr()) {
            return Optional.of(value.asStringLiteralExpr().asString());
        }
        return Optional.empty();
    }
}
