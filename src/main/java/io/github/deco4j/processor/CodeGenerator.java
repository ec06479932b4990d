package io.github.deco4j.processor;

import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.FieldSpec;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
import io.github.deco4j.model.GenerationContext;
import io.github.deco4j.model.GroupInfo;
import io.github.deco4j.model.MiddlewareCall;
import io.github.deco4j.model.MiddlewareInfo;
import io.github.deco4j.model.ParameterInfo;
import io.github.deco4j.model.ResponseInfo;
import io.github.deco4j.model.RouteMetadata;
import io.github.deco4j.runtime.Middlewares;
import io.github.deco4j.runtime.RouteEntry;
import io.github.deco4j.runtime.RouteRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.lang.model.element.Modifier;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

import static io.github.deco4j.processor.CodeGenUtils.quote;
import static io.github.deco4j.processor.CodeGenUtils.stringList;
import static io.github.deco4j.processor.CodeGenUtils.stringMap;
import static io.github.deco4j.processor.GenerationException.Reason.RENDER_FAILED;
import static io.github.deco4j.processor.GenerationException.Reason.WRITE_FAILED;

/**
 * Renders a {@link GenerationContext} into the registration source file.
 *
 * <p><b>Generated Code Example:</b>
 * <pre>{@code
 * // Code generated by deco4j; DO NOT EDIT.
 * package deco;
 *
 * public final class DecoratorsInit {
 *     public static final Map<String, Object> GENERATED_METADATA = Map.of(
 *             "routes_count", 1, "generated_at", "2024-01-01T00:00:00Z", "package_name", "deco");
 *
 *     public static RouteRegistry init() {
 *         RouteRegistry registry = new RouteRegistry();
 *         // GET /users/{id} -> UserApi.getUser (UserApi.java:12)
 *         registry.registerRoute(RouteEntry.builder("GET", "/users/{id}", UserApi::getUser)
 *                 .middlewares(List.of(Middlewares.create("Auth", "role=admin")))
 *                 .funcName("getUser")
 *                 ...
 *                 .build());
 *         return registry;
 *     }
 * }
 * }</pre>
 *
 * <p>Websocket-only handlers get one {@code registerWebSocketHandler} call per message
 * type plus a documentation route with method {@code WS} and path {@code /ws/<method>}.
 *
 * <p>Every value from annotation text is emitted through {@link CodeGenUtils#quote(String)}.
 * Output is deterministic apart from the {@code generated_at} timestamp.
 */
final class CodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CodeGenerator.class);

    static final String HEADER = "Code generated by deco4j; DO NOT EDIT.";
    static final String WEBSOCKET_METHOD = "WS";
    static final String GITIGNORE_NAME = ".gitignore";
    static final String GITIGNORE_CONTENT = "*.java\n!.gitignore\n*.tmp\n*.cache\n";

    private static final ClassName ROUTE_REGISTRY = ClassName.get(RouteRegistry.class);
    private static final ClassName ROUTE_ENTRY = ClassName.get(RouteEntry.class);
    private static final ClassName MIDDLEWARES = ClassName.get(Middlewares.class);
    private static final ClassName MIDDLEWARE_INFO = ClassName.get(MiddlewareInfo.class);
    private static final ClassName PARAMETER_INFO = ClassName.get(ParameterInfo.class);
    private static final ClassName RESPONSE_INFO = ClassName.get(ResponseInfo.class);
    private static final ClassName GROUP_INFO = ClassName.get(GroupInfo.class);
    private static final ClassName LIST = ClassName.get(List.class);
    private static final ClassName MAP = ClassName.get(Map.class);

    private final GeneratorConfig config;

    CodeGenerator(GeneratorConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    // ==================== OUTPUT ====================

    /**
     * Renders the context and writes it to {@link GeneratorConfig#outputFile()}.
     *
     * @return the written file
     * @throws GenerationException with {@code RENDER_FAILED} or {@code WRITE_FAILED}
     */
    Path write(GenerationContext context) throws GenerationException {
        String source = render(context);
        Path file = config.outputFile();
        try {
            Path parent = file.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Files.writeString(file, source, StandardCharsets.UTF_8);
            ensureGitignore(config.outputDirectory());
        } catch (IOException e) {
            throw new GenerationException(WRITE_FAILED, "Cannot write " + file + ": " + e.getMessage(), e);
        }
        log.debug("Generated source written to {}", file);
        return file;
    }

    /**
     * Creates the {@code .gitignore} of a {@code .deco} output directory if it has none.
     */
    static void ensureGitignore(Path outputDirectory) throws IOException {
        Path name = outputDirectory.toAbsolutePath().normalize().getFileName();
        if (name == null || !GeneratorConfig.DEFAULT_OUTPUT_DIRECTORY.equals(name.toString())) {
            return;
        }
        Path gitignore = outputDirectory.resolve(GITIGNORE_NAME);
        if (Files.notExists(gitignore)) {
            Files.createDirectories(outputDirectory);
            Files.writeString(gitignore, GITIGNORE_CONTENT, StandardCharsets.UTF_8);
            log.debug("Created {}", gitignore);
        }
    }

    /**
     * Renders the context to Java source, minified if configured. Consumes the context.
     *
     * @throws GenerationException with {@code RENDER_FAILED} if a handler type was not imported
     *                             or a name cannot be rendered
     * @throws IllegalStateException if the context was already consumed
     */
    String render(GenerationContext context) throws GenerationException {
        context.consume();
        checkImports(context);
        String source;
        try {
            source = JavaFile.builder(context.packageName(), type(context))
                    .addFileComment(HEADER)
                    .skipJavaLangImports(true)
                    .indent("    ")
                    .build()
                    .toString();
        } catch (IllegalArgumentException e) {
            throw new GenerationException(RENDER_FAILED, "Cannot render " + context.className() + ": "
                    + e.getMessage(), e);
        }
        return config.minify() ? SourceMinifier.minify(source) : source;
    }

    private static void checkImports(GenerationContext context) throws GenerationException {
        for (RouteMetadata route : context.routes()) {
            if (route.packageName().equals(context.packageName())) {
                continue;
            }
            String required = route.packageName() + "." + route.typeName().split("\\.")[0];
            if (route.packageName().isEmpty() || !context.hasImport(required)) {
                throw new GenerationException(RENDER_FAILED, "Handler type " + route.qualifiedTypeName()
                        + " is not imported into package '" + context.packageName() + "'");
            }
        }
    }

    // ==================== CLASS STRUCTURE ====================

    private TypeSpec type(GenerationContext context) {
        TypeName metadataType = ParameterizedTypeName.get(MAP, ClassName.get(String.class), ClassName.get(Object.class));
        FieldSpec metadata = FieldSpec.builder(metadataType, "GENERATED_METADATA",
                        Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
                .initializer("$T.of($L, $L, $L, $L, $L, $L)", MAP,
                        quote("routes_count"), context.routes().size(),
                        quote("generated_at"), quote(context.generatedAt().toString()),
                        quote("package_name"), quote(context.packageName()))
                .build();

        return TypeSpec.classBuilder(context.className())
                .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
                .addJavadoc("Registers the routes declared by annotated handlers.\n")
                .addField(metadata)
                .addMethod(MethodSpec.constructorBuilder().addModifiers(Modifier.PRIVATE).build())
                .addMethod(entryPoint(context))
                .build();
    }

    private MethodSpec entryPoint(GenerationContext context) {
        MethodSpec.Builder method = MethodSpec.methodBuilder(config.entryPoint())
                .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
                .returns(ROUTE_REGISTRY)
                .addJavadoc("Creates a registry holding every generated route.\n")
                .addStatement("$T registry = new $T()", ROUTE_REGISTRY, ROUTE_REGISTRY);

        for (RouteMetadata route : context.routes()) {
            ClassName handler = CodeGenUtils.handlerType(route);
            String target = route.typeName() + "." + route.functionName()
                    + " (" + route.fileName() + ":" + route.line() + ")";
            if (route.isWebSocketOnly()) {
                method.addComment("$L", CodeGenUtils.escapeString("WebSocket " + route.webSocketHandlers()
                        + " -> " + target));
                for (String messageType : route.webSocketHandlers()) {
                    method.addStatement("registry.registerWebSocketHandler($L, $T::$N)",
                            quote(messageType), handler, route.functionName());
                }
                method.addStatement("registry.registerRoute($L)",
                        routeEntry(route, handler, WEBSOCKET_METHOD, "/ws/" + route.functionName()));
            } else {
                method.addComment("$L", CodeGenUtils.escapeString(route.method() + " " + route.path()
                        + " -> " + target));
                method.addStatement("registry.registerRoute($L)",
                        routeEntry(route, handler, route.method(), route.path()));
            }
        }
        return method.addStatement("return registry").build();
    }

    // ==================== ROUTE ENTRIES ====================

    private static CodeBlock routeEntry(RouteMetadata route, ClassName handler, String method, String path) {
        CodeBlock.Builder entry = CodeBlock.builder()
                .add("$T.builder($L, $L, $T::$N)", ROUTE_ENTRY, quote(method), quote(path),
                        handler, route.functionName());

        if (!route.middlewareCalls().isEmpty()) {
            entry.add("\n.middlewares($L)", list(route.middlewareCalls(), CodeGenerator::middleware));
        }
        entry.add("\n.funcName($L)", quote(route.functionName()));
        entry.add("\n.packageName($L)", quote(route.packageName()));
        entry.add("\n.fileName($L)", quote(route.fileName()));
        if (!route.description().isEmpty()) {
            entry.add("\n.description($L)", quote(route.description()));
        }
        if (!route.summary().isEmpty()) {
            entry.add("\n.summary($L)", quote(route.summary()));
        }
        if (!route.tags().isEmpty()) {
            entry.add("\n.tags($L)", stringList(route.tags()));
        }
        if (!route.middlewareInfo().isEmpty()) {
            entry.add("\n.middlewareInfo($L)", list(route.middlewareInfo(), CodeGenerator::middlewareInfo));
        }
        if (!route.parameters().isEmpty()) {
            entry.add("\n.parameters($L)", list(route.parameters(), CodeGenerator::parameter));
        }
        if (route.group() != null) {
            GroupInfo group = route.group();
            entry.add("\n.group(new $T($L, $L, $L))", GROUP_INFO,
                    quote(group.name()), quote(group.prefix()), quote(group.description()));
        }
        if (!route.responses().isEmpty()) {
            entry.add("\n.responses($L)", list(route.responses(), CodeGenerator::response));
        }
        if (!route.webSocketHandlers().isEmpty()) {
            entry.add("\n.webSocketHandlers($L)", stringList(route.webSocketHandlers()));
        }
        return entry.add("\n.build()").build();
    }

    private static <T> CodeBlock list(List<T> values, Function<T, CodeBlock> element) {
        List<CodeBlock> items = new ArrayList<>();
        for (T value : values) {
            items.add(element.apply(value));
        }
        return CodeBlock.of("$T.of($L)", LIST, CodeBlock.join(items, ", "));
    }

    private static CodeBlock middleware(MiddlewareCall call) {
        return CodeBlock.of("$T.create($L, $L)", MIDDLEWARES, quote(call.marker()), quote(call.arguments()));
    }

    private static CodeBlock middlewareInfo(MiddlewareInfo info) {
        return CodeBlock.of("new $T($L, $L, $L, $L)", MIDDLEWARE_INFO,
                quote(info.name()), stringMap(info.args()), info.order(), quote(info.description()));
    }

    private static CodeBlock parameter(ParameterInfo parameter) {
        return CodeBlock.of("new $T($L, $L, $L, $L, $L, $L)", PARAMETER_INFO,
                quote(parameter.name()), quote(parameter.type()), quote(parameter.location()),
                parameter.required(), quote(parameter.description()), quote(parameter.example()));
    }

    private static CodeBlock response(ResponseInfo response) {
        return CodeBlock.of("new $T($L, $L, $L, $L)", RESPONSE_INFO,
                quote(response.code()), quote(response.description()),
                quote(response.type()), quote(response.example()));
    }
}
