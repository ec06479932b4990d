package io.github.deco4j.processor;

import io.github.deco4j.model.GenerationContext;
import io.github.deco4j.model.MiddlewareCall;
import io.github.deco4j.model.RouteMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Entry point of the annotation-to-code compiler.
 *
 * <p>A run goes scan → extract and validate → assemble → post-parse hooks → pre-generation
 * hooks → render and write → post-generation validation, single-threaded. Every run is a
 * full rescan of the source directory.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * GeneratorConfig config = GeneratorConfig.builder()
 *         .sourceDirectory(Path.of("src/main/java"))
 *         .outputDirectory(Path.of(".deco"))
 *         .build();
 * GenerationResult result = DecoGenerator.withDefaults(config).generate();
 * }</pre>
 *
 * <p><b>Failure modes:</b>
 * <ul>
 *   <li>{@link ValidationException}: marker errors in the sources, all reported together;
 *       nothing is written</li>
 *   <li>{@link GenerationException}: a fatal pipeline failure; a file written before the
 *       failure is left as is</li>
 * </ul>
 *
 * <p>Two runs against the same output path must not overlap.
 */
public final class DecoGenerator {

    private static final Logger log = LoggerFactory.getLogger(DecoGenerator.class);

    /** Context metadata key holding the {@code List<SchemaMetadata>} found in the scan. */
    public static final String SCHEMAS_KEY = "schemas";
    /** Context metadata key holding the {@code List<GroupInfo>} known after parsing. */
    public static final String GROUPS_KEY = "groups";

    private final GeneratorConfig config;
    private final GroupRegistry groups;
    private final SchemaRegistry schemas;
    private final HookPipeline hooks;
    private final DirectoryParser parser;

    public DecoGenerator(GeneratorConfig config,
                         MarkerRegistry markers,
                         GroupRegistry groups,
                         SchemaRegistry schemas,
                         HookPipeline hooks) {
        this.config = Objects.requireNonNull(config, "config");
        this.groups = Objects.requireNonNull(groups, "groups");
        this.schemas = Objects.requireNonNull(schemas, "schemas");
        this.hooks = Objects.requireNonNull(hooks, "hooks");
        this.parser = new DirectoryParser(Objects.requireNonNull(markers, "markers"), groups, schemas);
    }

    /**
     * Creates a generator with the installed markers, fresh group and schema registries, a
     * {@link LoggingHook} and an {@link ImportResolutionHook}.
     */
    public static DecoGenerator withDefaults(GeneratorConfig config) {
        HookPipeline hooks = new HookPipeline()
                .addParserHook(new LoggingHook(config.verbose()))
                .addGeneratorHook(new ImportResolutionHook());
        return new DecoGenerator(config, MarkerRegistry.loadInstalled(), new GroupRegistry(),
                new SchemaRegistry(), hooks);
    }

    /**
     * Scans the source directory and runs the post-parse hooks.
     *
     * @return the route metadata, in scan order
     */
    public List<RouteMetadata> parse() throws GenerationException, ValidationException {
        List<RouteMetadata> routes = parser.parse(config.sourceDirectory());
        hooks.runParserHooks(routes);
        return routes;
    }

    /**
     * Runs the whole pipeline and writes the generated file.
     */
    public GenerationResult generate() throws GenerationException, ValidationException {
        List<RouteMetadata> routes = parse();

        GenerationContext context = new GenerationContext(config.packageName(), config.className(),
                routes, Instant.now(config.clock()));
        context.putMetadata(SCHEMAS_KEY, schemas.all());
        context.putMetadata(GROUPS_KEY, groups.all());
        hooks.runGeneratorHooks(context);

        Path output = new CodeGenerator(config).write(context);
        if (config.validate()) {
            new GenerationValidator(config.entryPoint()).validate(output);
        }

        GenerationResult result = statistics(output, routes);
        log.info("Code generated: {} routes, {} websockets, {} middlewares, {} proxies processed",
                result.routeCount(), result.webSocketCount(), result.middlewareCount(), result.proxyCount());
        return result;
    }

    static GenerationResult statistics(Path output, List<RouteMetadata> routes) {
        int httpRoutes = 0;
        int webSockets = 0;
        int middlewares = 0;
        int proxies = 0;
        for (RouteMetadata route : routes) {
            if (route.isHttpRoute()) {
                httpRoutes++;
            }
            webSockets += route.webSocketHandlers().size();
            middlewares += route.middlewareCalls().size();
            for (MiddlewareCall call : route.middlewareCalls()) {
                if (BuiltinMarkers.PROXY.equals(call.marker())) {
                    proxies++;
                    break;
                }
            }
        }
        return new GenerationResult(output, httpRoutes, webSockets, middlewares, proxies);
    }
}
