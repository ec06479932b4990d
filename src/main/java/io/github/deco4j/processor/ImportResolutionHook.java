package io.github.deco4j.processor;

import io.github.deco4j.model.GenerationContext;
import io.github.deco4j.model.RouteMetadata;
import io.github.deco4j.runtime.Middlewares;
import io.github.deco4j.runtime.RouteEntry;
import io.github.deco4j.runtime.RouteRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Collects the imports the generated file needs.
 *
 * <p>Adds the runtime types, then the top-level type of every handler declared outside
 * the target package, deduplicated and in route order. Also records the artifact id of
 * the enclosing Maven module, found by walking upward from the working directory, as
 * {@value #MODULE_KEY} in the context metadata.
 *
 * <p>Handlers in the default package cannot be imported into a named package; the hook
 * fails for them.
 */
public final class ImportResolutionHook implements GeneratorHook {

    public static final String MODULE_KEY = "module";

    private static final Logger log = LoggerFactory.getLogger(ImportResolutionHook.class);

    private final Path workingDirectory;

    public ImportResolutionHook() {
        this(Path.of(System.getProperty("user.dir")));
    }

    public ImportResolutionHook(Path workingDirectory) {
        this.workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory");
    }

    @Override
    public void apply(GenerationContext context) throws Exception {
        context.addImport(RouteRegistry.class.getName());
        context.addImport(RouteEntry.class.getName());
        if (context.routes().stream().anyMatch(r -> !r.middlewareCalls().isEmpty())) {
            context.addImport(Middlewares.class.getName());
        }

        for (RouteMetadata route : context.routes()) {
            if (route.packageName().equals(context.packageName())) {
                continue;
            }
            if (route.packageName().isEmpty()) {
                throw new IllegalStateException("Handler " + route.typeName() + "." + route.functionName()
                        + " in " + route.fileName() + " is declared in the default package and cannot be"
                        + " imported into package '" + context.packageName() + "'");
            }
            String topLevel = route.typeName().split("\\.")[0];
            if (context.addImport(route.packageName() + "." + topLevel)) {
                log.debug("Import added: {}.{}", route.packageName(), topLevel);
            }
        }

        Optional<Path> pom = ModuleLocator.findModuleFile(workingDirectory);
        if (pom.isPresent()) {
            Optional<String> module = ModuleLocator.artifactId(pom.get());
            module.ifPresent(m -> context.putMetadata(MODULE_KEY, m));
            log.debug("Module resolved from {}: {}", pom.get(), module.orElse("<none>"));
        }
    }
}
