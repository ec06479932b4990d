package io.github.deco4j.processor;

import io.github.deco4j.model.GenerationContext;
import io.github.deco4j.model.RouteMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static io.github.deco4j.processor.GenerationException.Reason.HOOK_FAILED;

/**
 * Ordered post-parse and pre-generation hooks.
 *
 * <p>Hooks run strictly in registration order. The first hook that throws stops the run:
 * later hooks are not called and the failure is rethrown as a {@link GenerationException}
 * with reason {@code HOOK_FAILED}.
 */
public final class HookPipeline {

    private static final Logger log = LoggerFactory.getLogger(HookPipeline.class);

    private final List<ParserHook> parserHooks = new ArrayList<>();
    private final List<GeneratorHook> generatorHooks = new ArrayList<>();

    public HookPipeline addParserHook(ParserHook hook) {
        parserHooks.add(Objects.requireNonNull(hook, "hook"));
        return this;
    }

    public HookPipeline addGeneratorHook(GeneratorHook hook) {
        generatorHooks.add(Objects.requireNonNull(hook, "hook"));
        return this;
    }

    public List<ParserHook> parserHooks() {
        return List.copyOf(parserHooks);
    }

    public List<GeneratorHook> generatorHooks() {
        return List.copyOf(generatorHooks);
    }

    public void runParserHooks(List<RouteMetadata> routes) throws GenerationException {
        for (int i = 0; i < parserHooks.size(); i++) {
            ParserHook hook = parserHooks.get(i);
            log.debug("Running parser hook #{} ({})", i, hook.getClass().getName());
            try {
                hook.apply(routes);
            } catch (Exception e) {
                throw failure("Parser", i, hook, e);
            }
        }
    }

    public void runGeneratorHooks(GenerationContext context) throws GenerationException {
        for (int i = 0; i < generatorHooks.size(); i++) {
            GeneratorHook hook = generatorHooks.get(i);
            log.debug("Running generator hook #{} ({})", i, hook.getClass().getName());
            try {
                hook.apply(context);
            } catch (Exception e) {
                throw failure("Generator", i, hook, e);
            }
        }
    }

    private static GenerationException failure(String stage, int index, Object hook, Exception cause) {
        return new GenerationException(HOOK_FAILED, stage + " hook #" + index + " ("
                + hook.getClass().getName() + ") failed: " + cause.getMessage(), cause);
    }
}
