package io.github.deco4j.processor;

import io.github.deco4j.model.GenerationContext;

/**
 * Extension point that runs just before rendering and may add imports and metadata
 * to the generation context. Throwing aborts the run.
 */
@FunctionalInterface
public interface GeneratorHook {

    void apply(GenerationContext context) throws Exception;
}
