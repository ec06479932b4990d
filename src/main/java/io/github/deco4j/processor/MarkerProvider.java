package io.github.deco4j.processor;

/**
 * Service interface for contributing markers to a {@link MarkerRegistry}.
 *
 * <p>Implementations are discovered with {@link java.util.ServiceLoader} by
 * {@link MarkerRegistry#loadInstalled()}. Annotate an implementation with
 * {@code @AutoService(MarkerProvider.class)} to generate its service registration.
 */
public interface MarkerProvider {

    /**
     * Registers this provider's markers. Existing definitions of the same name are overwritten.
     */
    void registerMarkers(MarkerRegistry registry);
}
