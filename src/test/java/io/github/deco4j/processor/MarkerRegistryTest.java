package io.github.deco4j.processor;

import io.github.deco4j.model.MiddlewareCall;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Marker Registry")
class MarkerRegistryTest {

    @Nested
    @DisplayName("Built-in Markers")
    class Builtins {

        @Test
        @DisplayName("Routing, documentation and behavior markers are registered")
        void catalogue() {
            MarkerRegistry registry = MarkerRegistry.withBuiltins();

            assertThat(registry.names()).contains("Route", "Group", "Param", "Description", "Summary",
                    "Schema", "Tag", "Response", "Auth", "Cache", "CacheByURL", "RateLimit", "Metrics",
                    "CORS", "Telemetry", "Proxy", "Security", "WebSocket", "WebSocketStats", "ValidateJSON");
            assertThat(registry.lookup("Route").orElseThrow().arity()).isEqualTo(Arity.exactly(2));
            assertThat(registry.lookup("Response").orElseThrow().arity()).isEqualTo(Arity.atLeast(1));
            assertThat(registry.lookup("Route").orElseThrow().isBehavior()).isFalse();
            assertThat(registry.lookup("Auth").orElseThrow().isBehavior()).isTrue();
        }

        @Test
        @DisplayName("Cache and RateLimit fall back to default arguments")
        void defaultArguments() {
            MarkerRegistry registry = MarkerRegistry.withBuiltins();

            MiddlewareCall cache = registry.lookup("Cache").orElseThrow().factory().create("Cache", List.of());
            MiddlewareCall rateLimit = registry.lookup("RateLimit").orElseThrow().factory()
                    .create("RateLimit", List.of());
            MiddlewareCall auth = registry.lookup("Auth").orElseThrow().factory().create("Auth", List.of());

            assertThat(cache.arguments()).isEqualTo("duration=5m");
            assertThat(rateLimit.arguments()).isEqualTo("limit=100,window=1m");
            assertThat(auth.arguments()).isEmpty();
        }

        @Test
        @DisplayName("Behavior factory joins arguments and renders an escaped expression")
        void expression() {
            MiddlewareCall call = BehaviorFactory.joining().create("Auth", List.of("role=admin", "scope=\"x\""));

            assertThat(call.arguments()).isEqualTo("role=admin,scope=\"x\"");
            assertThat(call.expression()).isEqualTo("Middlewares.create(\"Auth\", \"role=admin,scope=\\\"x\\\"\")");
        }

        @Test
        @DisplayName("Installed providers include the built-ins")
        void loadInstalled() {
            assertThat(MarkerRegistry.loadInstalled().names()).containsAll(MarkerRegistry.withBuiltins().names());
        }
    }

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("Re-registering a name overwrites the definition")
        void lastWriteWins() {
            MarkerRegistry registry = new MarkerRegistry();
            registry.register(MarkerDefinition.metadata("Audit", Arity.any(), "first"));
            registry.register(MarkerDefinition.behavior("Audit", BehaviorFactory.joining(), "second"));

            assertThat(registry.all()).hasSize(1);
            assertThat(registry.lookup("Audit").orElseThrow().description()).isEqualTo("second");
            assertThat(registry.lookup("Audit").orElseThrow().isBehavior()).isTrue();
        }

        @Test
        @DisplayName("Definitions are listed in registration order")
        void order() {
            MarkerRegistry registry = new MarkerRegistry();
            registry.register(MarkerDefinition.metadata("B", Arity.any(), ""));
            registry.register(MarkerDefinition.metadata("A", Arity.any(), ""));

            assertThat(registry.all()).extracting(MarkerDefinition::name).containsExactly("B", "A");
        }

        @Test
        @DisplayName("Unknown names are absent and reset clears the registry")
        void lookupAndReset() {
            MarkerRegistry registry = MarkerRegistry.withBuiltins();
            assertThat(registry.lookup("Nope")).isEmpty();

            registry.reset();

            assertThat(registry.all()).isEmpty();
        }

        @Test
        @DisplayName("Blank descriptions default to 'Middleware <Name>'")
        void defaultDescription() {
            assertThat(MarkerDefinition.behavior("Audit", BehaviorFactory.joining(), "").description())
                    .isEqualTo("Middleware Audit");
        }

        @Test
        @DisplayName("Names must be identifiers")
        void invalidName() {
            assertThatThrownBy(() -> MarkerDefinition.metadata("Bad Name", Arity.any(), ""))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> MarkerDefinition.metadata("", Arity.any(), ""))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Arity")
    class Arities {

        @Test
        @DisplayName("Bounds are checked and described")
        void bounds() {
            assertThat(Arity.exactly(2).accepts(2)).isTrue();
            assertThat(Arity.exactly(2).accepts(1)).isFalse();
            assertThat(Arity.atLeast(1).accepts(0)).isFalse();
            assertThat(Arity.atLeast(1).accepts(9)).isTrue();
            assertThat(Arity.any().accepts(0)).isTrue();
            assertThat(Arity.exactly(2).describe()).isEqualTo("exactly 2");
            assertThat(Arity.atLeast(1).describe()).isEqualTo("at least 1");
            assertThatThrownBy(() -> new Arity(3, 1)).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
