package io.github.deco4j.runtime;

import io.github.deco4j.model.GroupInfo;
import io.github.deco4j.util.TestRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Route Registry")
class RouteRegistryTest {

    private static final Handler NOOP = ctx -> {
    };

    @Nested
    @DisplayName("Routes")
    class Routes {

        @Test
        @DisplayName("Routes are kept in registration order and found by method and path")
        void registrationOrder() {
            RouteRegistry registry = new RouteRegistry();
            registry.registerRoute(RouteEntry.builder("GET", "/users", NOOP).funcName("list").build());
            registry.registerRoute(RouteEntry.builder("POST", "/users", NOOP).funcName("create").build());

            assertThat(registry.routes()).extracting(RouteEntry::funcName).containsExactly("list", "create");
            assertThat(registry.find("POST", "/users")).map(RouteEntry::funcName).contains("create");
            assertThat(registry.find("DELETE", "/users")).isEmpty();
        }

        @Test
        @DisplayName("Group of the last route registered with a name wins")
        void groupsLastWins() {
            RouteRegistry registry = new RouteRegistry();
            registry.registerRoute(RouteEntry.builder("GET", "/a", NOOP)
                    .group(new GroupInfo("users", "/users", "first")).build());
            registry.registerRoute(RouteEntry.builder("GET", "/b", NOOP)
                    .group(new GroupInfo("users", "/v2/users", "second")).build());

            assertThat(registry.groups().get("users").description()).isEqualTo("second");
        }

        @Test
        @DisplayName("Null entries are rejected")
        void nullEntry() {
            assertThatThrownBy(() -> new RouteRegistry().registerRoute(null))
                    .isInstanceOf(NullPointerException.class);
        }

        @Test
        @DisplayName("Concurrent registration loses no routes")
        void concurrentRegistration() throws Exception {
            RouteRegistry registry = new RouteRegistry();
            ExecutorService pool = Executors.newFixedThreadPool(4);
            CountDownLatch start = new CountDownLatch(1);
            try {
                for (int t = 0; t < 4; t++) {
                    int thread = t;
                    pool.submit(() -> {
                        start.await();
                        for (int i = 0; i < 100; i++) {
                            registry.registerRoute(RouteEntry.builder("GET", "/r/" + thread + "/" + i, NOOP).build());
                            registry.routes();
                        }
                        return null;
                    });
                }
                start.countDown();
            } finally {
                pool.shutdown();
            }
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
            assertThat(registry.routes()).hasSize(400);
        }
    }

    @Nested
    @DisplayName("WebSocket Handlers")
    class WebSocketHandlers {

        @Test
        @DisplayName("Binding a message type twice replaces the handler")
        void rebinding() throws Exception {
            List<String> calls = new ArrayList<>();
            RouteRegistry registry = new RouteRegistry();
            registry.registerWebSocketHandler("chat.message", ctx -> calls.add("first"));
            registry.registerWebSocketHandler("chat.message", ctx -> calls.add("second"));

            registry.webSocketHandler("chat.message").orElseThrow().handle(new TestRequest("WS", "/ws"));

            assertThat(calls).containsExactly("second");
            assertThat(registry.webSocketMessageTypes()).containsExactly("chat.message");
            assertThat(registry.webSocketHandler("chat.join")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Middleware Composition")
    class Composition {

        @Test
        @DisplayName("First middleware runs outermost")
        void firstIsOutermost() throws Exception {
            TestRequest request = new TestRequest("GET", "/");
            Middleware auth = next -> ctx -> {
                request.record("auth");
                next.handle(ctx);
            };
            Middleware cache = next -> ctx -> {
                request.record("cache");
                next.handle(ctx);
            };
            RouteEntry entry = RouteEntry.builder("GET", "/", ctx -> request.record("handler"))
                    .middlewares(List.of(auth, cache))
                    .build();

            entry.composedHandler().handle(request);

            assertThat(request.trace()).containsExactly("auth", "cache", "handler");
        }

        @Test
        @DisplayName("Entry lists are copied defensively")
        void immutableLists() {
            List<String> tags = new ArrayList<>(List.of("users"));
            RouteEntry entry = RouteEntry.builder("GET", "/", NOOP).tags(tags).build();
            tags.add("admin");

            assertThat(entry.tags()).containsExactly("users");
            assertThatThrownBy(() -> entry.tags().add("x")).isInstanceOf(UnsupportedOperationException.class);
        }
    }
}
