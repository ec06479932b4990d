package io.github.deco4j.processor;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.google.testing.compile.Compilation;
import com.google.testing.compile.CompilationSubject;
import com.google.testing.compile.JavaFileObjects;
import io.github.deco4j.model.GenerationContext;
import io.github.deco4j.model.GroupInfo;
import io.github.deco4j.model.MiddlewareCall;
import io.github.deco4j.model.MiddlewareInfo;
import io.github.deco4j.model.ParameterInfo;
import io.github.deco4j.model.ResponseInfo;
import io.github.deco4j.model.RouteMetadata;
import io.github.deco4j.runtime.RouteEntry;
import io.github.deco4j.runtime.RouteRegistry;
import io.github.deco4j.util.CompileHelper;
import io.github.deco4j.util.RuntimeTestHelper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.tools.JavaFileObject;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.api.Assertions.tuple;

@DisplayName("Code Generator")
class CodeGeneratorTest {

    private static final Instant GENERATED_AT = Instant.parse("2024-01-01T00:00:00Z");

    private static final JavaFileObject USER_API = JavaFileObjects.forSourceString("app.UserApi", """
            package app;

            import io.github.deco4j.runtime.RequestContext;

            public class UserApi {
                public static void list(RequestContext ctx) {
                }

                public static void getUser(RequestContext ctx) {
                }

                public static class Chat {
                    public static void onMessage(RequestContext ctx) {
                    }
                }
            }
            """);

    @TempDir
    Path outputRoot;

    private GeneratorConfig config(boolean minify) {
        return GeneratorConfig.builder()
                .sourceDirectory(outputRoot)
                .outputDirectory(outputRoot.resolve(".deco"))
                .minify(minify)
                .build();
    }

    private static RouteMetadata plainRoute() {
        return RouteMetadata.builder("list", "UserApi", "app")
                .method("GET").path("/users").fileName("UserApi.java").line(7)
                .build();
    }

    private static RouteMetadata documentedRoute() {
        return RouteMetadata.builder("getUser", "UserApi", "app")
                .method("GET").path("/api/users/{id}").fileName("UserApi.java").line(12)
                .description("Fetches one user, \"by id\"")
                .summary("Get user")
                .addTag("users")
                .addTag("api")
                .addParameter(new ParameterInfo("id", "string", "path", true, "User id", "42"))
                .addResponse(new ResponseInfo("200", "OK", "User", ""))
                .addMiddleware(new MiddlewareCall("Auth", "role=admin",
                                "Middlewares.create(\"Auth\", \"role=admin\")"),
                        new MiddlewareInfo("Auth", Map.of("role", "admin"), 0, "Authentication"))
                .group(new GroupInfo("api", "/api", "Public API"))
                .build();
    }

    private static RouteMetadata webSocketRoute() {
        return RouteMetadata.builder("onMessage", "UserApi.Chat", "app")
                .fileName("UserApi.java").line(20)
                .addWebSocketHandler("chat")
                .addWebSocketHandler("typing")
                .build();
    }

    private static GenerationContext context(RouteMetadata... routes) {
        GenerationContext context = new GenerationContext("deco", "DecoratorsInit", List.of(routes), GENERATED_AT);
        context.addImport("app.UserApi");
        return context;
    }

    @Nested
    @DisplayName("Rendering")
    class Rendering {

        @Test
        @DisplayName("Output starts with the generated-code header and declares the entry point")
        void structure() throws Exception {
            String source = new CodeGenerator(config(false)).render(context(plainRoute()));

            assertThat(source).startsWith("// " + CodeGenerator.HEADER);
            assertThat(source).contains(
                    "package deco;",
                    "import app.UserApi;",
                    "public final class DecoratorsInit {",
                    "public static RouteRegistry init() {",
                    "// GET /users -> UserApi.list (UserApi.java:7)",
                    "registry.registerRoute(RouteEntry.builder(\"GET\", \"/users\", UserApi::list)",
                    "\"generated_at\", \"2024-01-01T00:00:00Z\"");
        }

        @Test
        @DisplayName("Only non-empty metadata produces builder calls")
        void optionalSetters() throws Exception {
            String source = new CodeGenerator(config(false)).render(context(plainRoute()));

            assertThat(source).contains(".funcName(\"list\")", ".packageName(\"app\")", ".fileName(\"UserApi.java\")");
            assertThat(source).doesNotContain(".description(", ".tags(", ".middlewares(", ".group(");
        }

        @Test
        @DisplayName("Annotation text survives as exact string literals")
        void escaping() throws Exception {
            String source = new CodeGenerator(config(false)).render(context(documentedRoute()));

            CompilationUnit unit = StaticJavaParser.parse(source);
            List<String> literals = unit.findAll(StringLiteralExpr.class).stream()
                    .map(StringLiteralExpr::asString)
                    .toList();
            assertThat(literals).contains("Fetches one user, \"by id\"", "/api/users/{id}", "role=admin");
        }

        @Test
        @DisplayName("Websocket-only handlers bind each message type and get a WS route")
        void webSocket() throws Exception {
            String source = new CodeGenerator(config(false)).render(context(webSocketRoute()));

            assertThat(source).contains(
                    "registry.registerWebSocketHandler(\"chat\", UserApi.Chat::onMessage);",
                    "registry.registerWebSocketHandler(\"typing\", UserApi.Chat::onMessage);",
                    "RouteEntry.builder(\"WS\", \"/ws/onMessage\", UserApi.Chat::onMessage)",
                    ".webSocketHandlers(List.of(\"chat\", \"typing\"))");
        }

        @Test
        @DisplayName("Same context renders identically")
        void deterministic() throws Exception {
            CodeGenerator generator = new CodeGenerator(config(false));

            String first = generator.render(context(plainRoute(), documentedRoute()));
            String second = generator.render(context(plainRoute(), documentedRoute()));

            assertThat(first).isEqualTo(second);
        }

        @Test
        @DisplayName("Minified output keeps only the header comment")
        void minify() throws Exception {
            String source = new CodeGenerator(config(true)).render(context(plainRoute()));

            assertThat(source).contains(CodeGenerator.HEADER);
            assertThat(source).doesNotContain("/**", "// GET /users", "\n\n\n");
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("A context is consumed once")
        void consumedOnce() throws Exception {
            CodeGenerator generator = new CodeGenerator(config(false));
            GenerationContext context = context(plainRoute());
            generator.render(context);

            assertThatThrownBy(() -> generator.render(context))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("already consumed");
        }

        @Test
        @DisplayName("A handler type missing from the imports fails with RENDER_FAILED")
        void missingImport() {
            GenerationContext context = new GenerationContext("deco", "DecoratorsInit",
                    List.of(plainRoute()), GENERATED_AT);

            GenerationException e = catchThrowableOfType(() -> new CodeGenerator(config(false)).render(context),
                    GenerationException.class);

            assertThat(e.getReason()).isEqualTo(GenerationException.Reason.RENDER_FAILED);
            assertThat(e.getMessage()).contains("app.UserApi");
        }
    }

    @Nested
    @DisplayName("Output files")
    class OutputFiles {

        @Test
        @DisplayName("Source is written under the package directory with a .gitignore")
        void write() throws Exception {
            Path file = new CodeGenerator(config(false)).write(context(plainRoute()));

            assertThat(file).isEqualTo(outputRoot.resolve(".deco/deco/DecoratorsInit.java"));
            assertThat(file).exists();
            assertThat(outputRoot.resolve(".deco/.gitignore")).hasContent(CodeGenerator.GITIGNORE_CONTENT);
        }

        @Test
        @DisplayName("An existing .gitignore is left untouched")
        void existingGitignore() throws Exception {
            Path dir = Files.createDirectories(outputRoot.resolve(".deco"));
            Files.writeString(dir.resolve(".gitignore"), "custom\n");

            CodeGenerator.ensureGitignore(dir);

            assertThat(dir.resolve(".gitignore")).hasContent("custom");
        }

        @Test
        @DisplayName("Other output directories get no .gitignore")
        void customDirectory() throws Exception {
            Path dir = Files.createDirectories(outputRoot.resolve("generated"));

            CodeGenerator.ensureGitignore(dir);

            assertThat(dir.resolve(".gitignore")).doesNotExist();
        }
    }

    @Nested
    @DisplayName("Compilation")
    class Compiles {

        @Test
        @DisplayName("Generated source compiles against the handlers")
        void compiles() throws Exception {
            String source = new CodeGenerator(config(false))
                    .render(context(plainRoute(), documentedRoute(), webSocketRoute()));

            Compilation compilation = CompileHelper.compile(USER_API,
                    JavaFileObjects.forSourceString("deco.DecoratorsInit", source));

            CompilationSubject.assertThat(compilation).succeeded();
        }

        @Test
        @DisplayName("The entry point registers every route with its metadata")
        void registers() throws Exception {
            String source = new CodeGenerator(config(false))
                    .render(context(plainRoute(), documentedRoute(), webSocketRoute()));
            RuntimeTestHelper runtime = RuntimeTestHelper.compile(USER_API,
                    JavaFileObjects.forSourceString("deco.DecoratorsInit", source));

            RouteRegistry registry = (RouteRegistry) runtime.invoke("deco.DecoratorsInit", "init");

            assertThat(registry.routes()).extracting(RouteEntry::method, RouteEntry::path)
                    .containsExactly(
                            tuple("GET", "/users"),
                            tuple("GET", "/api/users/{id}"),
                            tuple("WS", "/ws/onMessage"));
            RouteEntry documented = registry.find("GET", "/api/users/{id}").orElseThrow();
            assertThat(documented.description()).isEqualTo("Fetches one user, \"by id\"");
            assertThat(documented.tags()).containsExactly("users", "api");
            assertThat(documented.middlewares()).hasSize(1);
            assertThat(documented.group()).isEqualTo(new GroupInfo("api", "/api", "Public API"));
            assertThat(registry.webSocketMessageTypes()).containsExactly("chat", "typing");
            assertThat(runtime.getStatic("deco.DecoratorsInit", "GENERATED_METADATA"))
                    .isEqualTo(Map.of("routes_count", 3, "generated_at", "2024-01-01T00:00:00Z",
                            "package_name", "deco"));
        }
    }
}
