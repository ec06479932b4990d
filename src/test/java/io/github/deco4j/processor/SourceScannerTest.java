package io.github.deco4j.processor;

import io.github.deco4j.util.SourceTree;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Source Scanner")
class SourceScannerTest {

    private static final Set<String> NAMES = MarkerRegistry.withBuiltins().names();

    private final SourceScanner scanner = new SourceScanner();

    @TempDir
    Path root;

    @Nested
    @DisplayName("Scanning")
    class Scanning {

        @Test
        @DisplayName("Files are grouped by package and visited in sorted order")
        void groupedByPackage() throws Exception {
            SourceTree.at(root)
                    .file("b/Second.java", "package b; class Second {}")
                    .file("a/Zeta.java", "package a; class Zeta {}")
                    .file("a/Alpha.java", "package a; class Alpha {}")
                    .file("Loose.java", "class Loose {}")
                    .file("a/notes.txt", "not java");

            Map<String, List<SourceFile>> packages = scanner.scan(root);

            assertThat(packages).containsOnlyKeys("", "a", "b");
            assertThat(packages.get("a")).extracting(SourceFile::fileName).containsExactly("Alpha.java", "Zeta.java");
        }

        @Test
        @DisplayName("Dot-directories such as .deco are skipped")
        void hiddenDirectories() throws Exception {
            SourceTree.at(root)
                    .file("app/Api.java", "package app; class Api {}")
                    .file(".deco/deco/DecoratorsInit.java", "this is not { valid java")
                    .file("app/.cache/Broken.java", "neither is this");

            assertThat(scanner.scan(root)).containsOnlyKeys("app");
        }

        @Test
        @DisplayName("Unparsable file aborts the scan with PARSE_FAILED")
        void parseFailure() {
            SourceTree.at(root)
                    .file("app/Good.java", "package app; class Good {}")
                    .file("app/Bad.java", "package app; class Bad { void m( }");

            assertThatThrownBy(() -> scanner.scan(root))
                    .isInstanceOf(GenerationException.class)
                    .hasMessageContaining("Bad.java")
                    .extracting(e -> ((GenerationException) e).getReason())
                    .isEqualTo(GenerationException.Reason.PARSE_FAILED);
        }

        @Test
        @DisplayName("Missing source directory fails with SCAN_FAILED")
        void missingDirectory() {
            assertThatThrownBy(() -> scanner.scan(root.resolve("missing")))
                    .isInstanceOf(GenerationException.class)
                    .extracting(e -> ((GenerationException) e).getReason())
                    .isEqualTo(GenerationException.Reason.SCAN_FAILED);
        }
    }

    @Nested
    @DisplayName("Declarations")
    class Declarations {

        private List<DocumentedDeclaration> declarations(String source) throws Exception {
            SourceTree.at(root).file("app/UserApi.java", source);
            SourceFile file = scanner.parse(root.resolve("app/UserApi.java"));
            return scanner.declarations(file, NAMES);
        }

        @Test
        @DisplayName("Javadoc gutter is stripped and lines map to source lines")
        void javadoc() throws Exception {
            List<DocumentedDeclaration> found = declarations("""
                    package app;

                    public class UserApi {
                        /**
                         * Lists users.
                         * @Route("GET", "/users")
                         */
                        public static void list(Object ctx) {
                        }
                    }
                    """);

            assertThat(found).singleElement().satisfies(d -> {
                assertThat(d.kind()).isEqualTo(DocumentedDeclaration.Kind.FUNCTION);
                assertThat(d.name()).isEqualTo("list");
                assertThat(d.typeName()).isEqualTo("UserApi");
                assertThat(d.packageName()).isEqualTo("app");
                assertThat(d.line()).isEqualTo(8);
                assertThat(d.comment().lines()).contains("Lists users.", "@Route(\"GET\", \"/users\")");
                int routeLine = d.comment().firstLine() + d.comment().lines().indexOf("@Route(\"GET\", \"/users\")");
                assertThat(routeLine).isEqualTo(6);
            });
        }

        @Test
        @DisplayName("A run of line comments is read as one block")
        void lineComments() throws Exception {
            List<DocumentedDeclaration> found = declarations("""
                    package app;

                    public class UserApi {
                        // @Route(GET, /users)
                        // @Auth(role=admin)
                        public static void list(Object ctx) {
                        }
                    }
                    """);

            assertThat(found).singleElement().satisfies(d -> {
                assertThat(d.comment().lines()).containsExactly("@Route(GET, /users)", "@Auth(role=admin)");
                assertThat(d.comment().firstLine()).isEqualTo(4);
            });
        }

        @Test
        @DisplayName("Comments without a marker name are skipped")
        void precheck() throws Exception {
            List<DocumentedDeclaration> found = declarations("""
                    package app;

                    public class UserApi {
                        /** Plain helper, see {@link Object}. */
                        static void helper() {
                        }

                        static void undocumented() {
                        }
                    }
                    """);

            assertThat(found).isEmpty();
        }

        @Test
        @DisplayName("Nested types are named Outer.Inner; anonymous class methods are ignored")
        void nestedTypes() throws Exception {
            List<DocumentedDeclaration> found = declarations("""
                    package app;

                    public class UserApi {
                        public static class Admin {
                            /** @Route(DELETE, /users/{id}) */
                            public static void delete(Object ctx) {
                            }
                        }

                        static Runnable task = new Runnable() {
                            /** @Route(GET, /anon) */
                            public void run() {
                            }
                        };
                    }
                    """);

            assertThat(found).singleElement().satisfies(d -> {
                assertThat(d.name()).isEqualTo("delete");
                assertThat(d.typeName()).isEqualTo("UserApi.Admin");
            });
        }

        @Test
        @DisplayName("Documented types are reported as data structures")
        void types() throws Exception {
            List<DocumentedDeclaration> found = declarations("""
                    package app;

                    /** @Schema("A user") */
                    public record UserApi(String name) {
                    }
                    """);

            assertThat(found).singleElement().satisfies(d -> {
                assertThat(d.kind()).isEqualTo(DocumentedDeclaration.Kind.TYPE);
                assertThat(d.typeName()).isEqualTo("UserApi");
            });
        }
    }
}
