package io.github.deco4j.processor;

import com.github.javaparser.ast.CompilationUnit;

import java.nio.file.Path;

/**
 * A parsed source file.
 *
 * @param path        the file's path
 * @param packageName the declared package, empty for the default package
 * @param unit        the syntax tree
 */
record SourceFile(Path path, String packageName, CompilationUnit unit) {

    String fileName() {
        return path.getFileName().toString();
    }
}
