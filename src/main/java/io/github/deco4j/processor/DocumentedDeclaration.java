package io.github.deco4j.processor;

import com.github.javaparser.ast.body.BodyDeclaration;

/**
 * A method or type declaration whose comment may carry markers.
 *
 * @param kind        whether this is a function or a data structure
 * @param name        method name, or the type's simple name
 * @param typeName    enclosing type (or the type itself), nested names joined with {@code .}
 * @param packageName declaring package, empty for the default package
 * @param fileName    source file name
 * @param line        declaration line
 * @param comment     the attached comment
 * @param node        the syntax node
 */
record DocumentedDeclaration(Kind kind,
                             String name,
                             String typeName,
                             String packageName,
                             String fileName,
                             int line,
                             CommentBlock comment,
                             BodyDeclaration<?> node) {

    enum Kind {
        FUNCTION,
        TYPE
    }
}
