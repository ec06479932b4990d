package io.github.deco4j.util;

import com.google.testing.compile.Compilation;

import javax.tools.JavaFileObject;
import javax.tools.StandardLocation;
import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.util.Optional;

import static com.google.testing.compile.Compiler.javac;

/**
 * Compiles generated sources together with their handlers and runs the result in-process.
 *
 * <p>Classes from the compilation are defined in a child loader of the test class loader,
 * so runtime types such as {@code RouteRegistry} are shared with the test and returned
 * objects can be cast directly.
 *
 * <p>Usage:
 * <pre>{@code
 * RuntimeTestHelper helper = RuntimeTestHelper.compile(generated, handlers);
 * RouteRegistry registry = (RouteRegistry) helper.invoke("deco.DecoratorsInit", "init");
 * }</pre>
 */
public final class RuntimeTestHelper {

    private final Compilation compilation;
    private final ClassLoader classLoader;

    private RuntimeTestHelper(Compilation compilation) {
        this.compilation = compilation;
        this.classLoader = new CompilationClassLoader(compilation);
    }

    /**
     * Compiles the given sources.
     *
     * @throws AssertionError if compilation fails
     */
    public static RuntimeTestHelper compile(JavaFileObject... sources) {
        Compilation compilation = javac().compile(sources);
        if (compilation.status() != Compilation.Status.SUCCESS) {
            throw new AssertionError("Compilation failed: " + compilation.diagnostics());
        }
        return new RuntimeTestHelper(compilation);
    }

    /**
     * Calls a static no-arg method, such as the generated entry point.
     *
     * @return the method's return value, {@code null} for void methods
     */
    public Object invoke(String className, String methodName) {
        try {
            Method method = loadClass(className).getDeclaredMethod(methodName);
            method.setAccessible(true);
            return method.invoke(null);
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Cannot call " + className + "." + methodName + "()", e);
        }
    }

    /**
     * Reads a static field, such as {@code GENERATED_METADATA}.
     */
    public Object getStatic(String className, String fieldName) {
        try {
            Field field = loadClass(className).getDeclaredField(fieldName);
            field.setAccessible(true);
            return field.get(null);
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Cannot read " + className + "." + fieldName, e);
        }
    }

    public Class<?> loadClass(String className) {
        try {
            return Class.forName(className, true, classLoader);
        } catch (ClassNotFoundException e) {
            throw new IllegalStateException("Class not found in compilation output: " + className, e);
        }
    }

    public Compilation getCompilation() {
        return compilation;
    }

    /**
     * Defines classes from the compilation's class output on demand.
     */
    private static final class CompilationClassLoader extends ClassLoader {

        private final Compilation compilation;

        CompilationClassLoader(Compilation compilation) {
            super(RuntimeTestHelper.class.getClassLoader());
            this.compilation = compilation;
        }

        @Override
        protected Class<?> findClass(String name) throws ClassNotFoundException {
            Optional<JavaFileObject> file = compilation.generatedFile(StandardLocation.CLASS_OUTPUT,
                    name.replace('.', '/') + ".class");
            if (file.isEmpty()) {
                throw new ClassNotFoundException(name);
            }
            try (InputStream in = file.get().openInputStream()) {
                byte[] bytes = in.readAllBytes();
                return defineClass(name, bytes, 0, bytes.length);
            } catch (IOException e) {
                throw new ClassNotFoundException("Cannot read class file of " + name, e);
            }
        }
    }
}
