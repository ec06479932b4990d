package io.github.deco4j.processor;

import javax.lang.model.SourceVersion;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings for one generation run.
 *
 * <p>Use {@link #builder()} for programmatic setup or {@link #fromProperties(Properties)}
 * to map {@code deco.*} keys. Unset values take the defaults listed on the builder.
 *
 * @param sourceDirectory root of the annotated sources
 * @param outputDirectory root of the generated sources
 * @param packageName     package of the generated class, may be empty
 * @param className       simple name of the generated class
 * @param entryPoint      name of the generated initialization method
 * @param minify          whether to minify the generated source
 * @param validate        whether to re-parse and check the generated file
 * @param verbose         whether to log every route at INFO
 * @param clock           clock for the generation timestamp
 */
public record GeneratorConfig(Path sourceDirectory,
                              Path outputDirectory,
                              String packageName,
                              String className,
                              String entryPoint,
                              boolean minify,
                              boolean validate,
                              boolean verbose,
                              Clock clock) {

    public static final String DEFAULT_OUTPUT_DIRECTORY = ".deco";
    public static final String DEFAULT_PACKAGE = "deco";
    public static final String DEFAULT_CLASS_NAME = "DecoratorsInit";
    public static final String DEFAULT_ENTRY_POINT = "init";

    public GeneratorConfig {
        Objects.requireNonNull(sourceDirectory, "sourceDirectory");
        Objects.requireNonNull(outputDirectory, "outputDirectory");
        Objects.requireNonNull(packageName, "packageName");
        Objects.requireNonNull(clock, "clock");
        if (!packageName.isEmpty() && !SourceVersion.isName(packageName)) {
            throw new IllegalArgumentException("Invalid package name: '" + packageName + "'");
        }
        if (!isIdentifier(className)) {
            throw new IllegalArgumentException("Invalid class name: '" + className + "'");
        }
        if (!isIdentifier(entryPoint)) {
            throw new IllegalArgumentException("Invalid entry point name: '" + entryPoint + "'");
        }
    }

    private static boolean isIdentifier(String name) {
        return name != null && SourceVersion.isIdentifier(name) && !SourceVersion.isKeyword(name);
    }

    /**
     * Returns the path of the generated source file.
     */
    public Path outputFile() {
        Path dir = outputDirectory;
        if (!packageName.isEmpty()) {
            dir = dir.resolve(packageName.replace('.', '/'));
        }
        return dir.resolve(className + ".java");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a configuration from {@code deco.*} properties.
     *
     * <p>Recognized keys: {@code deco.source}, {@code deco.output}, {@code deco.package},
     * {@code deco.class}, {@code deco.entryPoint}, {@code deco.minify}, {@code deco.validate},
     * {@code deco.verbose}. Missing keys keep the builder defaults.
     */
    public static GeneratorConfig fromProperties(Properties properties) {
        Builder builder = builder();
        String source = properties.getProperty("deco.source");
        if (source != null) {
            builder.sourceDirectory(Path.of(source));
        }
        String output = properties.getProperty("deco.output");
        if (output != null) {
            builder.outputDirectory(Path.of(output));
        }
        builder.packageName(properties.getProperty("deco.package", DEFAULT_PACKAGE).strip());
        builder.className(properties.getProperty("deco.class", DEFAULT_CLASS_NAME).strip());
        builder.entryPoint(properties.getProperty("deco.entryPoint", DEFAULT_ENTRY_POINT).strip());
        builder.minify(Boolean.parseBoolean(properties.getProperty("deco.minify", "false").strip()));
        builder.validate(Boolean.parseBoolean(properties.getProperty("deco.validate", "true").strip()));
        builder.verbose(Boolean.parseBoolean(properties.getProperty("deco.verbose", "false").strip()));
        return builder.build();
    }

    /**
     * Builder for {@link GeneratorConfig}.
     *
     * <p>Defaults: source {@code .}, output {@code .deco}, package {@code deco}, class
     * {@code DecoratorsInit}, entry point {@code init}, not minified, validated, not verbose,
     * system UTC clock.
     */
    public static final class Builder {
        private Path sourceDirectory = Path.of(".");
        private Path outputDirectory = Path.of(DEFAULT_OUTPUT_DIRECTORY);
        private String packageName = DEFAULT_PACKAGE;
        private String className = DEFAULT_CLASS_NAME;
        private String entryPoint = DEFAULT_ENTRY_POINT;
        private boolean minify;
        private boolean validate = true;
        private boolean verbose;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        public Builder sourceDirectory(Path sourceDirectory) {
            this.sourceDirectory = sourceDirectory;
            return this;
        }

        public Builder outputDirectory(Path outputDirectory) {
            this.outputDirectory = outputDirectory;
            return this;
        }

        public Builder packageName(String packageName) {
            this.packageName = packageName;
            return this;
        }

        public Builder className(String className) {
            this.className = className;
            return this;
        }

        public Builder entryPoint(String entryPoint) {
            this.entryPoint = entryPoint;
            return this;
        }

        public Builder minify(boolean minify) {
            this.minify = minify;
            return this;
        }

        public Builder validate(boolean validate) {
            this.validate = validate;
            return this;
        }

        public Builder verbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public GeneratorConfig build() {
            return new GeneratorConfig(sourceDirectory, outputDirectory, packageName, className, entryPoint,
                    minify, validate, verbose, clock);
        }
    }
}
