package org.shaylang.compiler.backend;

import org.shaylang.compiler.backend.c.CCodeGenerator;
import org.shaylang.compiler.config.CompilerOptions;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping output formats to the code generators that produce them.
 * <p>
 * Use {@link #initializeWithDefaults(CompilerOptions)} for the standard set, or
 * {@link #initialize()} and {@link #register(OutputFormat, ICodeGenerator)} to install
 * custom backends.
 */
public final class BackendRegistry {

    private final Map<OutputFormat, ICodeGenerator> byFormat = new EnumMap<>(OutputFormat.class);

    private BackendRegistry() {
    }

    /**
     * Registers a generator for the given format, replacing any previous one.
     *
     * @param format The output format.
     * @param generator The generator producing that format.
     */
    public void register(OutputFormat format, ICodeGenerator generator) {
        byFormat.put(format, generator);
    }

    /**
     * @param format The output format to look up.
     * @return The registered generator, if any.
     */
    public Optional<ICodeGenerator> get(OutputFormat format) {
        return Optional.ofNullable(byFormat.get(format));
    }

    /**
     * Resolves the generator for a format. Formats without a registration resolve to an
     * {@link UnimplementedCodeGenerator}.
     *
     * @param format The output format.
     * @return A non-null generator.
     */
    public ICodeGenerator resolve(OutputFormat format) {
        return get(format).orElseGet(() -> new UnimplementedCodeGenerator(format));
    }

    /**
     * @return An empty registry.
     */
    public static BackendRegistry initialize() {
        return new BackendRegistry();
    }

    /**
     * Creates a registry with the C backend configured from {@code options} and placeholders
     * for every other format.
     *
     * @param options The compiler options.
     * @return A registry covering every {@link OutputFormat}.
     */
    public static BackendRegistry initializeWithDefaults(CompilerOptions options) {
        BackendRegistry registry = initialize();
        registry.register(OutputFormat.C,
                new CCodeGenerator(options.indentWidth(), options.suppressRedundantReturn()));
        registry.register(OutputFormat.JAVASCRIPT, new UnimplementedCodeGenerator(OutputFormat.JAVASCRIPT));
        registry.register(OutputFormat.PYTHON, new UnimplementedCodeGenerator(OutputFormat.PYTHON));
        registry.register(OutputFormat.BYTECODE, new UnimplementedCodeGenerator(OutputFormat.BYTECODE));
        return registry;
    }

    /**
     * @return A registry with the default backends and default options.
     */
    public static BackendRegistry initializeWithDefaults() {
        return initializeWithDefaults(CompilerOptions.defaults());
    }
}
