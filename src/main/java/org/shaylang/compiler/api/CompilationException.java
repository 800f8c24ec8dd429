package org.shaylang.compiler.api;

import org.shaylang.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * An exception that is thrown when one or more errors occur during the compilation process.
 * <p>
 * It is part of the public API and hides the internal exception types of the compiler.
 */
public class CompilationException extends Exception {

    private final List<Diagnostic> diagnostics;

    /**
     * Constructs a new compilation exception with the specified detail message.
     * @param message The detail message.
     */
    public CompilationException(String message) {
        this(message, List.of());
    }

    /**
     * Constructs a new compilation exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CompilationException(String message, Throwable cause) {
        super(message, cause);
        this.diagnostics = List.of();
    }

    /**
     * Constructs a new compilation exception carrying the diagnostics that caused it.
     * @param message The detail message, usually the diagnostics summary.
     * @param diagnostics The collected diagnostics.
     */
    public CompilationException(String message, List<Diagnostic> diagnostics) {
        super(message, null);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return The diagnostics collected before compilation stopped, possibly empty.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    /**
     * Checks whether a diagnostic with the given code was recorded.
     * @param code The error code to look for.
     * @return {@code true} if at least one diagnostic carries the code.
     */
    public boolean hasCode(CompilerErrorCode code) {
        return diagnostics.stream().anyMatch(d -> d.code() == code);
    }
}
