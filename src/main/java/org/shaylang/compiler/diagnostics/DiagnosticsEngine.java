package org.shaylang.compiler.diagnostics;

import org.shaylang.compiler.api.CompilerErrorCode;
import org.shaylang.compiler.api.SourcePosition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting and managing diagnostic messages (errors, warnings)
 * that occur during the compilation process.
 * <p>
 * This decouples error reporting from the actual compiler logic (lexer, parser, backend).
 * Each phase keeps its own sticky error state; the engine is the shared record all of
 * them report into.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param code     The error code.
     * @param message  The error message.
     * @param position Where the error occurred.
     */
    public void reportError(CompilerErrorCode code, String message, SourcePosition position) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, code, message,
                position.fileName(), position.line(), position.column()));
        CompilerLogger.debug("Diagnostic " + code + " at " + position + ": " + message);
    }

    /**
     * Reports an error that has no source position, e.g. a failure of the backend as a whole.
     *
     * @param code     The error code.
     * @param message  The error message.
     * @param fileName The file the failing compilation unit came from.
     */
    public void reportError(CompilerErrorCode code, String message, String fileName) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, code, message, fileName, 0, 0));
        CompilerLogger.debug("Diagnostic " + code + " in " + fileName + ": " + message);
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns the errors recorded with the given code.
     *
     * @param code The error code to filter by.
     * @return The matching diagnostics, in reporting order.
     */
    public List<Diagnostic> errorsWithCode(CompilerErrorCode code) {
        return diagnostics.stream()
                .filter(d -> d.type() == Diagnostic.Type.ERROR && d.code() == code)
                .collect(Collectors.toList());
    }

    /**
     * @return The number of errors reported so far.
     */
    public long errorCount() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).count();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
