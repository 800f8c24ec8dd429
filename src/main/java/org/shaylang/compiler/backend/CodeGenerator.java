package org.shaylang.compiler.backend;

import org.shaylang.compiler.api.CompilerErrorCode;
import org.shaylang.compiler.api.SourcePosition;
import org.shaylang.compiler.diagnostics.CompilerLogger;
import org.shaylang.compiler.diagnostics.DiagnosticsEngine;
import org.shaylang.compiler.frontend.parser.ast.ProgramNode;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;

/**
 * Runs the backend selected for one output format and reports the outcome as error state.
 * <p>
 * The translation is rendered into memory first and copied to the sink only if it succeeded,
 * so a failed generation leaves the sink untouched.
 */
public class CodeGenerator {

    private final OutputFormat format;
    private final ICodeGenerator backend;
    private final DiagnosticsEngine diagnostics;
    private boolean hadError = false;
    private String errorMessage = "";
    private int linesGenerated = 0;

    /**
     * @param format The output format to produce.
     * @param registry The registry to resolve the backend from.
     * @param diagnostics The engine for reporting errors.
     */
    public CodeGenerator(OutputFormat format, BackendRegistry registry, DiagnosticsEngine diagnostics) {
        this.format = format;
        this.backend = registry.resolve(format);
        this.diagnostics = diagnostics;
    }

    /**
     * Translates a program and writes it to the sink.
     *
     * @param program The program to translate.
     * @param sink The destination for the generated code.
     * @return {@code true} on success, {@code false} if an error was recorded.
     */
    public boolean generate(ProgramNode program, Writer sink) {
        StringWriter buffer = new StringWriter();
        try {
            backend.generate(program, buffer);
        } catch (GenerationException ex) {
            fail(ex.getCode(), ex.getMessage(), ex.getPosition(), program);
            return false;
        } catch (IOException ex) {
            fail(CompilerErrorCode.IO_ERROR, "Failed to render " + format.displayName() + " output: " + ex.getMessage(), null, program);
            return false;
        }

        String output = buffer.toString();
        try {
            sink.write(output);
            sink.flush();
        } catch (IOException ex) {
            fail(CompilerErrorCode.IO_ERROR, "Failed to write generated code: " + ex.getMessage(), null, program);
            return false;
        }

        linesGenerated = countLines(output);
        CompilerLogger.debug("CodeGenerator: " + linesGenerated + " lines of " + format.displayName() + " generated");
        return true;
    }

    private void fail(CompilerErrorCode code, String message, SourcePosition position, ProgramNode program) {
        hadError = true;
        errorMessage = message;
        if (position != null) {
            diagnostics.reportError(code, message, position);
        } else {
            diagnostics.reportError(code, message, program.position().fileName());
        }
    }

    private static int countLines(String output) {
        int lines = 0;
        for (int i = 0; i < output.length(); i++) {
            if (output.charAt(i) == '\n') lines++;
        }
        return lines;
    }

    /**
     * @return {@code true} if generation failed.
     */
    public boolean hasError() {
        return hadError;
    }

    /**
     * @return The message of the failure, or an empty string.
     */
    public String getErrorMessage() {
        return errorMessage;
    }

    /**
     * @return The number of lines written by the last successful generation.
     */
    public int linesGenerated() {
        return linesGenerated;
    }

    /**
     * @return The format this generator produces.
     */
    public OutputFormat getFormat() {
        return format;
    }
}
