package org.shaylang.compiler.api;

import org.shaylang.compiler.backend.OutputFormat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Defines the public interface of the ShayLang compiler.
 */
public interface ICompiler {

    /**
     * Compiles the given source buffer to the default output format.
     *
     * @param source The complete source text.
     * @param fileName A name for the source, used for diagnostics only.
     * @return The generated program together with its AST and statistics.
     * @throws CompilationException if any phase reports an error.
     */
    CompilationResult compile(String source, String fileName) throws CompilationException;

    /**
     * Compiles the given source buffer to the requested output format.
     *
     * @param source The complete source text.
     * @param fileName A name for the source, used for diagnostics only.
     * @param format The output format to generate.
     * @return The generated program together with its AST and statistics.
     * @throws CompilationException if any phase reports an error.
     */
    CompilationResult compile(String source, String fileName, OutputFormat format) throws CompilationException;

    /**
     * Sets the verbosity level for log output.
     * @param level The verbosity level (0=error only ... 4=trace).
     */
    void setVerbosity(int level);

    /**
     * Compiles the source code from a file.
     * @param sourcePath The path to the source file.
     * @return The compilation result.
     * @throws CompilationException if errors occur during compilation.
     * @throws IOException if the file cannot be read.
     */
    default CompilationResult compile(Path sourcePath) throws CompilationException, IOException {
        return compile(Files.readString(sourcePath, StandardCharsets.UTF_8), sourcePath.toString());
    }
}
