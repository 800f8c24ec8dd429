package org.shaylang.compiler;

import org.shaylang.compiler.api.CompilationException;
import org.shaylang.compiler.api.CompilationResult;
import org.shaylang.compiler.api.CompilationStatistics;
import org.shaylang.compiler.api.ICompiler;
import org.shaylang.compiler.backend.BackendRegistry;
import org.shaylang.compiler.backend.CodeGenerator;
import org.shaylang.compiler.backend.OutputFormat;
import org.shaylang.compiler.config.CompilerOptions;
import org.shaylang.compiler.diagnostics.CompilerLogger;
import org.shaylang.compiler.diagnostics.DiagnosticsEngine;
import org.shaylang.compiler.frontend.lexer.Lexer;
import org.shaylang.compiler.frontend.parser.Parser;
import org.shaylang.compiler.frontend.parser.ast.ProgramNode;
import org.shaylang.compiler.util.AstPrinter;

import java.io.StringWriter;

/**
 * The main compiler implementation. This class orchestrates the pipeline from source text
 * to generated code: lexing and parsing, then code generation for the selected format.
 * Each phase reports into one {@link DiagnosticsEngine}; the pipeline stops at the first
 * phase that recorded an error. It is not thread-safe.
 * <p>
 * On success the returned {@link ProgramNode} keeps its arena alive. On failure the arena
 * is released before the exception is thrown.
 */
public class Compiler implements ICompiler {

    private final CompilerOptions options;
    private final BackendRegistry backends;
    private DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private int verbosity = -1;

    /**
     * Creates a compiler with the default options.
     */
    public Compiler() {
        this(CompilerOptions.defaults());
    }

    /**
     * @param options The options for the arena and the backends.
     */
    public Compiler(CompilerOptions options) {
        this(options, BackendRegistry.initializeWithDefaults(options));
    }

    /**
     * @param options The options for the arena.
     * @param backends The backends to generate code with.
     */
    public Compiler(CompilerOptions options, BackendRegistry backends) {
        this.options = options;
        this.backends = backends;
    }

    @Override
    public CompilationResult compile(String source, String fileName) throws CompilationException {
        return compile(source, fileName, OutputFormat.C);
    }

    @Override
    public CompilationResult compile(String source, String fileName, OutputFormat format) throws CompilationException {
        if (verbosity >= 0) {
            CompilerLogger.setLevel(verbosity);
        }
        diagnostics = new DiagnosticsEngine();

        // Phase 1: Lexing and parsing. The parser pulls tokens on demand.
        long parseStart = System.nanoTime();
        Lexer lexer = new Lexer(source, diagnostics, fileName);
        Parser parser = new Parser(lexer, diagnostics, options.newArena());
        ProgramNode program = parser.parse();
        long parseNanos = System.nanoTime() - parseStart;

        if (lexer.hasError() || parser.hasError() || diagnostics.hasErrors()) {
            parser.close();
            throw new CompilationException(diagnostics.summary(), diagnostics.getDiagnostics());
        }
        if (CompilerLogger.getLevel() >= CompilerLogger.DEBUG) {
            CompilerLogger.debug("AST of " + fileName + ":\n" + AstPrinter.print(program));
        }

        // Phase 2: Code generation.
        long generationStart = System.nanoTime();
        CodeGenerator generator = new CodeGenerator(format, backends, diagnostics);
        StringWriter output = new StringWriter();
        if (!generator.generate(program, output)) {
            parser.close();
            throw new CompilationException(diagnostics.summary(), diagnostics.getDiagnostics());
        }
        long generationNanos = System.nanoTime() - generationStart;

        CompilationStatistics statistics = new CompilationStatistics(
                lexer.tokensProduced(),
                parser.nodesCreated(),
                parser.arena().bytesUsed(),
                generator.linesGenerated(),
                parseNanos,
                generationNanos);
        CompilerLogger.debug("Compiled " + fileName + ": " + statistics);
        return new CompilationResult(output.toString(), program, statistics);
    }

    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }

    /**
     * @return The diagnostics of the most recent compilation.
     */
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }
}
