package org.shaylang.cli.commands;

import com.typesafe.config.ConfigException;
import org.shaylang.cli.CommandLineInterface;
import org.shaylang.compiler.Compiler;
import org.shaylang.compiler.api.CompilationException;
import org.shaylang.compiler.api.CompilationResult;
import org.shaylang.compiler.api.CompilationStatistics;
import org.shaylang.compiler.backend.OutputFormat;
import org.shaylang.compiler.config.CompilerOptions;
import org.shaylang.compiler.util.AstPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "compile", description = "Compiles a ShayLang source file.")
public class CompileCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CompileCommand.class);

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the source file.")
    private File file;

    @Option(names = {"-o", "--output"}, description = "The output file (default: input name with the format's extension).")
    private File output;

    @Option(names = "--format", defaultValue = "C",
            description = "Output format, one of ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE}).")
    private OutputFormat format;

    @Option(names = "--dump-ast", description = "Print the parsed syntax tree.")
    private boolean dumpAst;

    @Option(names = "--stats", description = "Print compilation statistics.")
    private boolean stats;

    @CommandLine.ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        CompilerOptions options;
        try {
            options = CompilerOptions.fromConfig(parent.getConfig());
        } catch (ConfigException | IllegalArgumentException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return 1;
        }
        Compiler compiler = new Compiler(options);

        CompilationResult result;
        try {
            String source = Files.readString(file.toPath(), StandardCharsets.UTF_8);
            result = compiler.compile(source, file.getPath(), format);
        } catch (IOException e) {
            err.println("Cannot read " + file.getPath() + ": " + e.getMessage());
            return 1;
        } catch (CompilationException e) {
            err.println("Compilation failed:");
            err.println(e.getMessage());
            return 1;
        }

        if (dumpAst) {
            out.print(AstPrinter.print(result.program()));
        }

        Path target = output != null ? output.toPath() : defaultOutput(file.toPath(), format);
        try {
            Files.writeString(target, result.generatedSource(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Cannot write " + target + ": " + e.getMessage());
            return 1;
        }
        LOG.info("Compiled {} to {}", file.getPath(), target);
        out.println("Wrote " + target);

        if (stats) {
            printStatistics(out, result.statistics());
        }
        return 0;
    }

    private static void printStatistics(PrintWriter out, CompilationStatistics statistics) {
        out.printf("Tokens:      %d%n", statistics.tokensProduced());
        out.printf("AST nodes:   %d%n", statistics.nodesCreated());
        out.printf("Arena bytes: %d%n", statistics.arenaBytesUsed());
        out.printf("Lines:       %d%n", statistics.linesGenerated());
        out.printf("Parse:       %.3f ms%n", statistics.parseNanos() / 1_000_000.0);
        out.printf("Generation:  %.3f ms%n", statistics.generationNanos() / 1_000_000.0);
    }

    /**
     * Replaces the extension of {@code input} with the one of {@code format}, keeping the directory.
     */
    static Path defaultOutput(Path input, OutputFormat format) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return input.resolveSibling(base + format.fileExtension());
    }
}
