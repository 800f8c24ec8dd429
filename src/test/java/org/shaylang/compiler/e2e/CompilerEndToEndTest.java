package org.shaylang.compiler.e2e;

import org.shaylang.compiler.Compiler;
import org.shaylang.compiler.api.CompilationException;
import org.shaylang.compiler.api.CompilationResult;
import org.shaylang.compiler.api.CompilationStatistics;
import org.shaylang.compiler.api.CompilerErrorCode;
import org.shaylang.compiler.backend.OutputFormat;
import org.shaylang.compiler.config.CompilerOptions;
import org.shaylang.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Runs complete source programs through the {@link Compiler} pipeline.
 */
@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class CompilerEndToEndTest {

    private static final String PROGRAM = String.join("\n",
            "// computes 42 * 52",
            "int x = 42;",
            "int y = x + 10;",
            "int result = x * y;",
            "return result;",
            "");

    /**
     * Verifies the exact C translation unit and the collected statistics for a small program.
     */
    @Test
    void compilesProgramToC() throws CompilationException {
        // Arrange
        Compiler compiler = new Compiler();

        // Act
        CompilationResult result = compiler.compile(PROGRAM, "product.shay");

        // Assert
        assertThat(result.generatedSource()).isEqualTo(String.join("\n",
                "#include <stdio.h>",
                "#include <stdlib.h>",
                "#include <stdbool.h>",
                "#include <string.h>",
                "",
                "int main(void) {",
                "    int x = 42;",
                "    int y = (x + 10);",
                "    int result = (x * y);",
                "    return result;",
                "}",
                ""));

        CompilationStatistics statistics = result.statistics();
        assertThat(statistics.nodesCreated()).isEqualTo(12);
        assertThat(statistics.linesGenerated()).isEqualTo(11);
        assertThat(statistics.tokensProduced()).isGreaterThanOrEqualTo(20);
        assertThat(statistics.arenaBytesUsed()).isGreaterThanOrEqualTo(12L * 48);
        assertThat(result.program().isValid()).isTrue();
        assertThat(result.program().size()).isEqualTo(4);
        assertThat(compiler.getDiagnostics().hasErrors()).isFalse();
    }

    @Test
    void honoursCodegenOptions() throws CompilationException {
        Compiler compiler = new Compiler(new CompilerOptions(4096, 4, 2, false));

        String output = compiler.compile("float ratio = 0.5;\nreturn 1;", "opts.shay").generatedSource();

        assertThat(output).endsWith("int main(void) {\n  double ratio = 0.5;\n  return 1;\n  return 0;\n}\n");
    }

    @Test
    void reportsSyntaxErrorsWithCodesAndPositions() {
        Compiler compiler = new Compiler();

        CompilationException ex = catchThrowableOfType(
                () -> compiler.compile("int ok = 1;\n42 = ok;\n", "bad.shay"), CompilationException.class);

        assertThat(ex).isNotNull();
        assertThat(ex.hasCode(CompilerErrorCode.INVALID_ASSIGNMENT_TARGET)).isTrue();
        assertThat(ex.getDiagnostics()).singleElement()
                .satisfies(d -> {
                    assertThat(d.fileName()).isEqualTo("bad.shay");
                    assertThat(d.lineNumber()).isEqualTo(2);
                });
        assertThat(ex.getMessage()).contains("Invalid assignment target");
    }

    @Test
    void reportsLexicalErrors() {
        assertThatThrownBy(() -> new Compiler().compile("int x = @;", "lex.shay"))
                .isInstanceOfSatisfying(CompilationException.class, ex -> {
                    assertThat(ex.hasCode(CompilerErrorCode.UNEXPECTED_CHARACTER)).isTrue();
                    assertThat(ex.hasCode(CompilerErrorCode.LEXICAL_ERROR)).isTrue();
                });
    }

    @Test
    void rejectsUnimplementedFormat() {
        assertThatThrownBy(() -> new Compiler().compile("int x = 1;", "js.shay", OutputFormat.JAVASCRIPT))
                .isInstanceOfSatisfying(CompilationException.class,
                        ex -> assertThat(ex.hasCode(CompilerErrorCode.FORMAT_NOT_IMPLEMENTED)).isTrue())
                .hasMessageContaining("JavaScript output not implemented");
    }

    @Test
    void reportsEscapesThatHaveNoCForm() {
        assertThatThrownBy(() -> new Compiler().compile("string s = \"\\u12\";", "escape.shay"))
                .isInstanceOfSatisfying(CompilationException.class,
                        ex -> assertThat(ex.hasCode(CompilerErrorCode.INVALID_ESCAPE_SEQUENCE)).isTrue())
                .hasMessageContaining("escape.shay:1:12");
    }

    @Test
    void failsWhenArenaIsExhausted() {
        Compiler compiler = new Compiler(new CompilerOptions(64, 1, 4, true));

        assertThatThrownBy(() -> compiler.compile("int a = 1;\nint b = 2;\n", "big.shay"))
                .isInstanceOfSatisfying(CompilationException.class,
                        ex -> assertThat(ex.hasCode(CompilerErrorCode.ARENA_EXHAUSTED)).isTrue());
    }

    /**
     * Verifies that a compiler instance starts every compilation with fresh diagnostics.
     */
    @Test
    void compilerIsReusableAfterFailure() throws CompilationException {
        // Arrange
        Compiler compiler = new Compiler();
        assertThatThrownBy(() -> compiler.compile("int = ;", "first.shay")).isInstanceOf(CompilationException.class);

        // Act
        CompilationResult result = compiler.compile("int z = -1;", "second.shay");

        // Assert
        assertThat(result.generatedSource()).contains("    int z = (-1);\n    return 0;\n");
        assertThat(compiler.getDiagnostics().hasErrors()).isFalse();
    }

    @Test
    void compilesSourceFile(@TempDir Path dir) throws IOException, CompilationException {
        Path file = dir.resolve("file.shay");
        Files.writeString(file, "char c = 'z';\n", StandardCharsets.UTF_8);

        CompilationResult result = new Compiler().compile(file);

        assertThat(result.generatedSource()).contains("    char c = 'z';\n");
        assertThat(result.program().position().fileName()).isEqualTo(file.toString());
    }
}
