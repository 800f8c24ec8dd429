package org.shaylang.compiler.backend.c;

import org.shaylang.compiler.api.CompilerErrorCode;
import org.shaylang.compiler.api.SourcePosition;
import org.shaylang.compiler.backend.GenerationException;
import org.shaylang.compiler.diagnostics.DiagnosticsEngine;
import org.shaylang.compiler.frontend.lexer.Lexer;
import org.shaylang.compiler.frontend.lexer.TokenType;
import org.shaylang.compiler.frontend.parser.Parser;
import org.shaylang.compiler.frontend.parser.ast.AstNode;
import org.shaylang.compiler.frontend.parser.ast.BinaryNode;
import org.shaylang.compiler.frontend.parser.ast.BlockNode;
import org.shaylang.compiler.frontend.parser.ast.CallNode;
import org.shaylang.compiler.frontend.parser.ast.ExpressionStatementNode;
import org.shaylang.compiler.frontend.parser.ast.IdentifierNode;
import org.shaylang.compiler.frontend.parser.ast.IfNode;
import org.shaylang.compiler.frontend.parser.ast.LiteralKind;
import org.shaylang.compiler.frontend.parser.ast.LiteralNode;
import org.shaylang.compiler.frontend.parser.ast.ProgramNode;
import org.shaylang.compiler.frontend.parser.ast.VarDeclarationNode;
import org.shaylang.compiler.memory.Arena;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the {@link CCodeGenerator}: the program frame, literal and operator
 * translation, the type table, and rejection of unsupported nodes.
 */
@Tag("unit")
class CCodeGeneratorTest {

    private static final SourcePosition POS = new SourcePosition(1, 1, "test.shay");
    private static final String PREAMBLE = String.join("\n",
            "#include <stdio.h>",
            "#include <stdlib.h>",
            "#include <stdbool.h>",
            "#include <string.h>",
            "",
            "int main(void) {",
            "");

    private static String generate(CCodeGenerator generator, ProgramNode program) throws IOException {
        StringWriter out = new StringWriter();
        generator.generate(program, out);
        return out.toString();
    }

    private static String generate(String source) throws IOException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Parser parser = new Parser(new Lexer(source, diagnostics), diagnostics);
        ProgramNode program = parser.parse();
        assertThat(diagnostics.hasErrors()).as(diagnostics.summary()).isFalse();
        return generate(new CCodeGenerator(), program);
    }

    /** Returns the body lines between the preamble and the closing brace. */
    private static String body(String output) {
        assertThat(output).startsWith(PREAMBLE).endsWith("}\n");
        return output.substring(PREAMBLE.length(), output.length() - 2);
    }

    private static ProgramNode program(AstNode... statements) {
        return new ProgramNode(List.of(statements), new Arena(), POS);
    }

    /**
     * Verifies the exact translation of a program whose last statement returns.
     */
    @Test
    void generatesCompleteTranslationUnit() throws IOException {
        // Arrange
        String source = String.join("\n",
                "int x = 42;",
                "int y = x + 10;",
                "int result = x * y;",
                "return result;");

        // Act
        String output = generate(source);

        // Assert
        assertThat(output).isEqualTo(PREAMBLE
                + "    int x = 42;\n"
                + "    int y = (x + 10);\n"
                + "    int result = (x * y);\n"
                + "    return result;\n"
                + "}\n");
    }

    @Test
    void appendsReturnZeroWhenProgramDoesNotReturn() throws IOException {
        assertThat(body(generate("int x = 1;"))).isEqualTo("    int x = 1;\n    return 0;\n");
        assertThat(body(generate(""))).isEqualTo("    return 0;\n");
    }

    @Test
    void keepsRedundantReturnWhenSuppressionIsDisabled() throws IOException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        ProgramNode program = new Parser(new Lexer("return 1;", diagnostics), diagnostics).parse();

        String output = generate(new CCodeGenerator(2, false), program);

        assertThat(body(output)).isEqualTo("  return 1;\n  return 0;\n");
    }

    /**
     * Verifies the C spelling of every literal kind.
     */
    @Test
    void translatesLiterals() throws IOException {
        // Act
        String output = generate(String.join("\n",
                "int big = 3000000000;",
                "int small = 2147483647;",
                "float f = 1.5e2;",
                "float inf = 1e999;",
                "string s = \"a\\n\\\"b\";",
                "char c = '\\t';",
                "bool t = true;",
                "bool u = false;",
                "string n = null;"));

        // Assert
        assertThat(body(output)).isEqualTo(
                "    int big = 3000000000LL;\n"
                + "    int small = 2147483647;\n"
                + "    double f = 150.0;\n"
                + "    double inf = (1.0 / 0.0);\n"
                + "    char* s = \"a\\n\\\"b\";\n"
                + "    char c = '\\t';\n"
                + "    bool t = true;\n"
                + "    bool u = false;\n"
                + "    char* n = NULL;\n"
                + "    return 0;\n");
    }

    /**
     * Verifies that literal text is re-encoded where C would read it differently or reject it.
     */
    @Test
    void reencodesLiteralTextForC() throws IOException {
        // Act
        String output = generate(String.join("\n",
                "string lines = \"a",
                "b\r\";",
                "string low = \"\\u0041B\";",
                "string high = \"\\u00e9\";",
                "string hex = \"\\x41F\";",
                "string nul = \"\\012\";",
                "char tab = '\\u0009';",
                "char at = '\\u0040';"));

        // Assert
        assertThat(body(output)).isEqualTo(
                "    char* lines = \"a\\nb\\r\";\n"
                + "    char* low = \"\\x41\"\"B\";\n"
                + "    char* high = \"\\u00e9\";\n"
                + "    char* hex = \"\\x41\"\"F\";\n"
                + "    char* nul = \"\\0\"\"12\";\n"
                + "    char tab = '\\x09';\n"
                + "    char at = '\\u0040';\n"
                + "    return 0;\n");
    }

    @Test
    void rejectsIncompleteUniversalCharacterEscape() {
        assertThatThrownBy(() -> generate("string s = \"\\u12\";"))
                .isInstanceOf(GenerationException.class)
                .hasMessage("Universal character escape needs four hex digits in string literal")
                .extracting(e -> ((GenerationException) e).getCode())
                .isEqualTo(CompilerErrorCode.INVALID_ESCAPE_SEQUENCE);
    }

    @Test
    void rejectsHexEscapeWithoutDigits() {
        assertThatThrownBy(() -> generate("string s = \"\\x\";"))
                .isInstanceOf(GenerationException.class)
                .hasMessage("Hex escape without digits in string literal");
        assertThatThrownBy(() -> generate("char c = '\\x';"))
                .isInstanceOf(GenerationException.class)
                .hasMessage("Hex escape without digits in character literal");
    }

    @Test
    void rejectsSurrogateEscape() {
        assertThatThrownBy(() -> generate("string s = \"\\uD800\";"))
                .isInstanceOf(GenerationException.class)
                .extracting(e -> ((GenerationException) e).getCode())
                .isEqualTo(CompilerErrorCode.INVALID_ESCAPE_SEQUENCE);
    }

    /**
     * Verifies that names C reserves are renamed consistently and without clashing with existing names.
     */
    @Test
    void renamesIdentifiersReservedInC() throws IOException {
        // Act
        String output = generate(String.join("\n",
                "int long = 1;",
                "int long_ = 2;",
                "long = long + long_;",
                "int NULL = unsigned;",
                "return long;"));

        // Assert
        assertThat(body(output)).isEqualTo(
                "    int long_ = 1;\n"
                + "    int long__ = 2;\n"
                + "    (long_ = (long_ + long__));\n"
                + "    int NULL_ = unsigned_;\n"
                + "    return long_;\n");
    }

    @Test
    void mapsDeclaredTypes() throws IOException {
        String output = generate("int a; float b; string c; bool d; char e; void f;");

        assertThat(body(output)).isEqualTo(
                "    int a;\n    double b;\n    char* c;\n    bool d;\n    char e;\n    int f;\n    return 0;\n");
    }

    /**
     * Verifies that every binary, unary and assignment expression is parenthesized.
     */
    @Test
    void parenthesizesExpressions() throws IOException {
        // Act
        String output = generate(String.join("\n",
                "x = x + 1 * 2;",
                "ok = !done && -n <= 0 || a != b;",
                "r = a % b == c / d;"));

        // Assert
        assertThat(body(output)).isEqualTo(
                "    (x = (x + (1 * 2)));\n"
                + "    (ok = (((!done) && ((-n) <= 0)) || (a != b)));\n"
                + "    (r = ((a % b) == (c / d)));\n"
                + "    return 0;\n");
    }

    @Test
    void emitsBareReturn() throws IOException {
        assertThat(body(generate("return;"))).isEqualTo("    return;\n");
    }

    @Test
    void rejectsUnsupportedStatement() {
        IfNode ifNode = new IfNode(new LiteralNode(LiteralKind.BOOLEAN, true, POS),
                new BlockNode(List.of(), POS), null, new SourcePosition(3, 5, "test.shay"));

        assertThatThrownBy(() -> generate(new CCodeGenerator(), program(ifNode)))
                .isInstanceOf(GenerationException.class)
                .hasMessage("IfNode is not supported as a C statement")
                .satisfies(e -> {
                    GenerationException ex = (GenerationException) e;
                    assertThat(ex.getCode()).isEqualTo(CompilerErrorCode.UNSUPPORTED_NODE);
                    assertThat(ex.getPosition().line()).isEqualTo(3);
                });
    }

    @Test
    void rejectsUnsupportedExpression() {
        CallNode call = new CallNode(new IdentifierNode("print", POS), List.of(), POS);

        assertThatThrownBy(() -> generate(new CCodeGenerator(), program(new ExpressionStatementNode(call, POS))))
                .isInstanceOf(GenerationException.class)
                .hasMessage("CallNode is not supported as a C expression");
    }

    @Test
    void rejectsOperatorWithoutTranslation() {
        BinaryNode power = new BinaryNode(new IdentifierNode("a", POS), TokenType.POWER, new IdentifierNode("b", POS), POS);

        assertThatThrownBy(() -> generate(new CCodeGenerator(), program(new VarDeclarationNode(TokenType.INT, "x", power, POS))))
                .isInstanceOf(GenerationException.class)
                .extracting(e -> ((GenerationException) e).getCode())
                .isEqualTo(CompilerErrorCode.UNSUPPORTED_OPERATOR);
    }

    /**
     * Verifies that a program whose arena has been released is refused before anything is written.
     */
    @Test
    void rejectsReleasedProgram() {
        // Arrange
        ProgramNode program = program(new VarDeclarationNode(TokenType.INT, "x", null, POS));
        program.arena().release();
        StringWriter out = new StringWriter();

        // Act & Assert
        assertThatThrownBy(() -> new CCodeGenerator().generate(program, out))
                .isInstanceOf(GenerationException.class)
                .extracting(e -> ((GenerationException) e).getCode())
                .isEqualTo(CompilerErrorCode.AST_RELEASED);
        assertThat(out.toString()).isEmpty();
    }
}
