package org.shaylang.compiler.backend.c;

import org.shaylang.compiler.api.CompilerErrorCode;
import org.shaylang.compiler.backend.GenerationException;
import org.shaylang.compiler.backend.ICodeGenerator;
import org.shaylang.compiler.diagnostics.CompilerLogger;
import org.shaylang.compiler.frontend.parser.ast.AssignmentNode;
import org.shaylang.compiler.frontend.parser.ast.AstNode;
import org.shaylang.compiler.frontend.parser.ast.BinaryNode;
import org.shaylang.compiler.frontend.parser.ast.ExpressionStatementNode;
import org.shaylang.compiler.frontend.parser.ast.IdentifierNode;
import org.shaylang.compiler.frontend.parser.ast.LiteralNode;
import org.shaylang.compiler.frontend.parser.ast.ProgramNode;
import org.shaylang.compiler.frontend.parser.ast.ReturnNode;
import org.shaylang.compiler.frontend.parser.ast.UnaryNode;
import org.shaylang.compiler.frontend.parser.ast.VarDeclarationNode;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Translates a program into a single C translation unit.
 * <p>
 * All top-level statements become the body of {@code main}. Every binary, assignment and unary
 * expression is fully parenthesized, so the C output never depends on C's own precedence rules.
 * Names that C reserves are renamed, and literal text is re-encoded for C.
 */
public final class CCodeGenerator implements ICodeGenerator {

    private static final List<String> PREAMBLE = List.of(
            "#include <stdio.h>",
            "#include <stdlib.h>",
            "#include <stdbool.h>",
            "#include <string.h>",
            "",
            "int main(void) {");

    private final String indent;
    private final boolean suppressRedundantReturn;
    private final ExpressionEmitter expressions = new ExpressionEmitter();
    private final StatementEmitter statements = new StatementEmitter();

    /**
     * Creates a generator with four-space indentation that omits a redundant trailing return.
     */
    public CCodeGenerator() {
        this(4, true);
    }

    /**
     * @param indentWidth The number of spaces per indentation level.
     * @param suppressRedundantReturn If {@code true}, {@code return 0;} is not appended when the
     *                                last statement already returns.
     */
    public CCodeGenerator(int indentWidth, boolean suppressRedundantReturn) {
        if (indentWidth < 0) throw new IllegalArgumentException("indentWidth must not be negative: " + indentWidth);
        this.indent = " ".repeat(indentWidth);
        this.suppressRedundantReturn = suppressRedundantReturn;
    }

    @Override
    public void generate(ProgramNode program, Writer out) throws IOException {
        if (!program.isValid()) {
            throw new GenerationException(CompilerErrorCode.AST_RELEASED,
                    "The program's arena has been released", program.position());
        }

        for (String line : PREAMBLE) {
            writeLine(out, "", line);
        }
        List<AstNode> body = program.statements();
        for (AstNode statement : body) {
            writeLine(out, indent, statement.accept(statements));
        }
        boolean endsWithReturn = !body.isEmpty() && body.get(body.size() - 1) instanceof ReturnNode;
        if (!(suppressRedundantReturn && endsWithReturn)) {
            writeLine(out, indent, "return 0;");
        }
        writeLine(out, "", "}");
        CompilerLogger.trace("CCodeGenerator: translated " + body.size() + " statements");
    }

    private static void writeLine(Writer out, String prefix, String line) throws IOException {
        if (!line.isEmpty()) {
            out.write(prefix);
            out.write(line);
        }
        out.write('\n');
    }

    /**
     * Emits one top-level statement as a single line of C, without indentation.
     */
    private final class StatementEmitter extends RejectingVisitor {

        StatementEmitter() {
            super("statement");
        }

        @Override
        public String visitVarDeclaration(VarDeclarationNode node) {
            StringBuilder sb = new StringBuilder();
            sb.append(CTranslationTables.type(node.declaredType())).append(' ')
                    .append(CTranslationTables.identifier(node.name()));
            if (node.hasInitializer()) {
                sb.append(" = ").append(node.initializer().accept(expressions));
            }
            return sb.append(';').toString();
        }

        @Override
        public String visitExpressionStatement(ExpressionStatementNode node) {
            return node.expression().accept(expressions) + ";";
        }

        @Override
        public String visitReturn(ReturnNode node) {
            if (!node.hasValue()) return "return;";
            return "return " + node.value().accept(expressions) + ";";
        }
    }

    /**
     * Emits an expression as C source text.
     */
    private static final class ExpressionEmitter extends RejectingVisitor {

        ExpressionEmitter() {
            super("expression");
        }

        @Override
        public String visitLiteral(LiteralNode node) {
            switch (node.kind()) {
                case INTEGER: {
                    long value = (Long) node.value();
                    boolean fitsInt = value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
                    return fitsInt ? Long.toString(value) : value + "LL";
                }
                case FLOAT: {
                    double value = (Double) node.value();
                    if (Double.isInfinite(value)) return value > 0 ? "(1.0 / 0.0)" : "(-1.0 / 0.0)";
                    return Double.toString(value);
                }
                case STRING:
                    return "\"" + CLiterals.string((String) node.value(), node.position()) + "\"";
                case CHAR:
                    return "'" + CLiterals.character((String) node.value(), node.position()) + "'";
                case BOOLEAN:
                    return ((Boolean) node.value()) ? "true" : "false";
                case NULL:
                    return "NULL";
                default:
                    throw unsupported(node);
            }
        }

        @Override
        public String visitIdentifier(IdentifierNode node) {
            return CTranslationTables.identifier(node.name());
        }

        @Override
        public String visitBinary(BinaryNode node) {
            String operator = CTranslationTables.binaryOperator(node.operator())
                    .orElseThrow(() -> unsupportedOperator(node, node.operator().name()));
            return "(" + node.left().accept(this) + " " + operator + " " + node.right().accept(this) + ")";
        }

        @Override
        public String visitUnary(UnaryNode node) {
            String operator = CTranslationTables.unaryOperator(node.operator())
                    .orElseThrow(() -> unsupportedOperator(node, node.operator().name()));
            return "(" + operator + node.operand().accept(this) + ")";
        }

        @Override
        public String visitAssignment(AssignmentNode node) {
            return "(" + node.target().accept(this) + " = " + node.value().accept(this) + ")";
        }

        private GenerationException unsupportedOperator(AstNode node, String operator) {
            return new GenerationException(CompilerErrorCode.UNSUPPORTED_OPERATOR,
                    "Operator " + operator + " has no C translation", node.position());
        }
    }
}
