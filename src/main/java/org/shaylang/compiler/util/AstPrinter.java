package org.shaylang.compiler.util;

import org.shaylang.compiler.frontend.parser.ast.AssignmentNode;
import org.shaylang.compiler.frontend.parser.ast.AstNode;
import org.shaylang.compiler.frontend.parser.ast.AstVisitor;
import org.shaylang.compiler.frontend.parser.ast.BinaryNode;
import org.shaylang.compiler.frontend.parser.ast.BlockNode;
import org.shaylang.compiler.frontend.parser.ast.CallNode;
import org.shaylang.compiler.frontend.parser.ast.ClassDeclarationNode;
import org.shaylang.compiler.frontend.parser.ast.ExpressionStatementNode;
import org.shaylang.compiler.frontend.parser.ast.ForNode;
import org.shaylang.compiler.frontend.parser.ast.FunctionDeclarationNode;
import org.shaylang.compiler.frontend.parser.ast.IdentifierNode;
import org.shaylang.compiler.frontend.parser.ast.IfNode;
import org.shaylang.compiler.frontend.parser.ast.LiteralNode;
import org.shaylang.compiler.frontend.parser.ast.ProgramNode;
import org.shaylang.compiler.frontend.parser.ast.ReturnNode;
import org.shaylang.compiler.frontend.parser.ast.UnaryNode;
import org.shaylang.compiler.frontend.parser.ast.VarDeclarationNode;
import org.shaylang.compiler.frontend.parser.ast.WhileNode;

import java.util.List;

/**
 * Renders an AST as an indented tree, one node per line, two spaces per level.
 *
 * <pre>
 * Program (2 statements)
 *   VarDecl: INT x
 *     Literal: 42
 *   Return
 *     Identifier: x
 * </pre>
 */
public final class AstPrinter implements AstVisitor<Void> {

    private final StringBuilder out = new StringBuilder();
    private int depth = 0;

    private AstPrinter() {}

    /**
     * @param node The root of the tree to print.
     * @return The rendered tree, each line terminated by a newline.
     */
    public static String print(AstNode node) {
        AstPrinter printer = new AstPrinter();
        node.accept(printer);
        return printer.out.toString();
    }

    private Void line(String text, AstNode... children) {
        out.append("  ".repeat(depth)).append(text).append('\n');
        depth++;
        for (AstNode child : children) {
            if (child != null) child.accept(this);
        }
        depth--;
        return null;
    }

    private Void line(String text, List<? extends AstNode> children) {
        return line(text, children.toArray(new AstNode[0]));
    }

    @Override
    public Void visitLiteral(LiteralNode node) {
        switch (node.kind()) {
            case STRING: return line("Literal: \"" + node.value() + "\"");
            case CHAR: return line("Literal: '" + node.value() + "'");
            case NULL: return line("Literal: null");
            default: return line("Literal: " + node.value());
        }
    }

    @Override
    public Void visitIdentifier(IdentifierNode node) {
        return line("Identifier: " + node.name());
    }

    @Override
    public Void visitBinary(BinaryNode node) {
        return line("Binary: " + node.operator().name(), node.left(), node.right());
    }

    @Override
    public Void visitUnary(UnaryNode node) {
        return line("Unary: " + node.operator().name(), node.operand());
    }

    @Override
    public Void visitAssignment(AssignmentNode node) {
        return line("Assign: " + node.target().name(), node.value());
    }

    @Override
    public Void visitCall(CallNode node) {
        AstNode[] children = new AstNode[node.arguments().size() + 1];
        children[0] = node.callee();
        for (int i = 0; i < node.arguments().size(); i++) {
            children[i + 1] = node.arguments().get(i);
        }
        return line("Call (" + node.arguments().size() + " arguments)", children);
    }

    @Override
    public Void visitExpressionStatement(ExpressionStatementNode node) {
        return line("ExprStmt", node.expression());
    }

    @Override
    public Void visitVarDeclaration(VarDeclarationNode node) {
        return line("VarDecl: " + node.declaredType().name() + " " + node.name(), node.initializer());
    }

    @Override
    public Void visitFunctionDeclaration(FunctionDeclarationNode node) {
        line("Function: " + node.returnType().name() + " " + node.name(), node.parameters());
        depth++;
        node.body().accept(this);
        depth--;
        return null;
    }

    @Override
    public Void visitClassDeclaration(ClassDeclarationNode node) {
        return line("Class: " + node.name(), node.members());
    }

    @Override
    public Void visitIf(IfNode node) {
        return line("If", node.condition(), node.thenBranch(), node.elseBranch());
    }

    @Override
    public Void visitWhile(WhileNode node) {
        return line("While", node.condition(), node.body());
    }

    @Override
    public Void visitFor(ForNode node) {
        return line("For", node.initializer(), node.condition(), node.increment(), node.body());
    }

    @Override
    public Void visitReturn(ReturnNode node) {
        return line("Return", node.value());
    }

    @Override
    public Void visitBlock(BlockNode node) {
        return line("Block (" + node.statements().size() + " statements)", node.statements());
    }

    @Override
    public Void visitProgram(ProgramNode node) {
        return line("Program (" + node.size() + " statements)", node.statements());
    }
}
