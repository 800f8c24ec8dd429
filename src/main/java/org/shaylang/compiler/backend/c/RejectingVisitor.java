package org.shaylang.compiler.backend.c;

import org.shaylang.compiler.api.CompilerErrorCode;
import org.shaylang.compiler.backend.GenerationException;
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

/**
 * Base visitor that rejects every node kind. Emitters override the kinds they can translate.
 */
abstract class RejectingVisitor implements AstVisitor<String> {

    private final String context;

    /**
     * @param context What the emitter translates, used in messages ("expression", "statement").
     */
    RejectingVisitor(String context) {
        this.context = context;
    }

    protected GenerationException unsupported(AstNode node) {
        return new GenerationException(CompilerErrorCode.UNSUPPORTED_NODE,
                node.getClass().getSimpleName() + " is not supported as a C " + context,
                node.position());
    }

    @Override public String visitLiteral(LiteralNode node) { throw unsupported(node); }
    @Override public String visitIdentifier(IdentifierNode node) { throw unsupported(node); }
    @Override public String visitBinary(BinaryNode node) { throw unsupported(node); }
    @Override public String visitUnary(UnaryNode node) { throw unsupported(node); }
    @Override public String visitAssignment(AssignmentNode node) { throw unsupported(node); }
    @Override public String visitCall(CallNode node) { throw unsupported(node); }
    @Override public String visitExpressionStatement(ExpressionStatementNode node) { throw unsupported(node); }
    @Override public String visitVarDeclaration(VarDeclarationNode node) { throw unsupported(node); }
    @Override public String visitFunctionDeclaration(FunctionDeclarationNode node) { throw unsupported(node); }
    @Override public String visitClassDeclaration(ClassDeclarationNode node) { throw unsupported(node); }
    @Override public String visitIf(IfNode node) { throw unsupported(node); }
    @Override public String visitWhile(WhileNode node) { throw unsupported(node); }
    @Override public String visitFor(ForNode node) { throw unsupported(node); }
    @Override public String visitReturn(ReturnNode node) { throw unsupported(node); }
    @Override public String visitBlock(BlockNode node) { throw unsupported(node); }
    @Override public String visitProgram(ProgramNode node) { throw unsupported(node); }
}
