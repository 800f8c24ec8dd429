package org.shaylang.compiler.frontend.parser.ast;

/**
 * A visitor over the closed set of AST node kinds.
 *
 * @param <R> The return type of the visit methods.
 */
public interface AstVisitor<R> {
    R visitLiteral(LiteralNode node);
    R visitIdentifier(IdentifierNode node);
    R visitBinary(BinaryNode node);
    R visitUnary(UnaryNode node);
    R visitAssignment(AssignmentNode node);
    R visitCall(CallNode node);
    R visitExpressionStatement(ExpressionStatementNode node);
    R visitVarDeclaration(VarDeclarationNode node);
    R visitFunctionDeclaration(FunctionDeclarationNode node);
    R visitClassDeclaration(ClassDeclarationNode node);
    R visitIf(IfNode node);
    R visitWhile(WhileNode node);
    R visitFor(ForNode node);
    R visitReturn(ReturnNode node);
    R visitBlock(BlockNode node);
    R visitProgram(ProgramNode node);
}
