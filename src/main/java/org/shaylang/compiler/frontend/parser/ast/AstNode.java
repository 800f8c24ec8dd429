package org.shaylang.compiler.frontend.parser.ast;

import org.shaylang.compiler.api.SourcePosition;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * <p>
 * The set of node kinds is closed. Consumers dispatch through {@link AstVisitor}, which has
 * one method per kind, so adding a kind forces every consumer to handle it.
 * Children are exclusively owned by their parent; the tree is acyclic by construction.
 */
public sealed interface AstNode permits
        LiteralNode, IdentifierNode, BinaryNode, UnaryNode, AssignmentNode, CallNode,
        ExpressionStatementNode, VarDeclarationNode, FunctionDeclarationNode, ClassDeclarationNode,
        IfNode, WhileNode, ForNode, ReturnNode, BlockNode, ProgramNode {

    /**
     * @return The source position the node was parsed from.
     */
    SourcePosition position();

    /**
     * Dispatches to the visitor method for this node kind.
     *
     * @param visitor The visitor.
     * @param <R> The visitor's result type.
     * @return The visitor's result.
     */
    <R> R accept(AstVisitor<R> visitor);
}
