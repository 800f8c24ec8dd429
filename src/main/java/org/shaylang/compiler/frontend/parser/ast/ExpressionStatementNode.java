package org.shaylang.compiler.frontend.parser.ast;

import org.shaylang.compiler.api.SourcePosition;

/**
 * An expression evaluated for its side effects, terminated by ';'.
 *
 * @param expression The expression.
 * @param position The position of the statement.
 */
public record ExpressionStatementNode(AstNode expression, SourcePosition position) implements AstNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitExpressionStatement(this);
    }
}
