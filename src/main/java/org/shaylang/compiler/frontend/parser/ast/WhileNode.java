package org.shaylang.compiler.frontend.parser.ast;

import org.shaylang.compiler.api.SourcePosition;

/**
 * A pre-tested loop.
 *
 * @param condition The loop condition.
 * @param body The loop body.
 * @param position The position of the {@code while} keyword.
 */
public record WhileNode(AstNode condition, AstNode body, SourcePosition position) implements AstNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitWhile(this);
    }
}
