package org.shaylang.compiler.frontend.parser.ast;

import org.shaylang.compiler.api.SourcePosition;

/**
 * A {@code return} statement.
 *
 * @param value The returned expression, or null for a bare {@code return;}.
 * @param position The position of the {@code return} keyword.
 */
public record ReturnNode(AstNode value, SourcePosition position) implements AstNode {

    /**
     * @return {@code true} if a value is returned.
     */
    public boolean hasValue() {
        return value != null;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitReturn(this);
    }
}
