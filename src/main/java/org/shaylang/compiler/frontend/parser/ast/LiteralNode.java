package org.shaylang.compiler.frontend.parser.ast;

import org.shaylang.compiler.api.SourcePosition;

/**
 * An AST node that represents a literal value.
 *
 * @param kind The literal kind, which fixes the type of {@code value}.
 * @param value The value as described by {@link LiteralKind}.
 * @param position Where the literal appears.
 */
public record LiteralNode(LiteralKind kind, Object value, SourcePosition position) implements AstNode {

    public LiteralNode {
        if (kind == null) throw new IllegalArgumentException("kind must not be null");
        if (kind == LiteralKind.NULL ? value != null : value == null) {
            throw new IllegalArgumentException("Invalid value for " + kind + " literal: " + value);
        }
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}
