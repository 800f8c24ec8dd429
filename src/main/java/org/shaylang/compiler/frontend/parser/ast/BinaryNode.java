package org.shaylang.compiler.frontend.parser.ast;

import org.shaylang.compiler.api.SourcePosition;
import org.shaylang.compiler.frontend.lexer.TokenType;

/**
 * An AST node for a left-associative binary operation.
 *
 * @param left The left operand.
 * @param operator The operator token type, e.g. {@link TokenType#PLUS}.
 * @param right The right operand.
 * @param position The position of the operator.
 */
public record BinaryNode(AstNode left, TokenType operator, AstNode right, SourcePosition position) implements AstNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }
}
