package org.shaylang.compiler.frontend.parser.ast;

import org.shaylang.compiler.api.SourcePosition;
import org.shaylang.compiler.frontend.lexer.TokenType;

/**
 * An AST node for a prefix operation ({@code !x}, {@code -x}).
 *
 * @param operator The operator token type.
 * @param operand The operand.
 * @param position The position of the operator.
 */
public record UnaryNode(TokenType operator, AstNode operand, SourcePosition position) implements AstNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }
}
