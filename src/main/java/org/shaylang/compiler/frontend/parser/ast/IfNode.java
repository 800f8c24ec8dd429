package org.shaylang.compiler.frontend.parser.ast;

import org.shaylang.compiler.api.SourcePosition;

/**
 * A conditional statement.
 *
 * @param condition The condition.
 * @param thenBranch The statement run when the condition holds.
 * @param elseBranch The alternative, or null.
 * @param position The position of the {@code if} keyword.
 */
public record IfNode(AstNode condition, AstNode thenBranch, AstNode elseBranch,
                     SourcePosition position) implements AstNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIf(this);
    }
}
