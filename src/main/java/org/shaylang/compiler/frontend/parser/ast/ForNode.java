package org.shaylang.compiler.frontend.parser.ast;

import org.shaylang.compiler.api.SourcePosition;

/**
 * A C-style counting loop. Any of the three header clauses may be null.
 *
 * @param initializer The initializer statement.
 * @param condition The loop condition.
 * @param increment The expression evaluated after each iteration.
 * @param body The loop body.
 * @param position The position of the {@code for} keyword.
 */
public record ForNode(AstNode initializer, AstNode condition, AstNode increment, AstNode body,
                      SourcePosition position) implements AstNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFor(this);
    }
}
