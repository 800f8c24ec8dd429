package org.shaylang.compiler.frontend.parser.ast;

import org.shaylang.compiler.api.SourcePosition;

import java.util.List;

/**
 * A braced sequence of statements.
 *
 * @param statements The statements in order.
 * @param position The position of the opening brace.
 */
public record BlockNode(List<AstNode> statements, SourcePosition position) implements AstNode {

    public BlockNode {
        statements = List.copyOf(statements);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }
}
