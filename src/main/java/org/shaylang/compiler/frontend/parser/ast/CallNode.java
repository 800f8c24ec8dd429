package org.shaylang.compiler.frontend.parser.ast;

import org.shaylang.compiler.api.SourcePosition;

import java.util.List;

/**
 * An AST node for a call expression.
 *
 * @param callee The called expression.
 * @param arguments The argument expressions in order.
 * @param position The position of the call.
 */
public record CallNode(AstNode callee, List<AstNode> arguments, SourcePosition position) implements AstNode {

    public CallNode {
        arguments = List.copyOf(arguments);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitCall(this);
    }
}
