package org.shaylang.compiler.frontend.parser.ast;

import org.shaylang.compiler.api.SourcePosition;

/**
 * An AST node for {@code name = value}. Only bare identifiers are valid targets.
 *
 * @param target The assigned variable.
 * @param value The assigned expression.
 * @param position The position of the '=' operator.
 */
public record AssignmentNode(IdentifierNode target, AstNode value, SourcePosition position) implements AstNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitAssignment(this);
    }
}
