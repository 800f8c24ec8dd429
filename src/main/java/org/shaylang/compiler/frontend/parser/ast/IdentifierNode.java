package org.shaylang.compiler.frontend.parser.ast;

import org.shaylang.compiler.api.SourcePosition;

/**
 * An AST node that represents a reference to a named variable.
 *
 * @param name The identifier, interned in the parser's arena.
 * @param position Where the identifier appears.
 */
public record IdentifierNode(String name, SourcePosition position) implements AstNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }
}
