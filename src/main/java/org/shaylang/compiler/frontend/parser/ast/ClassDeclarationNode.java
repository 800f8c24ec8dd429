package org.shaylang.compiler.frontend.parser.ast;

import org.shaylang.compiler.api.SourcePosition;

import java.util.List;

/**
 * A class declaration. Part of the language model; the current grammar does not produce it.
 *
 * @param name The class name.
 * @param members Field and method declarations.
 * @param position The position of the declaration.
 */
public record ClassDeclarationNode(String name, List<AstNode> members, SourcePosition position) implements AstNode {

    public ClassDeclarationNode {
        members = List.copyOf(members);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitClassDeclaration(this);
    }
}
