package org.shaylang.compiler.frontend.parser.ast;

import org.shaylang.compiler.api.SourcePosition;
import org.shaylang.compiler.frontend.lexer.TokenType;

import java.util.List;

/**
 * A function declaration. Part of the language model; the current grammar does not produce it.
 *
 * @param name The function name.
 * @param returnType The declared return type keyword.
 * @param parameters The parameter declarations.
 * @param body The function body.
 * @param position The position of the declaration.
 */
public record FunctionDeclarationNode(String name, TokenType returnType, List<VarDeclarationNode> parameters,
                                      BlockNode body, SourcePosition position) implements AstNode {

    public FunctionDeclarationNode {
        parameters = List.copyOf(parameters);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFunctionDeclaration(this);
    }
}
