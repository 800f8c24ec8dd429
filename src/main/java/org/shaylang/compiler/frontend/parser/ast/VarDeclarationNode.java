package org.shaylang.compiler.frontend.parser.ast;

import org.shaylang.compiler.api.SourcePosition;
import org.shaylang.compiler.frontend.lexer.TokenType;

/**
 * A typed variable declaration, {@code type name [= initializer];}.
 *
 * @param declaredType The basic-type keyword, e.g. {@link TokenType#INT}.
 * @param name The variable name, interned in the parser's arena.
 * @param initializer The initializer expression, or null.
 * @param position The position of the declaration.
 */
public record VarDeclarationNode(TokenType declaredType, String name, AstNode initializer,
                                 SourcePosition position) implements AstNode {

    /**
     * @return {@code true} if the declaration has an initializer.
     */
    public boolean hasInitializer() {
        return initializer != null;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitVarDeclaration(this);
    }
}
