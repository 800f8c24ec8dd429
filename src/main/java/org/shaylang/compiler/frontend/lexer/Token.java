package org.shaylang.compiler.frontend.lexer;

import org.shaylang.compiler.api.SourcePosition;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 * A token does not own its text: {@link #lexeme()} resolves the span against the source
 * buffer, so anything that must outlive the buffer has to be copied.
 *
 * @param type The type of the token.
 * @param source The buffer the token was scanned from.
 * @param offset Offset of the first character in the buffer.
 * @param length Number of characters.
 * @param position The position of the first character.
 * @param value A {@link Long} for integers, a {@link Double} for floats, the message for
 *              {@link TokenType#ERROR} tokens, otherwise null.
 */
public record Token(
        TokenType type,
        SourceBuffer source,
        int offset,
        int length,
        SourcePosition position,
        Object value
) {

    /**
     * @return The exact characters of the token in the source buffer.
     */
    public CharSequence lexeme() {
        return source.span(offset, length);
    }

    /**
     * @return The lexeme as a fresh string, for messages and tests.
     */
    public String text() {
        return lexeme().toString();
    }

    /**
     * @return The raw characters between the delimiting quotes of a string or char literal,
     *         with escape sequences left untouched.
     */
    public CharSequence quotedContent() {
        if ((type != TokenType.STRING && type != TokenType.CHAR) || length < 2) {
            throw new IllegalStateException("Not a quoted literal: " + type);
        }
        return source.span(offset + 1, length - 2);
    }

    /**
     * @return The integer value of an {@link TokenType#INTEGER} token.
     */
    public long intValue() {
        return (Long) value;
    }

    /**
     * @return The value of a {@link TokenType#FLOAT} token.
     */
    public double floatValue() {
        return (Double) value;
    }

    /**
     * @return The message of an {@link TokenType#ERROR} token.
     */
    public String errorMessage() {
        return type == TokenType.ERROR ? (String) value : null;
    }

    @Override
    public String toString() {
        return type + " '" + lexeme() + "' at " + position;
    }
}
