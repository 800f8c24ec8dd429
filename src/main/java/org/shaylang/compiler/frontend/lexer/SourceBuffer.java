package org.shaylang.compiler.frontend.lexer;

/**
 * The text of one compilation unit together with its diagnostic name.
 * Tokens refer into this buffer by offset and length instead of copying their lexemes.
 *
 * @param text The complete source text.
 * @param fileName The name used in diagnostics.
 */
public record SourceBuffer(String text, String fileName) {

    /**
     * @param offset Start offset, inclusive.
     * @param length Number of characters.
     * @return The characters of the span as a view; callers that keep the text must copy it.
     */
    public CharSequence span(int offset, int length) {
        return text.subSequence(offset, offset + length);
    }

    /**
     * @return The number of characters in the buffer.
     */
    public int length() {
        return text.length();
    }
}
