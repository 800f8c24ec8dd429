package org.shaylang.compiler.frontend.lexer;

import java.util.Map;
import java.util.Optional;

import static java.util.Map.entry;

/**
 * The reserved words of the language. Matching is exact and case-sensitive: a keyword used
 * as a prefix ({@code int2}) or with different case ({@code Int}) is a plain identifier.
 * <p>
 * The table is immutable and shared by every lexer in the process.
 */
public final class Keywords {

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            entry("int", TokenType.INT),
            entry("float", TokenType.FLOAT_KW),
            entry("string", TokenType.STRING_KW),
            entry("bool", TokenType.BOOL_KW),
            entry("char", TokenType.CHAR_KW),
            entry("void", TokenType.VOID_KW),
            entry("if", TokenType.IF),
            entry("else", TokenType.ELSE),
            entry("while", TokenType.WHILE),
            entry("for", TokenType.FOR),
            entry("do", TokenType.DO),
            entry("switch", TokenType.SWITCH),
            entry("case", TokenType.CASE),
            entry("default", TokenType.DEFAULT),
            entry("break", TokenType.BREAK),
            entry("continue", TokenType.CONTINUE),
            entry("return", TokenType.RETURN),
            entry("function", TokenType.FUNCTION),
            entry("var", TokenType.VAR),
            entry("const", TokenType.CONST),
            entry("class", TokenType.CLASS),
            entry("struct", TokenType.STRUCT),
            entry("enum", TokenType.ENUM),
            entry("interface", TokenType.INTERFACE),
            entry("implements", TokenType.IMPLEMENTS),
            entry("extends", TokenType.EXTENDS),
            entry("public", TokenType.PUBLIC),
            entry("private", TokenType.PRIVATE),
            entry("protected", TokenType.PROTECTED),
            entry("static", TokenType.STATIC),
            entry("final", TokenType.FINAL),
            entry("abstract", TokenType.ABSTRACT),
            entry("virtual", TokenType.VIRTUAL),
            entry("override", TokenType.OVERRIDE),
            entry("try", TokenType.TRY),
            entry("catch", TokenType.CATCH),
            entry("finally", TokenType.FINALLY),
            entry("throw", TokenType.THROW),
            entry("import", TokenType.IMPORT),
            entry("export", TokenType.EXPORT),
            entry("module", TokenType.MODULE),
            entry("namespace", TokenType.NAMESPACE),
            entry("true", TokenType.TRUE),
            entry("false", TokenType.FALSE),
            entry("null", TokenType.NULL),
            entry("undefined", TokenType.UNDEFINED)
    );

    private Keywords() {}

    /**
     * Looks up the keyword type for an exact spelling.
     * @param text The identifier text.
     * @return The keyword type, or empty if the text is not reserved.
     */
    public static Optional<TokenType> lookup(String text) {
        return Optional.ofNullable(KEYWORDS.get(text));
    }

    /**
     * @return All reserved spellings with their token types.
     */
    public static Map<String, TokenType> all() {
        return KEYWORDS;
    }
}
