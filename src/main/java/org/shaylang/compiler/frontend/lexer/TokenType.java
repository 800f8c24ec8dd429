package org.shaylang.compiler.frontend.lexer;

import java.util.EnumSet;
import java.util.Set;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 * The constant names double as the debug names printed in AST dumps.
 */
public enum TokenType {
    // Literals.
    /** An integer literal in decimal, hexadecimal, binary or octal notation. */
    INTEGER,
    /** A floating-point literal with a fraction and/or an exponent. */
    FLOAT,
    /** A string literal; the lexeme includes the quotes. */
    STRING,
    /** A character literal; the lexeme includes the quotes. */
    CHAR,
    /** An identifier that is not a keyword. */
    IDENTIFIER,

    // Keywords - basic types.
    INT,
    FLOAT_KW,
    STRING_KW,
    BOOL_KW,
    CHAR_KW,
    VOID_KW,

    // Keywords - control flow.
    IF,
    ELSE,
    WHILE,
    FOR,
    DO,
    SWITCH,
    CASE,
    DEFAULT,
    BREAK,
    CONTINUE,
    RETURN,

    // Keywords - functions and variables.
    FUNCTION,
    VAR,
    CONST,

    // Keywords - object orientation.
    CLASS,
    STRUCT,
    ENUM,
    INTERFACE,
    IMPLEMENTS,
    EXTENDS,
    PUBLIC,
    PRIVATE,
    PROTECTED,
    STATIC,
    FINAL,
    ABSTRACT,
    VIRTUAL,
    OVERRIDE,

    // Keywords - error handling.
    TRY,
    CATCH,
    FINALLY,
    THROW,

    // Keywords - modules.
    IMPORT,
    EXPORT,
    MODULE,
    NAMESPACE,

    // Keywords - literal values.
    TRUE,
    FALSE,
    NULL,
    UNDEFINED,

    // Arithmetic operators.
    PLUS,
    MINUS,
    MULTIPLY,
    DIVIDE,
    MODULO,
    POWER,
    INCREMENT,
    DECREMENT,

    // Assignment operators.
    ASSIGN,
    PLUS_ASSIGN,
    MINUS_ASSIGN,
    MULTIPLY_ASSIGN,
    DIVIDE_ASSIGN,
    MODULO_ASSIGN,
    POWER_ASSIGN,

    // Comparison operators.
    EQUAL,
    NOT_EQUAL,
    STRICT_EQUAL,
    LESS,
    LESS_EQUAL,
    GREATER,
    GREATER_EQUAL,

    // Logical operators.
    AND,
    OR,
    NOT,

    // Bitwise operators.
    BITWISE_AND,
    BITWISE_OR,
    XOR,
    TILDE,
    LSHIFT,
    RSHIFT,
    AND_ASSIGN,
    OR_ASSIGN,
    XOR_ASSIGN,
    LSHIFT_ASSIGN,
    RSHIFT_ASSIGN,

    // Delimiters.
    LPAREN,
    RPAREN,
    LBRACE,
    RBRACE,
    LBRACKET,
    RBRACKET,
    SEMICOLON,
    COMMA,
    DOT,
    COLON,
    /** The '::' scope operator. */
    SCOPE,
    /** The '->' operator. */
    ARROW,
    QUESTION,
    /** The '...' operator. */
    ELLIPSIS,
    HASH,

    // Miscellaneous.
    /** A newline character. Layout only; the parser skips it. */
    NEWLINE,
    /** Represents the end of the source buffer. Returned indefinitely once reached. */
    END_OF_FILE,
    /** A lexical error. The token's value carries the message. */
    ERROR;

    private static final Set<TokenType> BASIC_TYPES =
            EnumSet.of(INT, FLOAT_KW, STRING_KW, BOOL_KW, CHAR_KW, VOID_KW);

    private static final Set<TokenType> STATEMENT_STARTS =
            EnumSet.of(INT, FLOAT_KW, STRING_KW, BOOL_KW, CHAR_KW, VOID_KW,
                    CLASS, FUNCTION, VAR, CONST, FOR, IF, WHILE, RETURN);

    /**
     * @return {@code true} for the keywords that introduce a typed variable declaration.
     */
    public boolean isBasicType() {
        return BASIC_TYPES.contains(this);
    }

    /**
     * @return {@code true} for the declaration and control-flow keywords the parser resynchronizes on.
     */
    public boolean startsStatement() {
        return STATEMENT_STARTS.contains(this);
    }
}
