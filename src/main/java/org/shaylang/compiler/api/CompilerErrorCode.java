package org.shaylang.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur during compilation.
 * This decouples the test logic from the wording of the error messages.
 */
public enum CompilerErrorCode {
    // region Lexical Errors
    /** A string literal was not closed before the end of the input. */
    UNTERMINATED_STRING,
    /** A character literal was missing its closing quote. */
    UNTERMINATED_CHAR_LITERAL,
    /** A malformed multi-character operator such as a bare {@code ..}. */
    INVALID_OPERATOR_SEQUENCE,
    /** A character that starts no token. */
    UNEXPECTED_CHARACTER,
    /** A numeric literal without digits after its base prefix, or out of 64-bit range. */
    INVALID_NUMBER,
    // endregion

    // region Syntax Errors
    /** The parser received an error token from the lexer. */
    LEXICAL_ERROR,
    /** A token that cannot start or continue the current construct. */
    UNEXPECTED_TOKEN,
    /** The left-hand side of an assignment is not a bare identifier. */
    INVALID_ASSIGNMENT_TARGET,
    /** A required delimiter such as ';' or ')' is missing. */
    MISSING_DELIMITER,
    /** A declaration is missing its name. */
    EXPECTED_IDENTIFIER,
    // endregion

    // region Generation Errors
    /** The active backend cannot translate this AST node kind. */
    UNSUPPORTED_NODE,
    /** An operator has no entry in the backend's translation table. */
    UNSUPPORTED_OPERATOR,
    /** The selected output format has no implementation. */
    FORMAT_NOT_IMPLEMENTED,
    /** The arena backing the AST was released before generation. */
    AST_RELEASED,
    /** A string or character literal holds an escape the target language cannot represent. */
    INVALID_ESCAPE_SEQUENCE,
    // endregion

    // region Resource Errors
    /** The AST arena ran out of capacity. */
    ARENA_EXHAUSTED,
    // endregion

    // region General Errors
    /** An I/O error occurred while reading or writing a file. */
    IO_ERROR
    // endregion
}
