package org.shaylang.compiler.backend.c;

import org.shaylang.compiler.frontend.lexer.TokenType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Closed lookup tables from ShayLang operators and type keywords to their C spelling.
 */
final class CTranslationTables {

    private static final Map<TokenType, String> BINARY_OPERATORS;
    private static final Map<TokenType, String> UNARY_OPERATORS;
    private static final Map<TokenType, String> TYPES;

    /** C keywords and the macros of the preamble headers; none of them may name a variable. */
    private static final Set<String> RESERVED_NAMES = Set.of(
            "auto", "break", "case", "char", "const", "continue", "default", "do", "double", "else",
            "enum", "extern", "float", "for", "goto", "if", "inline", "int", "long", "register",
            "restrict", "return", "short", "signed", "sizeof", "static", "struct", "switch", "typedef",
            "union", "unsigned", "void", "volatile", "while", "_Alignas", "_Alignof", "_Atomic",
            "_Bool", "_Complex", "_Generic", "_Imaginary", "_Noreturn", "_Static_assert",
            "_Thread_local",
            "NULL", "EOF", "BUFSIZ", "FILENAME_MAX", "FOPEN_MAX", "L_tmpnam", "TMP_MAX",
            "SEEK_SET", "SEEK_CUR", "SEEK_END", "_IOFBF", "_IOLBF", "_IONBF",
            "stdin", "stdout", "stderr", "EXIT_SUCCESS", "EXIT_FAILURE", "RAND_MAX", "MB_CUR_MAX",
            "bool", "true", "false", "__bool_true_false_are_defined");

    static {
        Map<TokenType, String> binary = new EnumMap<>(TokenType.class);
        binary.put(TokenType.PLUS, "+");
        binary.put(TokenType.MINUS, "-");
        binary.put(TokenType.MULTIPLY, "*");
        binary.put(TokenType.DIVIDE, "/");
        binary.put(TokenType.MODULO, "%");
        binary.put(TokenType.EQUAL, "==");
        binary.put(TokenType.NOT_EQUAL, "!=");
        binary.put(TokenType.LESS, "<");
        binary.put(TokenType.LESS_EQUAL, "<=");
        binary.put(TokenType.GREATER, ">");
        binary.put(TokenType.GREATER_EQUAL, ">=");
        binary.put(TokenType.AND, "&&");
        binary.put(TokenType.OR, "||");
        binary.put(TokenType.ASSIGN, "=");
        BINARY_OPERATORS = Collections.unmodifiableMap(binary);

        Map<TokenType, String> unary = new EnumMap<>(TokenType.class);
        unary.put(TokenType.MINUS, "-");
        unary.put(TokenType.NOT, "!");
        UNARY_OPERATORS = Collections.unmodifiableMap(unary);

        Map<TokenType, String> types = new EnumMap<>(TokenType.class);
        types.put(TokenType.INT, "int");
        types.put(TokenType.FLOAT_KW, "double");
        types.put(TokenType.STRING_KW, "char*");
        types.put(TokenType.BOOL_KW, "bool");
        types.put(TokenType.CHAR_KW, "char");
        TYPES = Collections.unmodifiableMap(types);
    }

    private CTranslationTables() {}

    static Optional<String> binaryOperator(TokenType operator) {
        return Optional.ofNullable(BINARY_OPERATORS.get(operator));
    }

    static Optional<String> unaryOperator(TokenType operator) {
        return Optional.ofNullable(UNARY_OPERATORS.get(operator));
    }

    /**
     * @return The C type for a declared type keyword; {@code int} for anything unmapped.
     */
    static String type(TokenType declaredType) {
        return TYPES.getOrDefault(declaredType, "int");
    }

    /**
     * Maps a ShayLang identifier to a usable C identifier. A reserved name, or a reserved name
     * followed by underscores, gets one more trailing underscore; every other name is kept.
     * Distinct ShayLang names therefore stay distinct in C.
     */
    static String identifier(String name) {
        int end = name.length();
        while (end > 0 && name.charAt(end - 1) == '_') end--;
        return RESERVED_NAMES.contains(name.substring(0, end)) ? name + "_" : name;
    }
}
