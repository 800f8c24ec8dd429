package org.shaylang.compiler.frontend.lexer;

import org.shaylang.compiler.api.CompilerErrorCode;
import org.shaylang.compiler.api.SourcePosition;
import org.shaylang.compiler.diagnostics.CompilerLogger;
import org.shaylang.compiler.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) converts a source buffer into tokens.
 * <p>
 * Tokens are produced on demand by {@link #next()}. Once the end of the buffer is reached every
 * further call returns an {@link TokenType#END_OF_FILE} token. Lexical problems never stop the
 * lexer: they are returned as {@link TokenType#ERROR} tokens, reported to the diagnostics engine
 * and remembered in a sticky error flag, and scanning continues after the offending characters.
 */
public class Lexer {

    private final SourceBuffer buffer;
    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final String logicalFileName;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;
    private long tokensProduced = 0;
    private boolean hasError = false;
    private String errorMessage = "";

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the file being scanned, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.buffer = new SourceBuffer(source, logicalFileName);
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Scans and returns the next token.
     * @return The next token; {@link TokenType#END_OF_FILE} once the input is exhausted.
     */
    public Token next() {
        skipWhitespace();
        start = current;
        startLine = line;
        startColumn = column;
        tokensProduced++;

        if (isAtEnd()) {
            return makeToken(TokenType.END_OF_FILE);
        }

        char c = advance();
        if (isAlpha(c)) return identifier();
        if (isDigit(c)) return number(c);

        switch (c) {
            case '(': return makeToken(TokenType.LPAREN);
            case ')': return makeToken(TokenType.RPAREN);
            case '{': return makeToken(TokenType.LBRACE);
            case '}': return makeToken(TokenType.RBRACE);
            case '[': return makeToken(TokenType.LBRACKET);
            case ']': return makeToken(TokenType.RBRACKET);
            case ';': return makeToken(TokenType.SEMICOLON);
            case ',': return makeToken(TokenType.COMMA);
            case '?': return makeToken(TokenType.QUESTION);
            case '~': return makeToken(TokenType.TILDE);
            case '#': return makeToken(TokenType.HASH);
            case '\n': return makeToken(TokenType.NEWLINE);
            case '"': return string();
            case '\'': return character();
            case '.':
                if (match('.')) {
                    if (match('.')) return makeToken(TokenType.ELLIPSIS);
                    return errorToken(CompilerErrorCode.INVALID_OPERATOR_SEQUENCE, "Invalid token '..'");
                }
                return makeToken(TokenType.DOT);
            case ':':
                return makeToken(match(':') ? TokenType.SCOPE : TokenType.COLON);
            case '^':
                return makeToken(match('=') ? TokenType.XOR_ASSIGN : TokenType.XOR);
            case '+':
                if (match('+')) return makeToken(TokenType.INCREMENT);
                if (match('=')) return makeToken(TokenType.PLUS_ASSIGN);
                return makeToken(TokenType.PLUS);
            case '-':
                if (match('-')) return makeToken(TokenType.DECREMENT);
                if (match('=')) return makeToken(TokenType.MINUS_ASSIGN);
                if (match('>')) return makeToken(TokenType.ARROW);
                return makeToken(TokenType.MINUS);
            case '*':
                if (match('=')) return makeToken(TokenType.MULTIPLY_ASSIGN);
                if (match('*')) return makeToken(match('=') ? TokenType.POWER_ASSIGN : TokenType.POWER);
                return makeToken(TokenType.MULTIPLY);
            case '/':
                return makeToken(match('=') ? TokenType.DIVIDE_ASSIGN : TokenType.DIVIDE);
            case '%':
                return makeToken(match('=') ? TokenType.MODULO_ASSIGN : TokenType.MODULO);
            case '!':
                return makeToken(match('=') ? TokenType.NOT_EQUAL : TokenType.NOT);
            case '=':
                if (match('=')) return makeToken(match('=') ? TokenType.STRICT_EQUAL : TokenType.EQUAL);
                return makeToken(TokenType.ASSIGN);
            case '<':
                if (match('<')) return makeToken(match('=') ? TokenType.LSHIFT_ASSIGN : TokenType.LSHIFT);
                return makeToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS);
            case '>':
                if (match('>')) return makeToken(match('=') ? TokenType.RSHIFT_ASSIGN : TokenType.RSHIFT);
                return makeToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
            case '&':
                if (match('&')) return makeToken(TokenType.AND);
                if (match('=')) return makeToken(TokenType.AND_ASSIGN);
                return makeToken(TokenType.BITWISE_AND);
            case '|':
                if (match('|')) return makeToken(TokenType.OR);
                if (match('=')) return makeToken(TokenType.OR_ASSIGN);
                return makeToken(TokenType.BITWISE_OR);
            default:
                return errorToken(CompilerErrorCode.UNEXPECTED_CHARACTER, "Unexpected character '" + c + "'");
        }
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return All tokens up to and including the single {@link TokenType#END_OF_FILE} token.
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = next();
            tokens.add(token);
        } while (token.type() != TokenType.END_OF_FILE);
        return tokens;
    }

    /**
     * @return {@code true} if any lexical error has been produced so far.
     */
    public boolean hasError() {
        return hasError;
    }

    /**
     * @return The message of the most recent lexical error, or an empty string.
     */
    public String getErrorMessage() {
        return errorMessage;
    }

    /**
     * @return The number of tokens returned by {@link #next()}, including repeated end-of-file tokens.
     */
    public long tokensProduced() {
        return tokensProduced;
    }

    /**
     * @return The logical file name used for positions and diagnostics.
     */
    public String getFileName() {
        return logicalFileName;
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\r' || c == '\t') {
                advance();
            } else if (c == '/' && peekNext() == '/') {
                while (peek() != '\n' && !isAtEnd()) advance();
            } else if (c == '/' && peekNext() == '*') {
                advance();
                advance();
                // Block comments do not nest; an unterminated one runs to the end of input.
                while (!isAtEnd()) {
                    if (peek() == '*' && peekNext() == '/') {
                        advance();
                        advance();
                        break;
                    }
                    advance();
                }
            } else {
                return;
            }
        }
    }

    private Token identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        return makeToken(Keywords.lookup(text).orElse(TokenType.IDENTIFIER));
    }

    private Token number(char first) {
        if (first == '0' && (peek() == 'x' || peek() == 'X')) {
            return prefixedInteger(16);
        }
        if (first == '0' && (peek() == 'b' || peek() == 'B')) {
            return prefixedInteger(2);
        }
        if (first == '0' && (peek() == 'o' || peek() == 'O')) {
            return prefixedInteger(8);
        }

        boolean isFloat = false;
        while (isDigit(peek())) advance();

        if (peek() == '.' && isDigit(peekNext())) {
            isFloat = true;
            advance(); // consume the '.'
            while (isDigit(peek())) advance();
        }

        if ((peek() == 'e' || peek() == 'E') && startsExponent()) {
            isFloat = true;
            advance(); // consume 'e' or 'E'
            if (peek() == '+' || peek() == '-') advance();
            while (isDigit(peek())) advance();
        }

        String text = source.substring(start, current);
        if (isFloat) {
            return makeToken(TokenType.FLOAT, Double.parseDouble(text));
        }
        try {
            return makeToken(TokenType.INTEGER, Long.parseLong(text));
        } catch (NumberFormatException e) {
            return errorToken(CompilerErrorCode.INVALID_NUMBER, "Integer literal out of range: " + text);
        }
    }

    private boolean startsExponent() {
        char next = peekNext();
        if (isDigit(next)) return true;
        return (next == '+' || next == '-') && current + 2 < source.length() && isDigit(source.charAt(current + 2));
    }

    private Token prefixedInteger(int radix) {
        advance(); // consume the base letter
        int digitsStart = current;
        while (Character.digit(peek(), radix) >= 0 && peek() < 128) advance();

        String digits = source.substring(digitsStart, current);
        if (digits.isEmpty()) {
            return errorToken(CompilerErrorCode.INVALID_NUMBER,
                    "Missing digits after '" + source.substring(start, current) + "'");
        }
        try {
            return makeToken(TokenType.INTEGER, Long.parseLong(digits, radix));
        } catch (NumberFormatException e) {
            return errorToken(CompilerErrorCode.INVALID_NUMBER,
                    "Integer literal out of range: " + source.substring(start, current));
        }
    }

    private Token string() {
        while (peek() != '"' && !isAtEnd()) {
            if (peek() == '\\') {
                advance(); // consume the backslash
                if (!isAtEnd()) escape();
            } else {
                advance();
            }
        }

        if (isAtEnd()) {
            return errorToken(CompilerErrorCode.UNTERMINATED_STRING, "Unterminated string");
        }

        advance(); // the closing "
        return makeToken(TokenType.STRING);
    }

    // Escapes are recognized so that an escaped quote does not end the literal; they are not decoded.
    private void escape() {
        char escaped = advance();
        if (escaped == 'x') {
            for (int i = 0; i < 2 && isHexDigit(peek()); i++) advance();
        } else if (escaped == 'u') {
            for (int i = 0; i < 4 && isHexDigit(peek()); i++) advance();
        }
    }

    private Token character() {
        if (peek() == '\\') {
            advance();
            if (!isAtEnd()) escape();
        } else if (peek() == '\'') {
            advance();
            return errorToken(CompilerErrorCode.UNTERMINATED_CHAR_LITERAL,
                    "Character literal must contain exactly one character");
        } else if (!isAtEnd()) {
            advance();
        }

        if (!match('\'')) {
            return errorToken(CompilerErrorCode.UNTERMINATED_CHAR_LITERAL, "Unterminated character literal");
        }
        return makeToken(TokenType.CHAR);
    }

    private Token makeToken(TokenType type) {
        return makeToken(type, null);
    }

    private Token makeToken(TokenType type, Object value) {
        return new Token(type, buffer, start, current - start,
                new SourcePosition(startLine, startColumn, logicalFileName), value);
    }

    private Token errorToken(CompilerErrorCode code, String message) {
        hasError = true;
        errorMessage = message;
        SourcePosition position = new SourcePosition(startLine, startColumn, logicalFileName);
        diagnostics.reportError(code, message, position);
        CompilerLogger.trace("Lexical error at " + position + ": " + message);
        return new Token(TokenType.ERROR, buffer, start, current - start, position, message);
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
