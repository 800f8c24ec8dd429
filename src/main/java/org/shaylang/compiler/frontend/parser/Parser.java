package org.shaylang.compiler.frontend.parser;

import org.shaylang.compiler.api.CompilerErrorCode;
import org.shaylang.compiler.api.SourcePosition;
import org.shaylang.compiler.diagnostics.CompilerLogger;
import org.shaylang.compiler.diagnostics.DiagnosticsEngine;
import org.shaylang.compiler.frontend.lexer.Lexer;
import org.shaylang.compiler.frontend.lexer.Token;
import org.shaylang.compiler.frontend.lexer.TokenType;
import org.shaylang.compiler.frontend.parser.ast.AssignmentNode;
import org.shaylang.compiler.frontend.parser.ast.AstNode;
import org.shaylang.compiler.frontend.parser.ast.BinaryNode;
import org.shaylang.compiler.frontend.parser.ast.ExpressionStatementNode;
import org.shaylang.compiler.frontend.parser.ast.IdentifierNode;
import org.shaylang.compiler.frontend.parser.ast.LiteralKind;
import org.shaylang.compiler.frontend.parser.ast.LiteralNode;
import org.shaylang.compiler.frontend.parser.ast.ProgramNode;
import org.shaylang.compiler.frontend.parser.ast.ReturnNode;
import org.shaylang.compiler.frontend.parser.ast.UnaryNode;
import org.shaylang.compiler.frontend.parser.ast.VarDeclarationNode;
import org.shaylang.compiler.memory.Arena;
import org.shaylang.compiler.memory.ArenaExhaustedException;

import java.util.ArrayList;
import java.util.List;

/**
 * A recursive-descent parser for ShayLang. It pulls tokens from a {@link Lexer} and produces
 * an Abstract Syntax Tree whose nodes and names live in the parser's {@link Arena}.
 * <p>
 * Errors never stop the parse. The first error of a statement is recorded, the parser
 * enters panic mode to suppress follow-up errors, skips to the next statement boundary
 * and continues. Malformed statements contribute no node to the program.
 * <p>
 * Closing the parser releases its arena, which invalidates the tree it produced.
 */
public class Parser implements AutoCloseable {

    /** Bytes reserved in the arena for every node. */
    private static final int NODE_SIZE = 48;
    private static final int NODE_ALIGNMENT = 8;

    private final Lexer lexer;
    private final DiagnosticsEngine diagnostics;
    private final Arena arena;
    private Token current;
    private Token previous;
    private boolean hadError = false;
    private boolean panicMode = false;
    private String errorMessage = "";
    private int nodesCreated = 0;
    private boolean parsed = false;

    /**
     * Constructs a new Parser with a default-sized arena.
     * @param lexer The token source.
     * @param diagnostics The engine for reporting errors.
     */
    public Parser(Lexer lexer, DiagnosticsEngine diagnostics) {
        this(lexer, diagnostics, new Arena());
    }

    /**
     * Constructs a new Parser.
     * @param lexer The token source. It is borrowed, not owned.
     * @param diagnostics The engine for reporting errors.
     * @param arena The arena the parser takes ownership of.
     */
    public Parser(Lexer lexer, DiagnosticsEngine diagnostics, Arena arena) {
        this.lexer = lexer;
        this.diagnostics = diagnostics;
        this.arena = arena;
    }

    /**
     * Parses the whole token stream.
     * <p>
     * If the arena runs out of space the parse stops, an {@link CompilerErrorCode#ARENA_EXHAUSTED}
     * error is recorded and the statements parsed so far are returned. Callers must check
     * {@link #hasError()} before using the result.
     *
     * @return The program node holding all well-formed top-level statements.
     */
    public ProgramNode parse() {
        if (parsed) {
            throw new IllegalStateException("A parser can only parse once");
        }
        parsed = true;

        List<AstNode> statements = new ArrayList<>();
        try {
            advance();
            while (!isAtEnd()) {
                AstNode statement = declaration();
                if (statement != null) {
                    statements.add(statement);
                }
            }
        } catch (ArenaExhaustedException ex) {
            panicMode = false;
            errorAt(current, CompilerErrorCode.ARENA_EXHAUSTED, ex.getMessage());
        }

        CompilerLogger.debug("Parser: " + statements.size() + " statements, " + nodesCreated
                + " nodes, " + arena.bytesUsed() + " arena bytes");
        return new ProgramNode(statements, arena, new SourcePosition(1, 1, lexer.getFileName()));
    }

    /**
     * Parses a single declaration or statement, recovering from syntax errors.
     * @return The parsed node, or null if the statement was malformed.
     */
    private AstNode declaration() {
        int startOffset = current.offset();
        try {
            AstNode node = current.type().isBasicType() ? varDeclaration() : statement();
            if (panicMode) {
                synchronize(startOffset);
                return null;
            }
            return node;
        } catch (ParseError ex) {
            synchronize(startOffset);
            return null;
        }
    }

    private AstNode varDeclaration() {
        Token typeToken = advance();
        Token nameToken = consume(TokenType.IDENTIFIER, CompilerErrorCode.EXPECTED_IDENTIFIER,
                "Expected variable name after type");
        AstNode initializer = null;
        if (match(TokenType.ASSIGN)) {
            initializer = expression();
        }
        consume(TokenType.SEMICOLON, CompilerErrorCode.MISSING_DELIMITER,
                "Expected ';' after variable declaration");
        return node(new VarDeclarationNode(typeToken.type(), arena.intern(nameToken.lexeme()),
                initializer, typeToken.position()));
    }

    private AstNode statement() {
        if (match(TokenType.RETURN)) {
            return returnStatement();
        }
        return expressionStatement();
    }

    private AstNode returnStatement() {
        Token keyword = previous;
        AstNode value = null;
        if (!check(TokenType.SEMICOLON)) {
            value = expression();
        }
        consume(TokenType.SEMICOLON, CompilerErrorCode.MISSING_DELIMITER, "Expected ';' after return value");
        return node(new ReturnNode(value, keyword.position()));
    }

    private AstNode expressionStatement() {
        SourcePosition position = current.position();
        AstNode expression = expression();
        consume(TokenType.SEMICOLON, CompilerErrorCode.MISSING_DELIMITER, "Expected ';' after expression");
        return node(new ExpressionStatementNode(expression, position));
    }

    private AstNode expression() {
        return assignment();
    }

    private AstNode assignment() {
        AstNode target = logicalOr();

        if (match(TokenType.ASSIGN)) {
            Token equals = previous;
            AstNode value = assignment();
            if (target instanceof IdentifierNode) {
                return node(new AssignmentNode((IdentifierNode) target, value, equals.position()));
            }
            // Reported without unwinding; declaration() discards the statement afterwards.
            errorAt(equals, CompilerErrorCode.INVALID_ASSIGNMENT_TARGET, "Invalid assignment target");
        }
        return target;
    }

    private AstNode logicalOr() {
        AstNode expr = logicalAnd();
        while (match(TokenType.OR)) {
            expr = binary(expr, this::logicalAnd);
        }
        return expr;
    }

    private AstNode logicalAnd() {
        AstNode expr = equality();
        while (match(TokenType.AND)) {
            expr = binary(expr, this::equality);
        }
        return expr;
    }

    private AstNode equality() {
        AstNode expr = comparison();
        while (match(TokenType.EQUAL, TokenType.NOT_EQUAL)) {
            expr = binary(expr, this::comparison);
        }
        return expr;
    }

    private AstNode comparison() {
        AstNode expr = term();
        while (match(TokenType.LESS, TokenType.LESS_EQUAL, TokenType.GREATER, TokenType.GREATER_EQUAL)) {
            expr = binary(expr, this::term);
        }
        return expr;
    }

    private AstNode term() {
        AstNode expr = factor();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            expr = binary(expr, this::factor);
        }
        return expr;
    }

    private AstNode factor() {
        AstNode expr = unary();
        while (match(TokenType.MULTIPLY, TokenType.DIVIDE, TokenType.MODULO)) {
            expr = binary(expr, this::unary);
        }
        return expr;
    }

    private AstNode binary(AstNode left, Operand operand) {
        Token operator = previous;
        AstNode right = operand.parse();
        return node(new BinaryNode(left, operator.type(), right, operator.position()));
    }

    private AstNode unary() {
        if (match(TokenType.NOT, TokenType.MINUS)) {
            Token operator = previous;
            AstNode operand = unary();
            return node(new UnaryNode(operator.type(), operand, operator.position()));
        }
        return primary();
    }

    private AstNode primary() {
        Token token = current;
        switch (token.type()) {
            case INTEGER:
                advance();
                return node(new LiteralNode(LiteralKind.INTEGER, token.intValue(), token.position()));
            case FLOAT:
                advance();
                return node(new LiteralNode(LiteralKind.FLOAT, token.floatValue(), token.position()));
            case STRING:
                advance();
                return node(new LiteralNode(LiteralKind.STRING, arena.intern(token.quotedContent()), token.position()));
            case CHAR:
                advance();
                return node(new LiteralNode(LiteralKind.CHAR, arena.intern(token.quotedContent()), token.position()));
            case TRUE:
            case FALSE:
                advance();
                return node(new LiteralNode(LiteralKind.BOOLEAN, token.type() == TokenType.TRUE, token.position()));
            case NULL:
                advance();
                return node(new LiteralNode(LiteralKind.NULL, null, token.position()));
            case IDENTIFIER:
                advance();
                return node(new IdentifierNode(arena.intern(token.lexeme()), token.position()));
            case LPAREN: {
                advance();
                AstNode expr = expression();
                consume(TokenType.RPAREN, CompilerErrorCode.MISSING_DELIMITER, "Expected ')' after expression");
                return expr;
            }
            default:
                throw error(token, CompilerErrorCode.UNEXPECTED_TOKEN, "Expected expression");
        }
    }

    /**
     * Discards tokens until a statement boundary: the token just consumed is ';', or the
     * current token starts a declaration or control-flow statement. At least one token is
     * consumed when the failed statement did not consume any.
     */
    private void synchronize(int startOffset) {
        panicMode = false;
        if (current.offset() == startOffset && !isAtEnd()) {
            advance();
        }
        while (!isAtEnd()) {
            if (previous.type() == TokenType.SEMICOLON) return;
            if (current.type().startsStatement()) return;
            advance();
        }
    }

    private <T extends AstNode> T node(T node) {
        arena.allocate(NODE_SIZE, NODE_ALIGNMENT);
        nodesCreated++;
        return node;
    }

    private Token advance() {
        previous = current;
        Token next = lexer.next();
        while (next.type() == TokenType.NEWLINE) {
            next = lexer.next();
        }
        current = next;
        return previous;
    }

    private boolean check(TokenType type) {
        return current.type() == type;
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean isAtEnd() {
        return current.type() == TokenType.END_OF_FILE;
    }

    private Token consume(TokenType type, CompilerErrorCode code, String message) {
        if (check(type)) return advance();
        throw error(current, code, message);
    }

    private ParseError error(Token token, CompilerErrorCode code, String message) {
        errorAt(token, code, message);
        return new ParseError(message);
    }

    /**
     * Records an error unless the parser is already in panic mode. An error token from the
     * lexer is always reported as a lexical error carrying the lexer's own message.
     */
    private void errorAt(Token token, CompilerErrorCode code, String message) {
        if (panicMode) return;
        panicMode = true;
        hadError = true;

        if (token.type() == TokenType.ERROR) {
            code = CompilerErrorCode.LEXICAL_ERROR;
            message = token.errorMessage();
        } else if (token.type() == TokenType.END_OF_FILE) {
            message = message + " at end";
        } else {
            message = message + " at '" + token.lexeme() + "'";
        }
        SourcePosition position = token.position();
        errorMessage = String.format("Error at line %d, column %d: %s", position.line(), position.column(), message);
        diagnostics.reportError(code, message, position);
    }

    /**
     * @return {@code true} if any syntax error was recorded. Sticky.
     */
    public boolean hasError() {
        return hadError;
    }

    /**
     * @return The most recently recorded error, or an empty string.
     */
    public String getErrorMessage() {
        return errorMessage;
    }

    /**
     * @return The number of AST nodes created, including nodes of discarded statements.
     */
    public int nodesCreated() {
        return nodesCreated;
    }

    /**
     * @return The arena backing the parsed tree.
     */
    public Arena arena() {
        return arena;
    }

    /**
     * Releases the arena. Any {@link ProgramNode} produced by this parser becomes invalid.
     */
    @Override
    public void close() {
        arena.release();
    }

    @FunctionalInterface
    private interface Operand {
        AstNode parse();
    }

    /**
     * Unwinds the recursive descent to the enclosing {@link #declaration()}.
     */
    private static final class ParseError extends RuntimeException {
        ParseError(String message) {
            super(message, null, false, false);
        }
    }
}
