package org.shaylang.compiler.frontend.parser.ast;

/**
 * The kinds of literal values a {@link LiteralNode} can hold.
 */
public enum LiteralKind {
    /** A signed 64-bit integer, value is a {@link Long}. */
    INTEGER,
    /** An IEEE double, value is a {@link Double}. */
    FLOAT,
    /** The raw characters between the quotes, escapes undecoded; value is a {@link String}. */
    STRING,
    /** The raw characters between the single quotes; value is a {@link String}. */
    CHAR,
    /** {@code true} or {@code false}; value is a {@link Boolean}. */
    BOOLEAN,
    /** The {@code null} literal; value is null. */
    NULL
}
