package org.shaylang.compiler.api;

/**
 * Counters collected while compiling one unit. Reported by the CLI, never used for control flow.
 *
 * @param tokensProduced Number of tokens pulled from the lexer.
 * @param nodesCreated Number of AST nodes allocated by the parser.
 * @param arenaBytesUsed Bytes consumed in the parser's arena.
 * @param linesGenerated Number of output lines written by the backend.
 * @param parseNanos Wall time spent lexing and parsing.
 * @param generationNanos Wall time spent in the backend.
 */
public record CompilationStatistics(
        long tokensProduced,
        int nodesCreated,
        long arenaBytesUsed,
        int linesGenerated,
        long parseNanos,
        long generationNanos
) {
}
