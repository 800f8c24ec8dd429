package org.shaylang.compiler.frontend.parser.ast;

import org.shaylang.compiler.api.SourcePosition;
import org.shaylang.compiler.memory.Arena;

import java.util.List;

/**
 * The root of the AST: the ordered top-level statements of one compilation unit.
 * <p>
 * The program keeps a reference to the arena its nodes were allocated in. Once that arena is
 * released the tree must no longer be consumed; backends check {@link #isValid()} first.
 *
 * @param statements The top-level statements in source order.
 * @param arena The arena backing the nodes and their interned strings.
 * @param position The start of the source buffer.
 */
public record ProgramNode(List<AstNode> statements, Arena arena, SourcePosition position) implements AstNode {

    public ProgramNode {
        statements = List.copyOf(statements);
    }

    /**
     * @return {@code true} while the backing arena is alive.
     */
    public boolean isValid() {
        return !arena.isReleased();
    }

    /**
     * @return The number of top-level statements.
     */
    public int size() {
        return statements.size();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitProgram(this);
    }
}
