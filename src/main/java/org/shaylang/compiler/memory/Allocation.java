package org.shaylang.compiler.memory;

/**
 * A block of arena storage handed out by {@link Arena#allocate(int, int)}.
 * The handle stays valid, and its address stable, until the owning arena is reset or released.
 *
 * @param block The index of the arena block holding the storage.
 * @param offset The aligned byte offset inside the block.
 * @param size The number of bytes reserved.
 */
public record Allocation(int block, int offset, int size) {
}
