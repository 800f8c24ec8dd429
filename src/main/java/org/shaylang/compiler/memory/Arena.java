package org.shaylang.compiler.memory;

import org.shaylang.compiler.diagnostics.CompilerLogger;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * A region allocator. Storage is a chain of fixed-size blocks; allocation bumps the offset
 * of the newest block and never moves earlier allocations. Individual allocations are never
 * freed: {@link #reset()} rewinds the whole region, {@link #release()} ends its lifetime.
 * <p>
 * The parser owns one arena per compilation unit. Every AST node reserves its footprint here
 * and every string that must outlive the source buffer is copied in via {@link #intern(CharSequence)}.
 * <p>
 * Not thread-safe.
 */
public final class Arena {

    /** Default size of a single block in bytes. */
    public static final int DEFAULT_BLOCK_SIZE = 64 * 1024;
    /** Default maximum number of chained blocks. */
    public static final int DEFAULT_MAX_BLOCKS = 256;

    private final int blockSize;
    private final int maxBlocks;
    private final List<byte[]> blocks = new ArrayList<>();
    private int currentBlock = 0;
    private int offset = 0;
    private long bytesUsed = 0;
    private long allocationCount = 0;
    private boolean released = false;

    /**
     * Creates an arena with the default block size and limit.
     */
    public Arena() {
        this(DEFAULT_BLOCK_SIZE, DEFAULT_MAX_BLOCKS);
    }

    /**
     * Creates an arena.
     * @param blockSize The size of each block in bytes.
     * @param maxBlocks The maximum number of blocks that may be chained.
     */
    public Arena(int blockSize, int maxBlocks) {
        if (blockSize <= 0) throw new IllegalArgumentException("blockSize must be positive: " + blockSize);
        if (maxBlocks <= 0) throw new IllegalArgumentException("maxBlocks must be positive: " + maxBlocks);
        this.blockSize = blockSize;
        this.maxBlocks = maxBlocks;
        blocks.add(new byte[blockSize]);
    }

    /**
     * Reserves {@code size} bytes aligned to {@code alignment}.
     *
     * @param size The number of bytes, zero or more.
     * @param alignment The required alignment, a power of two.
     * @return The allocation handle.
     * @throws ArenaExhaustedException if neither the current block nor a new one can hold the request.
     * @throws IllegalStateException if the arena was released.
     */
    public Allocation allocate(int size, int alignment) {
        ensureAlive();
        if (size < 0) throw new IllegalArgumentException("size must not be negative: " + size);
        if (alignment <= 0 || Integer.bitCount(alignment) != 1) {
            throw new IllegalArgumentException("alignment must be a power of two: " + alignment);
        }
        if (size > blockSize) {
            throw new ArenaExhaustedException(size, capacity());
        }

        int aligned = alignUp(offset, alignment);
        if (aligned + size > blockSize) {
            nextBlock(size);
            aligned = 0;
        }

        Allocation allocation = new Allocation(currentBlock, aligned, size);
        bytesUsed += (aligned - offset) + size;
        offset = aligned + size;
        allocationCount++;
        return allocation;
    }

    /**
     * Copies the given text into arena storage and returns a string built from that copy.
     * The result never shares storage with the argument.
     *
     * @param text The text to copy.
     * @return The interned copy.
     * @throws ArenaExhaustedException if the arena cannot hold the encoded text.
     */
    public String intern(CharSequence text) {
        byte[] encoded = text.toString().getBytes(StandardCharsets.UTF_8);
        Allocation allocation = allocate(encoded.length, 1);
        byte[] block = blocks.get(allocation.block());
        System.arraycopy(encoded, 0, block, allocation.offset(), encoded.length);
        return new String(block, allocation.offset(), allocation.size(), StandardCharsets.UTF_8);
    }

    /**
     * Rewinds the arena to empty. Blocks stay allocated and are reused by later allocations.
     * Every handle and every node created before the reset must be considered invalid.
     */
    public void reset() {
        ensureAlive();
        currentBlock = 0;
        offset = 0;
        bytesUsed = 0;
        allocationCount = 0;
    }

    /**
     * Ends the lifetime of the arena. Subsequent allocations fail, and consumers holding
     * data backed by this arena must treat it as invalid.
     */
    public void release() {
        if (released) return;
        CompilerLogger.trace("Arena released after " + allocationCount + " allocations, " + bytesUsed + " bytes");
        blocks.clear();
        released = true;
    }

    /**
     * @return {@code true} once {@link #release()} has been called.
     */
    public boolean isReleased() {
        return released;
    }

    /**
     * @return The number of bytes consumed, including alignment padding and block tails skipped when chaining.
     */
    public long bytesUsed() {
        return bytesUsed;
    }

    /**
     * @return The maximum number of bytes the arena can hold across all blocks.
     */
    public long capacity() {
        return (long) blockSize * maxBlocks;
    }

    /**
     * @return The number of blocks currently in use.
     */
    public int blockCount() {
        return currentBlock + 1;
    }

    /**
     * @return The number of successful allocations since creation or the last reset.
     */
    public long allocationCount() {
        return allocationCount;
    }

    private void nextBlock(int size) {
        if (currentBlock + 1 >= maxBlocks) {
            throw new ArenaExhaustedException(size, capacity());
        }
        bytesUsed += blockSize - offset;
        currentBlock++;
        if (currentBlock == blocks.size()) {
            blocks.add(new byte[blockSize]);
        }
        offset = 0;
    }

    private void ensureAlive() {
        if (released) throw new IllegalStateException("Arena has been released");
    }

    private static int alignUp(int value, int alignment) {
        return (value + alignment - 1) & -alignment;
    }
}
