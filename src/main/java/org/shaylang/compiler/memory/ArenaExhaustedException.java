package org.shaylang.compiler.memory;

/**
 * Thrown when an {@link Arena} cannot satisfy an allocation. This is a resource error:
 * the enclosing compilation phase must stop and report it.
 */
public class ArenaExhaustedException extends RuntimeException {

    private final int requested;
    private final long capacity;

    /**
     * @param requested The number of bytes that could not be allocated.
     * @param capacity The total capacity of the arena at the time of failure.
     */
    public ArenaExhaustedException(int requested, long capacity) {
        super(String.format("Arena exhausted: cannot allocate %d bytes (capacity %d bytes)", requested, capacity));
        this.requested = requested;
        this.capacity = capacity;
    }

    /**
     * @return The number of bytes that could not be allocated.
     */
    public int getRequested() {
        return requested;
    }

    /**
     * @return The arena capacity in bytes.
     */
    public long getCapacity() {
        return capacity;
    }
}
