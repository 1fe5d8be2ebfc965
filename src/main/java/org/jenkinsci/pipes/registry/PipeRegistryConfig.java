package org.jenkinsci.pipes.registry;

/**
 * Settings a {@link PipeRegistry} is created with. Fixed for the lifetime of the registry.
 */
public final class PipeRegistryConfig {

    public static final int DEFAULT_PIPE_COUNT = 1;

    public static final int DEFAULT_CAPACITY = 4096;

    public static final int DEFAULT_FIRST_ID = 0;

    private final int pipeCount;
    private final int capacity;
    private final int firstId;

    /**
     * @param pipeCount Number of pipes to create, positive.
     * @param capacity Ring capacity in bytes shared by all pipes, positive.
     * @param firstId Identifier of the first pipe; the others follow consecutively. Non-negative.
     * @throws IllegalArgumentException if a value is out of range.
     */
    public PipeRegistryConfig(int pipeCount, int capacity, int firstId) {
        if (pipeCount <= 0) {
            throw new IllegalArgumentException("Number of pipes must be positive: " + pipeCount);
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("Pipe capacity must be positive: " + capacity);
        }
        if (firstId < 0) {
            throw new IllegalArgumentException("First pipe identifier must not be negative: " + firstId);
        }
        if (firstId > Integer.MAX_VALUE - (pipeCount - 1)) {
            throw new IllegalArgumentException(
                    "Identifiers of " + pipeCount + " pipes starting at " + firstId + " overflow");
        }
        this.pipeCount = pipeCount;
        this.capacity = capacity;
        this.firstId = firstId;
    }

    public PipeRegistryConfig() {
        this(DEFAULT_PIPE_COUNT, DEFAULT_CAPACITY, DEFAULT_FIRST_ID);
    }

    public int getPipeCount() {
        return pipeCount;
    }

    public int getCapacity() {
        return capacity;
    }

    public int getFirstId() {
        return firstId;
    }

    @Override
    public String toString() {
        return "PipeRegistryConfig[pipes=" + pipeCount + ", capacity=" + capacity + ", firstId=" + firstId + "]";
    }
}
