package io.memblock.core;

/**
 * Raised when data cannot fit the byte budget it is given: a single record larger
 * than the maximum block size, or a serialization target too small for a payload.
 * <p>
 * Never transient. Retrying with the same configuration fails the same way.
 */
public class BlockCapacityException extends MemblockException {

    private final int requiredSize;
    private final int availableSize;

    public BlockCapacityException(String message, int requiredSize, int availableSize) {
        super(message + " (required=" + requiredSize + ", available=" + availableSize + ")");
        this.requiredSize = requiredSize;
        this.availableSize = availableSize;
    }

    public int requiredSize() {
        return requiredSize;
    }

    public int availableSize() {
        return availableSize;
    }
}
