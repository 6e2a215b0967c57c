package io.memblock.core;

/**
 * Immutable configuration for block builders.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * MemblockConfiguration config = MemblockConfiguration.builder()
 *     .maxBlockSize(8192)
 *     .truncationTolerance(0.02)
 *     .build();
 * </pre>
 * <p>
 * All configuration is immutable once built.
 *
 * @see io.memblock.block.BlockBuilder
 */
public final class MemblockConfiguration {

    private static final MemblockConfiguration DEFAULTS = builder().build();

    // Serialization budget
    private final int maxBlockSize;

    // Truncation search
    private final int truncationSeedRecordCount;
    private final int maxTruncationRounds;
    private final double truncationTolerance;

    private MemblockConfiguration(Builder builder) {
        if (builder.maxBlockSize <= 0) {
            throw new IllegalArgumentException("maxBlockSize must be positive: " + builder.maxBlockSize);
        }
        if (builder.truncationSeedRecordCount <= 0) {
            throw new IllegalArgumentException(
                    "truncationSeedRecordCount must be positive: " + builder.truncationSeedRecordCount);
        }
        if (builder.maxTruncationRounds <= 0) {
            throw new IllegalArgumentException(
                    "maxTruncationRounds must be positive: " + builder.maxTruncationRounds);
        }
        if (!(builder.truncationTolerance > 0d && builder.truncationTolerance < 1d)) {
            throw new IllegalArgumentException(
                    "truncationTolerance must be in (0, 1): " + builder.truncationTolerance);
        }
        this.maxBlockSize = builder.maxBlockSize;
        this.truncationSeedRecordCount = builder.truncationSeedRecordCount;
        this.maxTruncationRounds = builder.maxTruncationRounds;
        this.truncationTolerance = builder.truncationTolerance;
    }

    /**
     * Create a new builder for MemblockConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Configuration with every default value.
     */
    public static MemblockConfiguration defaults() {
        return DEFAULTS;
    }

    /**
     * Get the default byte budget of a serialized block.
     *
     * @return max block size in bytes
     */
    public int maxBlockSize() {
        return maxBlockSize;
    }

    /**
     * Get the record count of the first truncation candidate.
     *
     * @return seed record count
     */
    public int truncationSeedRecordCount() {
        return truncationSeedRecordCount;
    }

    /**
     * Get the number of interpolation rounds after which a fitting candidate is accepted.
     *
     * @return maximum interpolation rounds
     */
    public int maxTruncationRounds() {
        return maxTruncationRounds;
    }

    /**
     * Get the relative distance to the budget at which a fitting candidate is accepted.
     *
     * @return tolerance as a fraction of the budget
     */
    public double truncationTolerance() {
        return truncationTolerance;
    }

    /**
     * Builder for MemblockConfiguration.
     * <p>
     * Provides a fluent API for building configuration instances.
     */
    public static class Builder {
        private int maxBlockSize = 4096;
        private int truncationSeedRecordCount = 100;
        private int maxTruncationRounds = 5;
        private double truncationTolerance = 0.05d;

        private Builder() {
        }

        /**
         * Set the default byte budget used by {@code truncateBlock()}.
         *
         * @param maxBlockSize the budget in bytes
         * @return this builder for method chaining
         */
        public Builder maxBlockSize(int maxBlockSize) {
            this.maxBlockSize = maxBlockSize;
            return this;
        }

        /**
         * Set the record count of the first truncation candidate.
         *
         * @param truncationSeedRecordCount the seed record count (default: 100)
         * @return this builder for method chaining
         */
        public Builder truncationSeedRecordCount(int truncationSeedRecordCount) {
            this.truncationSeedRecordCount = truncationSeedRecordCount;
            return this;
        }

        /**
         * Set the interpolation round cap.
         *
         * @param maxTruncationRounds the round cap (default: 5)
         * @return this builder for method chaining
         */
        public Builder maxTruncationRounds(int maxTruncationRounds) {
            this.maxTruncationRounds = maxTruncationRounds;
            return this;
        }

        /**
         * Set the acceptance tolerance.
         *
         * @param truncationTolerance fraction of the budget (default: 0.05)
         * @return this builder for method chaining
         */
        public Builder truncationTolerance(double truncationTolerance) {
            this.truncationTolerance = truncationTolerance;
            return this;
        }

        /**
         * Build the immutable MemblockConfiguration.
         *
         * @return a new MemblockConfiguration instance
         * @throws IllegalArgumentException if a value is out of range
         */
        public MemblockConfiguration build() {
            return new MemblockConfiguration(this);
        }
    }
}
