package io.memblock.encoding;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Compressed column payload together with the metadata needed to decode it.
 */
public record SerializedColumn(
        int itemCount,
        boolean hasNulls,
        Object columnMinimum,
        Object columnMaximum,
        byte[] payload) {

    public SerializedColumn {
        if (itemCount < 0) {
            throw new IllegalArgumentException("itemCount must be non-negative: " + itemCount);
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload required");
        }
    }

    public static SerializedColumn of(ColumnStats stats, byte[] payload) {
        return new SerializedColumn(
                stats.itemCount(),
                stats.hasNulls(),
                stats.columnMinimum(),
                stats.columnMaximum(),
                payload);
    }

    public ColumnStats stats() {
        return new ColumnStats(itemCount, hasNulls, columnMinimum, columnMaximum);
    }

    /**
     * Same payload and counts with different min/max, used when a column exposes
     * another value type than the one it stores.
     */
    public SerializedColumn withExtrema(Object minimum, Object maximum) {
        return new SerializedColumn(itemCount, hasNulls, minimum, maximum, payload);
    }

    /**
     * Little-endian read-only view over the payload, positioned at its start.
     */
    public ByteBuffer payloadBuffer() {
        return ByteBuffer.wrap(payload).asReadOnlyBuffer().order(ByteOrder.LITTLE_ENDIAN);
    }
}
