package io.memblock.storage;

import io.memblock.core.ColumnType;

/**
 * Boolean column stored as {@code 1}/{@code 0} in an {@link ArrayIntColumn}.
 * <p>
 * Only {@code EQ} and {@code NEQ} apply; ordering operators raise
 * {@link UnsupportedOperationException}.
 */
public final class ArrayBoolColumn extends TransformProxyColumn<Boolean, Integer> {

    public ArrayBoolColumn(boolean nullable) {
        this(nullable, 16);
    }

    public ArrayBoolColumn(boolean nullable, int initialCapacity) {
        super(nullable ? ColumnType.BOOL_NULLABLE : ColumnType.BOOL,
                Boolean.class,
                Integer.class,
                new ArrayIntColumn(nullable, initialCapacity),
                value -> value ? 1 : 0,
                value -> value != 0);
    }
}
