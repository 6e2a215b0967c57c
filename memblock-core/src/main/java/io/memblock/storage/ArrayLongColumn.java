package io.memblock.storage;

import io.memblock.core.ColumnType;
import io.memblock.encoding.Int64Codec;
import io.memblock.encoding.SerializedColumn;
import io.memblock.kernel.Predicate;

import java.util.Arrays;
import java.util.Set;

/**
 * Growable 64-bit integer column backed by a primitive array.
 * <p>
 * A nullable column stores null as {@link #NULL_VALUE}, which therefore cannot be
 * appended as a regular value. Scans run directly over the raw buffer.
 */
public final class ArrayLongColumn implements DataColumn {

    /** In-buffer representation of null in nullable columns. */
    public static final long NULL_VALUE = Long.MIN_VALUE;

    private final ColumnType columnType;
    private final boolean nullable;
    private long[] values;
    private int size;

    public ArrayLongColumn(boolean nullable) {
        this(nullable, 16);
    }

    public ArrayLongColumn(boolean nullable, int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("initialCapacity must be non-negative: " + initialCapacity);
        }
        this.nullable = nullable;
        this.columnType = nullable ? ColumnType.INT64_NULLABLE : ColumnType.INT64;
        this.values = new long[initialCapacity];
    }

    @Override
    public ColumnType columnType() {
        return columnType;
    }

    @Override
    public int recordCount() {
        return size;
    }

    @Override
    public Object getValue(int index) {
        ColumnChecks.checkIndex(index, size);
        var value = values[index];
        return nullable && value == NULL_VALUE ? null : value;
    }

    /**
     * Raw value at the given row, {@link #NULL_VALUE} for null in nullable columns.
     */
    public long getLong(int index) {
        ColumnChecks.checkIndex(index, size);
        return values[index];
    }

    @Override
    public void appendValue(Object value) {
        ColumnChecks.checkAppend(columnType, value);
        if (value == null) {
            appendRaw(NULL_VALUE);
            return;
        }
        appendLong((Long) value);
    }

    public void appendLong(long value) {
        if (nullable && value == NULL_VALUE) {
            throw new IllegalArgumentException("Long.MIN_VALUE is reserved for null in nullable columns");
        }
        appendRaw(value);
    }

    private void appendRaw(long value) {
        if (size == values.length) {
            values = Arrays.copyOf(values, Math.max(16, size * 2));
        }
        values[size++] = value;
    }

    @Override
    public int[] filter(Predicate.Operator operator, Object value) {
        ColumnChecks.checkFilter(columnType, operator, value);
        if (value == null) {
            return scanNull(operator == Predicate.Operator.EQ);
        }
        long target = (Long) value;
        if (nullable && target == NULL_VALUE) {
            // No stored value can equal the sentinel and every non-null value is greater
            return switch (operator) {
                case EQ, LT, LTE -> new int[0];
                case NEQ -> allRows();
                case GT, GTE -> scanNull(false);
            };
        }
        return scan(operator, target);
    }

    /**
     * Linear scan over the raw buffer. Null rows hold {@link #NULL_VALUE}, the smallest
     * long, so only LT and LTE need to skip them explicitly.
     */
    private int[] scan(Predicate.Operator operator, long target) {
        var data = values;
        var count = size;
        var results = new int[count];
        var found = 0;
        var skipNulls = nullable;
        switch (operator) {
            case EQ -> {
                for (var i = 0; i < count; i++) {
                    if (data[i] == target) {
                        results[found++] = i;
                    }
                }
            }
            case NEQ -> {
                for (var i = 0; i < count; i++) {
                    if (data[i] != target) {
                        results[found++] = i;
                    }
                }
            }
            case LT -> {
                for (var i = 0; i < count; i++) {
                    if (data[i] < target && !(skipNulls && data[i] == NULL_VALUE)) {
                        results[found++] = i;
                    }
                }
            }
            case LTE -> {
                for (var i = 0; i < count; i++) {
                    if (data[i] <= target && !(skipNulls && data[i] == NULL_VALUE)) {
                        results[found++] = i;
                    }
                }
            }
            case GT -> {
                for (var i = 0; i < count; i++) {
                    if (data[i] > target) {
                        results[found++] = i;
                    }
                }
            }
            case GTE -> {
                for (var i = 0; i < count; i++) {
                    if (data[i] >= target) {
                        results[found++] = i;
                    }
                }
            }
        }
        return found == count ? results : Arrays.copyOf(results, found);
    }

    private int[] scanNull(boolean matchNulls) {
        if (!nullable) {
            return matchNulls ? new int[0] : allRows();
        }
        var results = new int[size];
        var found = 0;
        for (var i = 0; i < size; i++) {
            if ((values[i] == NULL_VALUE) == matchNulls) {
                results[found++] = i;
            }
        }
        return Arrays.copyOf(results, found);
    }

    private int[] allRows() {
        var results = new int[size];
        for (var i = 0; i < size; i++) {
            results[i] = i;
        }
        return results;
    }

    @Override
    public int[] filterIn(Set<?> candidates) {
        ColumnChecks.checkFilterIn(columnType, candidates);
        var results = new int[size];
        var found = 0;
        for (var i = 0; i < size; i++) {
            if (candidates.contains(getValue(i))) {
                results[found++] = i;
            }
        }
        return Arrays.copyOf(results, found);
    }

    @Override
    public void reorder(int[] permutation) {
        ColumnChecks.checkPermutation(permutation, size);
        var reordered = new long[values.length];
        for (var i = 0; i < size; i++) {
            reordered[i] = values[permutation[i]];
        }
        values = reordered;
    }

    @Override
    public void deleteRecords(int[] sortedIndexes) {
        ColumnChecks.checkSortedIndexes(sortedIndexes, size);
        size = ColumnChecks.compact(values, size, sortedIndexes);
    }

    @Override
    public SerializedColumn serialize() {
        return nullable
                ? Int64Codec.compress(values, size, NULL_VALUE)
                : Int64Codec.compress(values, size);
    }

    @Override
    public void deserialize(SerializedColumn column) {
        var decoded = Int64Codec.decompress(column, NULL_VALUE);
        if (!nullable && column.hasNulls()) {
            throw new IllegalArgumentException("payload holds nulls but " + columnType + " is not nullable");
        }
        values = decoded;
        size = decoded.length;
    }

    @Override
    public void clear() {
        size = 0;
    }
}
