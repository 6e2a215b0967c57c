package io.memblock.storage;

import io.memblock.core.ColumnType;
import io.memblock.encoding.SerializedColumn;
import io.memblock.encoding.StringCodec;
import io.memblock.kernel.Predicate;

import java.util.Arrays;
import java.util.Set;

/**
 * Growable, always nullable string column.
 * <p>
 * Ordering operators use {@link String#compareTo(String)}.
 */
public final class ArrayStringColumn implements DataColumn {

    private String[] values;
    private int size;

    public ArrayStringColumn() {
        this(16);
    }

    public ArrayStringColumn(int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("initialCapacity must be non-negative: " + initialCapacity);
        }
        this.values = new String[initialCapacity];
    }

    @Override
    public ColumnType columnType() {
        return ColumnType.STRING;
    }

    @Override
    public int recordCount() {
        return size;
    }

    @Override
    public Object getValue(int index) {
        ColumnChecks.checkIndex(index, size);
        return values[index];
    }

    public String getString(int index) {
        ColumnChecks.checkIndex(index, size);
        return values[index];
    }

    @Override
    public void appendValue(Object value) {
        ColumnChecks.checkAppend(ColumnType.STRING, value);
        if (size == values.length) {
            values = Arrays.copyOf(values, Math.max(16, size * 2));
        }
        values[size++] = (String) value;
    }

    @Override
    public int[] filter(Predicate.Operator operator, Object value) {
        ColumnChecks.checkFilter(ColumnType.STRING, operator, value);
        var target = (String) value;
        var data = values;
        var results = new int[size];
        var found = 0;
        for (var i = 0; i < size; i++) {
            if (matches(data[i], operator, target)) {
                results[found++] = i;
            }
        }
        return Arrays.copyOf(results, found);
    }

    private static boolean matches(String current, Predicate.Operator operator, String target) {
        return switch (operator) {
            case EQ -> current == null ? target == null : current.equals(target);
            case NEQ -> current == null ? target != null : !current.equals(target);
            case LT -> current != null && current.compareTo(target) < 0;
            case LTE -> current != null && current.compareTo(target) <= 0;
            case GT -> current != null && current.compareTo(target) > 0;
            case GTE -> current != null && current.compareTo(target) >= 0;
        };
    }

    @Override
    public int[] filterIn(Set<?> candidates) {
        ColumnChecks.checkFilterIn(ColumnType.STRING, candidates);
        var results = new int[size];
        var found = 0;
        for (var i = 0; i < size; i++) {
            if (candidates.contains(values[i])) {
                results[found++] = i;
            }
        }
        return Arrays.copyOf(results, found);
    }

    @Override
    public void reorder(int[] permutation) {
        ColumnChecks.checkPermutation(permutation, size);
        var reordered = new String[values.length];
        for (var i = 0; i < size; i++) {
            reordered[i] = values[permutation[i]];
        }
        values = reordered;
    }

    @Override
    public void deleteRecords(int[] sortedIndexes) {
        ColumnChecks.checkSortedIndexes(sortedIndexes, size);
        var newSize = ColumnChecks.compact(values, size, sortedIndexes);
        Arrays.fill(values, newSize, size, null);
        size = newSize;
    }

    @Override
    public SerializedColumn serialize() {
        return StringCodec.compress(values, size);
    }

    @Override
    public void deserialize(SerializedColumn column) {
        values = StringCodec.decompress(column);
        size = values.length;
    }

    @Override
    public void clear() {
        Arrays.fill(values, 0, size, null);
        size = 0;
    }
}
