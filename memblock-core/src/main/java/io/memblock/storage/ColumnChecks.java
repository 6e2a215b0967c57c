package io.memblock.storage;

import io.memblock.core.ColumnType;
import io.memblock.kernel.Predicate;

import java.util.Set;

final class ColumnChecks {

    private ColumnChecks() {
    }

    static void checkValueType(ColumnType columnType, Object value) {
        if (value != null && !columnType.valueType().isInstance(value)) {
            throw new IllegalArgumentException("Value type mismatch for " + columnType + " column: expected "
                    + columnType.valueType().getSimpleName() + " but was " + value.getClass().getSimpleName());
        }
    }

    static void checkFilter(ColumnType columnType, Predicate.Operator operator, Object value) {
        if (operator == null) {
            throw new IllegalArgumentException("operator required");
        }
        if (operator.isOrdering() && !columnType.ordered()) {
            throw new UnsupportedOperationException(
                    "Operator " + operator + " is not supported by " + columnType + " columns");
        }
        checkValueType(columnType, value);
        if (operator.isOrdering() && value == null) {
            throw new IllegalArgumentException("Operator " + operator + " requires a non-null value");
        }
    }

    static void checkFilterIn(ColumnType columnType, Set<?> values) {
        if (values == null) {
            throw new IllegalArgumentException("values required");
        }
        for (var value : values) {
            checkValueType(columnType, value);
        }
    }

    static void checkAppend(ColumnType columnType, Object value) {
        if (value == null && !columnType.nullable()) {
            throw new IllegalArgumentException(columnType + " column is not nullable");
        }
        checkValueType(columnType, value);
    }

    static void checkIndex(int index, int recordCount) {
        if (index < 0 || index >= recordCount) {
            throw new IndexOutOfBoundsException("index out of range: " + index + " (recordCount=" + recordCount + ")");
        }
    }

    static void checkPermutation(int[] permutation, int recordCount) {
        if (permutation == null || permutation.length != recordCount) {
            throw new IllegalArgumentException("permutation length must equal recordCount " + recordCount);
        }
        var seen = new boolean[recordCount];
        for (var source : permutation) {
            if (source < 0 || source >= recordCount || seen[source]) {
                throw new IllegalArgumentException("not a permutation of [0, " + recordCount + "): " + source);
            }
            seen[source] = true;
        }
    }

    static void checkSortedIndexes(int[] sortedIndexes, int recordCount) {
        if (sortedIndexes == null) {
            throw new IllegalArgumentException("indexes required");
        }
        for (var i = 0; i < sortedIndexes.length; i++) {
            checkIndex(sortedIndexes[i], recordCount);
            if (i > 0 && sortedIndexes[i] <= sortedIndexes[i - 1]) {
                throw new IllegalArgumentException("indexes must be strictly increasing at position " + i);
            }
        }
    }

    /**
     * Stable in-place compaction shared by the array columns: moves each run of
     * surviving slots left past the deleted ones and returns the new record count.
     */
    static int compact(Object array, int recordCount, int[] sortedIndexes) {
        if (sortedIndexes.length == 0) {
            return recordCount;
        }
        var write = sortedIndexes[0];
        for (var k = 0; k < sortedIndexes.length; k++) {
            var runStart = sortedIndexes[k] + 1;
            var runEnd = k + 1 < sortedIndexes.length ? sortedIndexes[k + 1] : recordCount;
            var runLength = runEnd - runStart;
            if (runLength > 0) {
                System.arraycopy(array, runStart, array, write, runLength);
                write += runLength;
            }
        }
        return write;
    }
}
