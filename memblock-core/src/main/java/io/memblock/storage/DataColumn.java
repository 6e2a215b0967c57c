package io.memblock.storage;

import io.memblock.encoding.SerializedColumn;

/**
 * Mutable typed column owned by a block builder.
 * <p>
 * Not thread-safe; callers serialize mutations.
 */
public interface DataColumn extends ReadOnlyDataColumn {

    /**
     * Appends one value, {@code null} meaning null.
     *
     * @throws IllegalArgumentException if the value has the wrong type, is null for a
     *                                  non-nullable column, or collides with the column's
     *                                  null sentinel
     */
    void appendValue(Object value);

    /**
     * Rearranges the rows so that row {@code i} becomes the former row {@code permutation[i]}.
     *
     * @throws IllegalArgumentException if {@code permutation} is not a permutation of
     *                                  {@code [0, recordCount)}
     */
    void reorder(int[] permutation);

    /**
     * Removes the given rows, compacting the remaining ones in place and keeping their order.
     *
     * @param sortedIndexes strictly increasing row indexes
     * @throws IllegalArgumentException  if the indexes are not strictly increasing
     * @throws IndexOutOfBoundsException if an index is outside {@code [0, recordCount)}
     */
    void deleteRecords(int[] sortedIndexes);

    /**
     * Compresses the column.
     *
     * @throws IllegalArgumentException if the column is empty or holds more than 65,535 rows
     */
    SerializedColumn serialize();

    /**
     * Replaces the content of the column with a decoded payload.
     */
    void deserialize(SerializedColumn column);

    void clear();
}
