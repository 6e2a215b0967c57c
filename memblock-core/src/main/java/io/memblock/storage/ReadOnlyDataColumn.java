package io.memblock.storage;

import io.memblock.core.ColumnType;
import io.memblock.kernel.Predicate;

import java.util.Set;

/**
 * Read side of a typed column.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>Values are exposed in their external form: {@code null} for null, never a sentinel</li>
 *   <li>Filters return strictly ascending row indexes</li>
 *   <li>A filter value of another class than {@link ColumnType#valueType()} is rejected
 *       with {@link IllegalArgumentException}</li>
 *   <li>Ordering operators never match null rows; {@code NEQ v} does</li>
 * </ul>
 */
public interface ReadOnlyDataColumn {

    ColumnType columnType();

    int recordCount();

    /**
     * Value at the given row, or {@code null}.
     *
     * @throws IndexOutOfBoundsException if {@code index} is outside {@code [0, recordCount)}
     */
    Object getValue(int index);

    /**
     * Row indexes whose value satisfies {@code value(row) operator value}.
     *
     * @throws IllegalArgumentException      if {@code value} has the wrong type, or is null
     *                                       with an ordering operator
     * @throws UnsupportedOperationException if the column type does not support the operator
     */
    int[] filter(Predicate.Operator operator, Object value);

    /**
     * Row indexes whose value, null included, is contained in {@code values}.
     */
    int[] filterIn(Set<?> values);
}
