package io.memblock.block;

import io.memblock.core.TableSchema;
import io.memblock.kernel.Predicate;
import io.memblock.kernel.Selection;
import io.memblock.storage.ReadOnlyDataColumn;

import java.util.List;

/**
 * Row-aligned set of columns: one per schema column followed by the record id column.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>Every column holds exactly {@link #recordCount()} rows</li>
 *   <li>Row {@code i} of every column belongs to the same record</li>
 *   <li>Column {@code schema().recordIdColumnIndex()} holds non-null {@code Long} record ids</li>
 * </ul>
 */
public interface Block {

    TableSchema schema();

    int recordCount();

    /**
     * Column at the given position, the record id column included.
     *
     * @throws IndexOutOfBoundsException if {@code columnIndex > schema().recordIdColumnIndex()}
     */
    ReadOnlyDataColumn column(int columnIndex);

    /**
     * Resolves the predicate into the set of matching row indexes.
     */
    Selection filter(Predicate predicate);

    /**
     * Resolves the predicate and projects the matching rows, in row order.
     * <p>
     * Projection indexes may name schema columns, the record id column, or the row index
     * pseudo column ({@link TableSchema#rowIndexColumnIndex()}), which yields the row
     * position as an {@code Integer}.
     */
    List<Object[]> query(Predicate predicate, int... projection);
}
