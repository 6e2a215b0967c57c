package io.memblock.block;

import io.memblock.core.ColumnType;
import io.memblock.kernel.Predicate;
import io.memblock.kernel.Selection;
import io.memblock.storage.ReadOnlyDataColumn;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Query side shared by builders and read-only blocks: predicate resolution and projection.
 */
public abstract class ReadOnlyBlockBase implements Block {

    @Override
    public Selection filter(Predicate predicate) {
        return PredicateResolver.resolve(predicate, recordCount(), this::resolveLeaf);
    }

    @Override
    public List<Object[]> query(Predicate predicate, int... projection) {
        checkProjection(projection);
        var rows = filter(predicate).toIntArray();
        var rowIndexColumn = schema().rowIndexColumnIndex();
        var columns = new ReadOnlyDataColumn[projection.length];
        for (var j = 0; j < projection.length; j++) {
            if (projection[j] != rowIndexColumn) {
                columns[j] = column(projection[j]);
            }
        }
        var result = new ArrayList<Object[]>(rows.length);
        for (var row : rows) {
            var record = new Object[projection.length];
            for (var j = 0; j < projection.length; j++) {
                record[j] = columns[j] == null ? Integer.valueOf(row) : columns[j].getValue(row);
            }
            result.add(record);
        }
        return result;
    }

    /**
     * Type of any column of the block, the record id column included.
     */
    public ColumnType columnType(int columnIndex) {
        checkColumnIndex(columnIndex);
        return columnIndex == schema().recordIdColumnIndex()
                ? ColumnType.INT64
                : schema().column(columnIndex).type();
    }

    /**
     * Gives subclasses a chance to answer a comparison without scanning its column.
     *
     * @return the matching rows, or empty to fall back to a column scan
     */
    protected Optional<Selection> prune(Predicate.Compare compare) {
        return Optional.empty();
    }

    private Selection resolveLeaf(Predicate leaf) {
        if (leaf instanceof Predicate.Compare compare) {
            checkColumnIndex(compare.columnIndex());
            var pruned = prune(compare);
            if (pruned.isPresent()) {
                return pruned.get();
            }
            var column = column(compare.columnIndex());
            return Selection.fromScanIndices(column.filter(compare.operator(), compare.value()));
        }
        if (leaf instanceof Predicate.MemberOf memberOf) {
            checkColumnIndex(memberOf.columnIndex());
            return Selection.fromScanIndices(column(memberOf.columnIndex()).filterIn(memberOf.values()));
        }
        throw new IllegalStateException("Not a leaf predicate: " + leaf);
    }

    protected void checkColumnIndex(int columnIndex) {
        if (columnIndex < 0 || columnIndex > schema().recordIdColumnIndex()) {
            throw new IllegalArgumentException("Column index " + columnIndex + " out of range for table '"
                    + schema().tableName() + "' (" + schema().columnCount() + " columns + record id)");
        }
    }

    private void checkProjection(int[] projection) {
        if (projection == null) {
            throw new IllegalArgumentException("projection required");
        }
        for (var columnIndex : projection) {
            if (columnIndex != schema().rowIndexColumnIndex()) {
                checkColumnIndex(columnIndex);
            }
        }
    }
}
