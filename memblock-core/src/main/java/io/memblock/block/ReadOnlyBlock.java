package io.memblock.block;

import io.memblock.core.TableSchema;
import io.memblock.kernel.Predicate;
import io.memblock.kernel.Selection;
import io.memblock.storage.ReadOnlyDataColumn;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Immutable block over a {@link SerializedBlock}, decoding each column lazily.
 * <p>
 * Comparisons are first checked against the column min/max recorded at write time, so
 * a leaf that cannot match resolves to no rows without decoding its column. Instances
 * are safe to share between threads.
 */
public final class ReadOnlyBlock extends ReadOnlyBlockBase {

    private final SerializedBlock serialized;
    private final List<LazyDataColumn> columns;

    ReadOnlyBlock(SerializedBlock serialized) {
        this.serialized = serialized;
        var lazyColumns = new ArrayList<LazyDataColumn>(serialized.columns().size());
        for (var i = 0; i < serialized.columns().size(); i++) {
            lazyColumns.add(new LazyDataColumn(columnType(i), serialized.columns().get(i)));
        }
        this.columns = List.copyOf(lazyColumns);
    }

    @Override
    public TableSchema schema() {
        return serialized.schema();
    }

    @Override
    public int recordCount() {
        return serialized.recordCount();
    }

    @Override
    public ReadOnlyDataColumn column(int columnIndex) {
        return columns.get(columnIndex);
    }

    public SerializedBlock serialized() {
        return serialized;
    }

    /**
     * Whether the column has been decoded by a previous access.
     */
    public boolean isColumnDecoded(int columnIndex) {
        return columns.get(columnIndex).isDecoded();
    }

    @Override
    protected Optional<Selection> prune(Predicate.Compare compare) {
        var type = columnType(compare.columnIndex());
        var value = compare.value();
        if (compare.operator() == Predicate.Operator.NEQ || value == null
                || !type.ordered() || !type.valueType().isInstance(value)) {
            return Optional.empty();
        }
        var stats = columns.get(compare.columnIndex()).source();
        if (stats.columnMinimum() == null) {
            // Only nulls, which no comparison with a non-null value matches
            return Optional.of(Selection.empty());
        }
        var min = compareTo(value, stats.columnMinimum());
        var max = compareTo(value, stats.columnMaximum());
        var excluded = switch (compare.operator()) {
            case EQ -> min < 0 || max > 0;
            case LT -> min <= 0;
            case LTE -> min < 0;
            case GT -> max >= 0;
            case GTE -> max > 0;
            case NEQ -> false;
        };
        return excluded ? Optional.of(Selection.empty()) : Optional.empty();
    }

    @SuppressWarnings("unchecked")
    private static int compareTo(Object value, Object extremum) {
        return ((Comparable<Object>) value).compareTo(extremum);
    }
}
