package io.memblock.block;

import io.memblock.core.ColumnType;
import io.memblock.encoding.SerializedColumn;
import io.memblock.kernel.Predicate;
import io.memblock.storage.DataColumn;
import io.memblock.storage.DataColumns;
import io.memblock.storage.ReadOnlyDataColumn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Read-only column decoded from its payload on first access.
 * <p>
 * <b>Thread-safety:</b> concurrent first readers decode exactly once; the decoded
 * column is published through a volatile field and never mutated afterwards.
 */
final class LazyDataColumn implements ReadOnlyDataColumn {

    private static final Logger LOG = LoggerFactory.getLogger(LazyDataColumn.class);

    private final ColumnType columnType;
    private final SerializedColumn source;
    private volatile DataColumn decoded;

    LazyDataColumn(ColumnType columnType, SerializedColumn source) {
        this.columnType = columnType;
        this.source = source;
    }

    @Override
    public ColumnType columnType() {
        return columnType;
    }

    @Override
    public int recordCount() {
        return source.itemCount();
    }

    @Override
    public Object getValue(int index) {
        return decoded().getValue(index);
    }

    @Override
    public int[] filter(Predicate.Operator operator, Object value) {
        return decoded().filter(operator, value);
    }

    @Override
    public int[] filterIn(Set<?> values) {
        return decoded().filterIn(values);
    }

    boolean isDecoded() {
        return decoded != null;
    }

    SerializedColumn source() {
        return source;
    }

    private DataColumn decoded() {
        var column = decoded;
        if (column == null) {
            synchronized (this) {
                column = decoded;
                if (column == null) {
                    column = DataColumns.create(columnType, 0);
                    column.deserialize(source);
                    LOG.trace("Decoded {} column of {} rows", columnType, source.itemCount());
                    decoded = column;
                }
            }
        }
        return column;
    }
}
