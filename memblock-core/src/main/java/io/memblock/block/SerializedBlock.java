package io.memblock.block;

import io.memblock.core.BlockCapacityException;
import io.memblock.core.TableSchema;
import io.memblock.encoding.ColumnStats;
import io.memblock.encoding.SerializedColumn;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;

/**
 * Compressed form of a block.
 * <p>
 * Payload layout, little-endian:
 * <pre>
 * [payloadLength : u16] x columnCount     schema columns, then record id
 * [column payload] x columnCount          same order
 * </pre>
 * The payload is not self-describing: reading it back needs the schema and the
 * {@link BlockStats} captured at write time.
 */
public final class SerializedBlock {

    /** Record counts are stored on 16 bits by the column codecs. */
    public static final int MAX_RECORD_COUNT = 0xFFFF;

    /** Column payload lengths are stored on 16 bits. */
    public static final int MAX_COLUMN_PAYLOAD_SIZE = 0xFFFF;

    private final TableSchema schema;
    private final List<SerializedColumn> columns;
    private final int recordCount;
    private final int size;

    private SerializedBlock(TableSchema schema, List<SerializedColumn> columns) {
        if (columns.size() != schema.columnCount() + 1) {
            throw new IllegalArgumentException("expected " + (schema.columnCount() + 1)
                    + " columns (schema + record id) but got " + columns.size());
        }
        var count = columns.get(0).itemCount();
        var total = Short.BYTES * columns.size();
        for (var i = 0; i < columns.size(); i++) {
            var column = columns.get(i);
            if (column.itemCount() != count) {
                throw new IllegalArgumentException("column " + i + " holds " + column.itemCount()
                        + " items, expected " + count);
            }
            if (column.payload().length > MAX_COLUMN_PAYLOAD_SIZE) {
                throw new IllegalArgumentException("column " + i + " payload is too large ("
                        + column.payload().length + " bytes)");
            }
            total += column.payload().length;
        }
        this.schema = schema;
        this.columns = List.copyOf(columns);
        this.recordCount = count;
        this.size = total;
    }

    public static SerializedBlock of(TableSchema schema, List<SerializedColumn> columns) {
        return new SerializedBlock(schema, columns);
    }

    /**
     * Reads a payload written by {@link #writeTo(ByteBuffer)} from the buffer's position
     * and advances the buffer past it.
     *
     * @param columnStats metadata captured with {@link #stats()}, one entry per column
     */
    public static SerializedBlock read(TableSchema schema, List<ColumnStats> columnStats, ByteBuffer source) {
        if (columnStats.size() != schema.columnCount() + 1) {
            throw new IllegalArgumentException("expected " + (schema.columnCount() + 1)
                    + " column stats but got " + columnStats.size());
        }
        for (var i = 0; i < columnStats.size(); i++) {
            Class<?> valueType = i < schema.columnCount() ? schema.column(i).type().valueType() : Long.class;
            checkExtremum(i, valueType, columnStats.get(i).columnMinimum());
            checkExtremum(i, valueType, columnStats.get(i).columnMaximum());
        }
        var reader = source.duplicate().order(ByteOrder.LITTLE_ENDIAN);
        var lengths = new int[columnStats.size()];
        for (var i = 0; i < lengths.length; i++) {
            lengths[i] = reader.getShort() & 0xFFFF;
        }
        var columns = new ArrayList<SerializedColumn>(lengths.length);
        for (var i = 0; i < lengths.length; i++) {
            if (reader.remaining() < lengths[i]) {
                throw new IllegalArgumentException("payload truncated in column " + i + ": "
                        + reader.remaining() + " < " + lengths[i]);
            }
            var payload = new byte[lengths[i]];
            reader.get(payload);
            columns.add(SerializedColumn.of(columnStats.get(i), payload));
        }
        source.position(reader.position());
        return new SerializedBlock(schema, columns);
    }

    private static void checkExtremum(int columnIndex, Class<?> valueType, Object extremum) {
        if (extremum != null && !valueType.isInstance(extremum)) {
            throw new IllegalArgumentException("column " + columnIndex + " stats hold a "
                    + extremum.getClass().getSimpleName() + " extremum, expected " + valueType.getSimpleName());
        }
    }

    public TableSchema schema() {
        return schema;
    }

    public int recordCount() {
        return recordCount;
    }

    /**
     * Payload size in bytes, column length table included.
     */
    public int size() {
        return size;
    }

    public List<SerializedColumn> columns() {
        return columns;
    }

    public BlockStats stats() {
        var columnStats = new ArrayList<ColumnStats>(columns.size());
        for (var column : columns) {
            columnStats.add(column.stats());
        }
        return new BlockStats(recordCount, size, columnStats);
    }

    public byte[] toPayload() {
        var buffer = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        writeTo(buffer);
        return buffer.array();
    }

    /**
     * Writes the payload at the buffer's position and advances it.
     *
     * @throws BlockCapacityException if fewer than {@link #size()} bytes remain
     */
    public void writeTo(ByteBuffer target) {
        if (target.remaining() < size) {
            throw new BlockCapacityException("Serialized block does not fit the target buffer",
                    size, target.remaining());
        }
        var writer = target.duplicate().order(ByteOrder.LITTLE_ENDIAN);
        for (var column : columns) {
            writer.putShort((short) column.payload().length);
        }
        for (var column : columns) {
            writer.put(column.payload());
        }
        target.position(writer.position());
    }

    public ReadOnlyBlock toReadOnlyBlock() {
        return new ReadOnlyBlock(this);
    }
}
