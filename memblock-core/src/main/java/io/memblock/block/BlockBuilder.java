package io.memblock.block;

import io.memblock.core.BlockCapacityException;
import io.memblock.core.MemblockConfiguration;
import io.memblock.core.TableSchema;
import io.memblock.encoding.SerializedColumn;
import io.memblock.kernel.Predicates;
import io.memblock.kernel.Selection;
import io.memblock.storage.ArrayLongColumn;
import io.memblock.storage.DataColumn;
import io.memblock.storage.DataColumns;
import io.memblock.storage.ReadOnlyDataColumn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;
import java.util.function.ToIntFunction;

/**
 * Mutable block: grows by appending records or other blocks, shrinks by deletion and
 * truncation, and serializes into a {@link SerializedBlock}.
 * <p>
 * Not thread-safe; callers serialize every mutation.
 */
public final class BlockBuilder extends ReadOnlyBlockBase {

    private static final Logger LOG = LoggerFactory.getLogger(BlockBuilder.class);

    private final TableSchema schema;
    private final MemblockConfiguration configuration;
    private final List<DataColumn> columns;
    private final ArrayLongColumn recordIds;

    public BlockBuilder(TableSchema schema) {
        this(schema, MemblockConfiguration.defaults());
    }

    public BlockBuilder(TableSchema schema, MemblockConfiguration configuration) {
        if (schema == null) {
            throw new IllegalArgumentException("schema required");
        }
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        this.schema = schema;
        this.configuration = configuration;
        this.columns = new ArrayList<>(schema.columnCount() + 1);
        for (var column : schema.columns()) {
            columns.add(DataColumns.create(column.type()));
        }
        this.recordIds = new ArrayLongColumn(false);
        columns.add(recordIds);
    }

    /**
     * Builder holding every record of the given blocks, in order.
     *
     * @throws IllegalArgumentException if the blocks do not share compatible schemas
     */
    public static BlockBuilder merge(MemblockConfiguration configuration, Block first, Block... others) {
        var merged = new BlockBuilder(first.schema(), configuration);
        merged.appendBlock(first);
        for (var other : others) {
            merged.appendBlock(other);
        }
        LOG.debug("Merged {} blocks of table '{}' into {} records",
                others.length + 1, first.schema().tableName(), merged.recordCount());
        return merged;
    }

    public static BlockBuilder merge(Block first, Block... others) {
        return merge(MemblockConfiguration.defaults(), first, others);
    }

    /**
     * Builder holding the decoded content of a serialized block.
     */
    public static BlockBuilder fromSerialized(SerializedBlock serialized, MemblockConfiguration configuration) {
        var builder = new BlockBuilder(serialized.schema(), configuration);
        for (var i = 0; i < builder.columns.size(); i++) {
            builder.columns.get(i).deserialize(serialized.columns().get(i));
        }
        return builder;
    }

    @Override
    public TableSchema schema() {
        return schema;
    }

    public MemblockConfiguration configuration() {
        return configuration;
    }

    @Override
    public int recordCount() {
        return recordIds.recordCount();
    }

    @Override
    public ReadOnlyDataColumn column(int columnIndex) {
        return columns.get(columnIndex);
    }

    public long recordId(int rowIndex) {
        return recordIds.getLong(rowIndex);
    }

    public OptionalLong maxRecordId() {
        var count = recordIds.recordCount();
        if (count == 0) {
            return OptionalLong.empty();
        }
        var max = Long.MIN_VALUE;
        for (var i = 0; i < count; i++) {
            max = Math.max(max, recordIds.getLong(i));
        }
        return OptionalLong.of(max);
    }

    /**
     * Appends one record: one value per schema column, in schema order.
     *
     * @throws IllegalArgumentException if the value count or a value type does not match
     *                                  the schema; the builder is left unchanged
     */
    public void appendRecord(long recordId, Object... values) {
        if (values == null || values.length != schema.columnCount()) {
            throw new IllegalArgumentException("expected " + schema.columnCount() + " values but got "
                    + (values == null ? 0 : values.length));
        }
        var row = Arrays.copyOf(values, values.length + 1);
        row[values.length] = recordId;
        appendRow(row);
    }

    /**
     * Appends every record of another block, record ids included.
     *
     * @throws IllegalArgumentException if the column types differ
     */
    public void appendBlock(Block other) {
        if (!schema.areColumnsCompatible(other.schema())) {
            throw new IllegalArgumentException("Incompatible columns: cannot append block of table '"
                    + other.schema().tableName() + "' to table '" + schema.tableName() + "'");
        }
        var projection = new int[columns.size()];
        for (var i = 0; i < projection.length; i++) {
            projection[i] = i;
        }
        for (var row : other.query(Predicates.allRows(), projection)) {
            appendRow(row);
        }
    }

    private void appendRow(Object[] row) {
        var appended = 0;
        try {
            for (; appended < columns.size(); appended++) {
                columns.get(appended).appendValue(row[appended]);
            }
        } catch (RuntimeException e) {
            // Keep columns aligned: drop the partial row before rethrowing
            var last = new int[] {recordCount()};
            for (var i = 0; i < appended; i++) {
                columns.get(i).deleteRecords(last);
            }
            throw e;
        }
    }

    /**
     * Sorts every column by ascending record id; equal ids keep their relative order.
     */
    public void orderByRecordId() {
        var count = recordCount();
        var sorted = true;
        for (var i = 1; i < count && sorted; i++) {
            sorted = recordIds.getLong(i - 1) <= recordIds.getLong(i);
        }
        if (sorted) {
            return;
        }
        var order = new Integer[count];
        for (var i = 0; i < count; i++) {
            order[i] = i;
        }
        Arrays.sort(order, (a, b) -> Long.compare(recordIds.getLong(a), recordIds.getLong(b)));
        var permutation = new int[count];
        for (var i = 0; i < count; i++) {
            permutation[i] = order[i];
        }
        for (var column : columns) {
            column.reorder(permutation);
        }
    }

    /**
     * Deletes the records carrying the given ids.
     *
     * @return the ids that were found and deleted
     */
    public Set<Long> deleteRecordsByRecordId(Collection<Long> ids) {
        if (ids == null) {
            throw new IllegalArgumentException("ids required");
        }
        var indexes = recordIds.filterIn(new HashSet<>(ids));
        var found = new LinkedHashSet<Long>();
        for (var index : indexes) {
            found.add(recordIds.getLong(index));
        }
        deleteRecordsByRecordIndex(indexes);
        return found;
    }

    /**
     * Deletes the records at the given row positions, in any order; duplicates are ignored.
     *
     * @throws IllegalArgumentException  if a position is negative
     * @throws IndexOutOfBoundsException if a position is not below {@code recordCount()}
     */
    public void deleteRecordsByRecordIndex(int... indexes) {
        var sorted = Selection.of(indexes).toIntArray();
        if (sorted.length == 0) {
            return;
        }
        for (var column : columns) {
            column.deleteRecords(sorted);
        }
    }

    public void clear() {
        for (var column : columns) {
            column.clear();
        }
    }

    /**
     * @throws IllegalArgumentException if the block is empty or exceeds 65,535 records
     */
    public SerializedBlock serialize() {
        if (recordCount() > SerializedBlock.MAX_RECORD_COUNT) {
            throw new IllegalArgumentException("Block is too large to be serialized (" + recordCount()
                    + " records); truncate it first");
        }
        var serialized = new ArrayList<SerializedColumn>(columns.size());
        for (var column : columns) {
            serialized.add(column.serialize());
        }
        return SerializedBlock.of(schema, serialized);
    }

    /**
     * Size of the payload {@link #serialize()} would produce.
     */
    public int serializedSize() {
        var size = Short.BYTES * columns.size();
        for (var column : columns) {
            size += column.serialize().payload().length;
        }
        return size;
    }

    /**
     * {@link #truncateBlock(int)} with the configured maximum block size.
     */
    public BlockBuilder truncateBlock() {
        return truncateBlock(configuration.maxBlockSize());
    }

    /**
     * Moves the longest prefix of records whose serialized size fits {@code maxSize}, or
     * close to it, into a new builder.
     * <p>
     * Serialized size grows with the record count, nearly linearly for homogeneous data,
     * so candidates are found by secant interpolation over measured {@code (count, size)}
     * points within a bracket {@code [known fit, known over]}. A fitting candidate within
     * the configured tolerance of {@code maxSize}, or the last fitting one after the
     * configured number of rounds, is accepted. A candidate with a column payload above
     * {@link SerializedBlock#MAX_COLUMN_PAYLOAD_SIZE} never fits, whatever its total size.
     * The accepted prefix is deleted from this builder.
     *
     * @throws BlockCapacityException if a single record does not fit
     * @throws IllegalStateException  if measured sizes contradict a monotone size curve
     */
    public BlockBuilder truncateBlock(int maxSize) {
        return truncateBlock(maxSize, block -> block.truncationSize(maxSize));
    }

    // Search over the sizes reported by the given measure; sizes above maxSize never fit
    BlockBuilder truncateBlock(int maxSize, ToIntFunction<BlockBuilder> measure) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        var total = recordCount();
        if (total == 0) {
            throw new IllegalArgumentException("Cannot truncate an empty block");
        }
        var limit = Math.min(total, SerializedBlock.MAX_RECORD_COUNT);
        var tolerance = configuration.truncationTolerance() * maxSize;

        // Bracket: fitCount always fits, overCount (when >= 0) never does
        var fitCount = 0;
        var fitSize = 0;
        BlockBuilder fitBlock = null;
        var overCount = -1;
        var overSize = 0;

        var previousCount = 0;
        var previousSize = 0;
        var candidate = Math.min(configuration.truncationSeedRecordCount(), limit);
        for (var round = 1; round <= configuration.maxTruncationRounds(); round++) {
            var block = prefix(candidate);
            var size = measure.applyAsInt(block);
            LOG.debug("Truncation round {} of table '{}': {} records -> {} bytes (budget {})",
                    round, schema.tableName(), candidate, size, maxSize);
            if (size <= maxSize) {
                if (fitBlock != null && size < fitSize) {
                    throw nonMonotone(candidate, size, fitCount, fitSize);
                }
                fitCount = candidate;
                fitSize = size;
                fitBlock = block;
                if (candidate == limit || maxSize - size <= tolerance) {
                    break;
                }
            } else {
                if (overCount >= 0 && size > overSize) {
                    throw nonMonotone(candidate, size, overCount, overSize);
                }
                overCount = candidate;
                overSize = size;
            }

            var low = fitCount + 1;
            var high = overCount >= 0 ? overCount - 1 : limit;
            if (low > high) {
                break;
            }
            var next = interpolate(previousCount, previousSize, candidate, size, maxSize);
            previousCount = candidate;
            previousSize = size;
            candidate = (int) Math.max(low, Math.min(high, next));
        }

        if (fitBlock == null) {
            // Interpolation never found a fit: bisect the bracket (0, overCount)
            var low = 0;
            var high = overCount;
            while (high - low > 1) {
                var middle = (low + high) >>> 1;
                var block = prefix(middle);
                var size = measure.applyAsInt(block);
                if (size <= maxSize) {
                    low = middle;
                    fitBlock = block;
                    fitCount = middle;
                    fitSize = size;
                } else {
                    high = middle;
                    overSize = size;
                }
            }
            if (fitBlock == null) {
                throw new BlockCapacityException("A single record does not fit in the block size", overSize, maxSize);
            }
        }

        deleteRecordsByRecordIndex(Selection.range(0, fitCount).toIntArray());
        LOG.debug("Truncated {} of {} records of table '{}' into {} bytes (budget {})",
                fitCount, total, schema.tableName(), fitSize, maxSize);
        return fitBlock;
    }

    /**
     * Serialized size, or the largest column payload scaled from the 16-bit column cap
     * onto {@code maxSize} when that is larger. The result is at most {@code maxSize}
     * exactly when the block serializes within {@code maxSize}.
     */
    int truncationSize(int maxSize) {
        var size = (long) Short.BYTES * columns.size();
        var largestPayload = 0L;
        for (var column : columns) {
            var length = column.serialize().payload().length;
            size += length;
            largestPayload = Math.max(largestPayload, length);
        }
        var scaled = largestPayload * maxSize / SerializedBlock.MAX_COLUMN_PAYLOAD_SIZE;
        if (largestPayload > SerializedBlock.MAX_COLUMN_PAYLOAD_SIZE) {
            // Integer division may round an overflowing column down onto the budget
            scaled = Math.max(scaled, (long) maxSize + 1);
        }
        return (int) Math.min(Integer.MAX_VALUE, Math.max(size, scaled));
    }

    // Row count where the line through both points reaches the target size
    private static long interpolate(int count1, int size1, int count2, int size2, int targetSize) {
        double slope;
        if (count1 != count2 && size2 != size1) {
            slope = (double) (size2 - size1) / (count2 - count1);
        } else {
            slope = (double) size2 / count2;
        }
        if (slope <= 0d) {
            slope = (double) size2 / count2;
        }
        return (long) Math.floor(count2 + (targetSize - size2) / slope);
    }

    private BlockBuilder prefix(int count) {
        var block = new BlockBuilder(schema, configuration);
        var row = new Object[columns.size()];
        for (var i = 0; i < count; i++) {
            for (var c = 0; c < row.length; c++) {
                row[c] = columns.get(c).getValue(i);
            }
            block.appendRow(row);
        }
        return block;
    }

    private static IllegalStateException nonMonotone(int count, int size, int boundCount, int boundSize) {
        return new IllegalStateException("Interpolation failed: " + count + " records serialize to " + size
                + " bytes but " + boundCount + " records serialize to " + boundSize + " bytes");
    }
}
