package io.memblock.block;

import io.memblock.encoding.ColumnStats;

import java.util.List;

/**
 * Out-of-band metadata of a serialized block: enough, with the schema, to read its payload back.
 *
 * @param recordCount rows in the block
 * @param size        payload size in bytes, column length table included
 * @param columnStats per-column metadata, schema columns then record id
 */
public record BlockStats(int recordCount, int size, List<ColumnStats> columnStats) {
    public BlockStats {
        if (columnStats == null) {
            throw new IllegalArgumentException("columnStats required");
        }
        columnStats = List.copyOf(columnStats);
    }
}
