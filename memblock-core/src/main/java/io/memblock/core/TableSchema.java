package io.memblock.core;

import java.util.HashSet;
import java.util.List;

/**
 * Ordered list of columns describing the records of a block.
 * <p>
 * Every block carries one extra, implicit, non-nullable 64-bit record id column after
 * the schema columns. Projections may also ask for the row index pseudo column, which
 * exists only at query time.
 * <pre>
 * [0 .. columnCount-1]   schema columns
 * [columnCount]          record id
 * [columnCount + 1]      row index (projection only)
 * </pre>
 */
public record TableSchema(String tableName, List<ColumnSchema> columns) {

    public TableSchema {
        if (tableName == null || tableName.isBlank()) {
            throw new IllegalArgumentException("tableName required");
        }
        if (columns == null) {
            throw new IllegalArgumentException("columns required");
        }
        columns = List.copyOf(columns);
        var names = new HashSet<String>();
        for (var column : columns) {
            if (!names.add(column.name())) {
                throw new IllegalArgumentException("duplicate column name: " + column.name());
            }
        }
    }

    public static TableSchema of(String tableName, ColumnSchema... columns) {
        return new TableSchema(tableName, List.of(columns));
    }

    public int columnCount() {
        return columns.size();
    }

    public ColumnSchema column(int columnIndex) {
        return columns.get(columnIndex);
    }

    public int recordIdColumnIndex() {
        return columns.size();
    }

    public int rowIndexColumnIndex() {
        return columns.size() + 1;
    }

    /**
     * Returns the position of the named column.
     *
     * @throws IllegalArgumentException if no column carries that name
     */
    public int columnIndex(String name) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).name().equals(name)) {
                return i;
            }
        }
        throw new IllegalArgumentException("Unknown column '" + name + "' in table '" + tableName + "'");
    }

    /**
     * Two schemas are compatible when their columns have the same types in the same
     * order. Names and table names are not compared.
     */
    public boolean areColumnsCompatible(TableSchema other) {
        if (other == null || other.columns.size() != columns.size()) {
            return false;
        }
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).type() != other.columns.get(i).type()) {
                return false;
            }
        }
        return true;
    }
}
