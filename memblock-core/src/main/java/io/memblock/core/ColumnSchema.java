package io.memblock.core;

public record ColumnSchema(String name, ColumnType type) {
    public ColumnSchema {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name required");
        }
        if (type == null) {
            throw new IllegalArgumentException("type required");
        }
    }
}
