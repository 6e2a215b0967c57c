package io.memblock.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TableSchemaTest {

    private static final TableSchema USERS = TableSchema.of("users",
            new ColumnSchema("name", ColumnType.STRING),
            new ColumnSchema("age", ColumnType.INT32_NULLABLE),
            new ColumnSchema("active", ColumnType.BOOL));

    @Test
    void pseudoColumnsFollowSchemaColumns() {
        assertThat(USERS.columnCount()).isEqualTo(3);
        assertThat(USERS.recordIdColumnIndex()).isEqualTo(3);
        assertThat(USERS.rowIndexColumnIndex()).isEqualTo(4);
        assertThat(USERS.column(1).type()).isEqualTo(ColumnType.INT32_NULLABLE);
    }

    @Test
    void columnIndexLooksUpByName() {
        assertThat(USERS.columnIndex("active")).isEqualTo(2);
        assertThatThrownBy(() -> USERS.columnIndex("email"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown column 'email'");
    }

    @Test
    void compatibilityComparesTypesInOrderOnly() {
        var renamed = TableSchema.of("people",
                new ColumnSchema("fullName", ColumnType.STRING),
                new ColumnSchema("years", ColumnType.INT32_NULLABLE),
                new ColumnSchema("enabled", ColumnType.BOOL));
        var reordered = TableSchema.of("users",
                new ColumnSchema("age", ColumnType.INT32_NULLABLE),
                new ColumnSchema("name", ColumnType.STRING),
                new ColumnSchema("active", ColumnType.BOOL));
        var nullability = TableSchema.of("users",
                new ColumnSchema("name", ColumnType.STRING),
                new ColumnSchema("age", ColumnType.INT32),
                new ColumnSchema("active", ColumnType.BOOL));

        assertThat(USERS.areColumnsCompatible(renamed)).isTrue();
        assertThat(USERS.areColumnsCompatible(reordered)).isFalse();
        assertThat(USERS.areColumnsCompatible(nullability)).isFalse();
        assertThat(USERS.areColumnsCompatible(TableSchema.of("users"))).isFalse();
        assertThat(USERS.areColumnsCompatible(null)).isFalse();
    }

    @Test
    void rejectsInvalidDefinitions() {
        assertThatThrownBy(() -> TableSchema.of("users",
                new ColumnSchema("name", ColumnType.STRING),
                new ColumnSchema("name", ColumnType.INT64)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("duplicate column name");
        assertThatThrownBy(() -> TableSchema.of(" "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TableSchema("users", null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ColumnSchema("name", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("type required");
    }

    @Test
    void columnsAreCopied() {
        var columns = new ArrayList<>(List.of(new ColumnSchema("id", ColumnType.INT64)));
        var schema = new TableSchema("t", columns);

        columns.clear();

        assertThat(schema.columnCount()).isEqualTo(1);
    }
}
