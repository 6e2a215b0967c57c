package io.memblock.storage;

import io.memblock.core.ColumnType;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DataColumnsTest {

    @ParameterizedTest
    @EnumSource(ColumnType.class)
    void everyTypeHasAColumnImplementation(ColumnType type) {
        var column = DataColumns.create(type);

        assertThat(column.columnType()).isEqualTo(type);
        assertThat(column.recordCount()).isZero();
    }

    @ParameterizedTest
    @EnumSource(ColumnType.class)
    void nullPolicyFollowsType(ColumnType type) {
        var column = DataColumns.create(type, 0);

        if (type.nullable()) {
            column.appendValue(null);
            assertThat(column.getValue(0)).isNull();
        } else {
            assertThatThrownBy(() -> column.appendValue(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("not nullable");
        }
    }
}
