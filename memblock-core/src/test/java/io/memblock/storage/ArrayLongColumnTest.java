package io.memblock.storage;

import io.memblock.core.ColumnType;
import io.memblock.kernel.Predicate.Operator;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArrayLongColumnTest {

    private static ArrayLongColumn nullableColumn(Long... values) {
        var column = new ArrayLongColumn(true, 2);
        for (var value : values) {
            column.appendValue(value);
        }
        return column;
    }

    @Test
    void appendGrowsAndExposesNulls() {
        var column = nullableColumn(5L, null, 3L, 10L, null);

        assertThat(column.columnType()).isEqualTo(ColumnType.INT64_NULLABLE);
        assertThat(column.recordCount()).isEqualTo(5);
        assertThat(column.getValue(0)).isEqualTo(5L);
        assertThat(column.getValue(1)).isNull();
        assertThat(column.getLong(1)).isEqualTo(ArrayLongColumn.NULL_VALUE);
    }

    @Test
    void nullableColumnRejectsSentinel() {
        var column = new ArrayLongColumn(true);

        assertThatThrownBy(() -> column.appendValue(Long.MIN_VALUE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("reserved");
    }

    @Test
    void nonNullableColumnRejectsNullButAcceptsFullRange() {
        var column = new ArrayLongColumn(false);
        column.appendValue(Long.MIN_VALUE);
        column.appendValue(Long.MAX_VALUE);

        assertThat(column.getValue(0)).isEqualTo(Long.MIN_VALUE);
        assertThatThrownBy(() -> column.appendValue(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not nullable");
    }

    @Test
    void appendRejectsWrongType() {
        var column = new ArrayLongColumn(true);

        assertThatThrownBy(() -> column.appendValue(1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("type mismatch");
    }

    @Test
    void filterAppliesNullSemantics() {
        var column = nullableColumn(5L, null, 3L, 10L, null);

        assertThat(column.filter(Operator.EQ, 5L)).containsExactly(0);
        assertThat(column.filter(Operator.NEQ, 5L)).containsExactly(1, 2, 3, 4);
        assertThat(column.filter(Operator.LT, 6L)).containsExactly(0, 2);
        assertThat(column.filter(Operator.LTE, 5L)).containsExactly(0, 2);
        assertThat(column.filter(Operator.GT, 3L)).containsExactly(0, 3);
        assertThat(column.filter(Operator.GTE, 5L)).containsExactly(0, 3);
        assertThat(column.filter(Operator.EQ, null)).containsExactly(1, 4);
        assertThat(column.filter(Operator.NEQ, null)).containsExactly(0, 2, 3);
    }

    @Test
    void filterWithSentinelValueNeverMatchesNullRows() {
        var column = nullableColumn(5L, null);

        assertThat(column.filter(Operator.EQ, Long.MIN_VALUE)).isEmpty();
        assertThat(column.filter(Operator.NEQ, Long.MIN_VALUE)).containsExactly(0, 1);
        assertThat(column.filter(Operator.GT, Long.MIN_VALUE)).containsExactly(0);
        assertThat(column.filter(Operator.LTE, Long.MIN_VALUE)).isEmpty();
    }

    @Test
    void filterRejectsNullOrderingAndWrongType() {
        var column = nullableColumn(1L);

        assertThatThrownBy(() -> column.filter(Operator.LT, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("non-null");
        assertThatThrownBy(() -> column.filter(Operator.EQ, "1"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("type mismatch");
    }

    @Test
    void filterInMatchesNullMembers() {
        var column = nullableColumn(5L, null, 3L, 10L);
        Set<Object> values = new HashSet<>(Arrays.asList(3L, null));

        assertThat(column.filterIn(values)).containsExactly(1, 2);
    }

    @Test
    void reorderGathersRows() {
        var column = nullableColumn(10L, 20L, null);

        column.reorder(new int[] {2, 0, 1});

        assertThat(column.getValue(0)).isNull();
        assertThat(column.getValue(1)).isEqualTo(10L);
        assertThat(column.getValue(2)).isEqualTo(20L);
    }

    @Test
    void reorderRejectsNonPermutation() {
        var column = nullableColumn(1L, 2L);

        assertThatThrownBy(() -> column.reorder(new int[] {0, 0}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> column.reorder(new int[] {0}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void deleteRecordsCompactsInOrder() {
        var column = nullableColumn(5L, null, 3L, 10L, 7L, 8L);

        column.deleteRecords(new int[] {1, 3, 4});

        assertThat(column.recordCount()).isEqualTo(3);
        assertThat(column.getValue(0)).isEqualTo(5L);
        assertThat(column.getValue(1)).isEqualTo(3L);
        assertThat(column.getValue(2)).isEqualTo(8L);
        assertThat(column.filter(Operator.EQ, 10L)).isEmpty();
    }

    @Test
    void deleteRecordsValidatesIndexes() {
        var column = nullableColumn(1L, 2L, 3L);

        assertThatThrownBy(() -> column.deleteRecords(new int[] {2, 1}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> column.deleteRecords(new int[] {3}))
                .isInstanceOf(IndexOutOfBoundsException.class);
        assertThat(column.recordCount()).isEqualTo(3);
    }

    @Test
    void serializeRoundTripsThroughFreshColumn() {
        var column = nullableColumn(5L, null, -3L, 10L);

        var serialized = column.serialize();
        var copy = new ArrayLongColumn(true);
        copy.deserialize(serialized);

        assertThat(serialized.columnMinimum()).isEqualTo(-3L);
        assertThat(serialized.columnMaximum()).isEqualTo(10L);
        assertThat(copy.recordCount()).isEqualTo(4);
        assertThat(copy.getValue(1)).isNull();
        assertThat(copy.getValue(2)).isEqualTo(-3L);
    }

    @Test
    void nonNullableColumnRejectsPayloadWithNulls() {
        var serialized = nullableColumn(1L, null).serialize();

        assertThatThrownBy(() -> new ArrayLongColumn(false).deserialize(serialized))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not nullable");
    }

    @Test
    void clearEmptiesTheColumn() {
        var column = nullableColumn(1L, 2L);

        column.clear();

        assertThat(column.recordCount()).isZero();
        assertThatThrownBy(() -> column.getValue(0)).isInstanceOf(IndexOutOfBoundsException.class);
    }
}
