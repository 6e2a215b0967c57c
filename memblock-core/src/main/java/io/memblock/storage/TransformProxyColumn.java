package io.memblock.storage;

import io.memblock.core.ColumnType;
import io.memblock.encoding.SerializedColumn;
import io.memblock.kernel.Predicate;

import java.util.HashSet;
import java.util.Set;
import java.util.function.Function;

/**
 * Column exposing values of type {@code O} while storing them in an inner column of
 * type {@code I}.
 * <p>
 * Every value crossing the boundary is converted, including the min/max carried by a
 * serialized payload, so the inner codec is reused unchanged.
 *
 * @param <O> exposed value type
 * @param <I> stored value type
 */
public class TransformProxyColumn<O, I> implements DataColumn {

    private final ColumnType columnType;
    private final Class<O> outerType;
    private final Class<I> innerType;
    private final DataColumn inner;
    private final Function<O, I> toInner;
    private final Function<I, O> toOuter;

    public TransformProxyColumn(
            ColumnType columnType,
            Class<O> outerType,
            Class<I> innerType,
            DataColumn inner,
            Function<O, I> toInner,
            Function<I, O> toOuter) {
        if (columnType.valueType() != outerType) {
            throw new IllegalArgumentException(
                    columnType + " exposes " + columnType.valueType().getSimpleName()
                            + ", not " + outerType.getSimpleName());
        }
        if (inner.columnType().valueType() != innerType) {
            throw new IllegalArgumentException(
                    "inner column stores " + inner.columnType().valueType().getSimpleName()
                            + ", not " + innerType.getSimpleName());
        }
        this.columnType = columnType;
        this.outerType = outerType;
        this.innerType = innerType;
        this.inner = inner;
        this.toInner = toInner;
        this.toOuter = toOuter;
    }

    @Override
    public ColumnType columnType() {
        return columnType;
    }

    @Override
    public int recordCount() {
        return inner.recordCount();
    }

    @Override
    public Object getValue(int index) {
        return outer(inner.getValue(index));
    }

    @Override
    public int[] filter(Predicate.Operator operator, Object value) {
        ColumnChecks.checkFilter(columnType, operator, value);
        return inner.filter(operator, innerValue(value));
    }

    @Override
    public int[] filterIn(Set<?> values) {
        ColumnChecks.checkFilterIn(columnType, values);
        var converted = new HashSet<Object>(values.size() * 2);
        for (var value : values) {
            converted.add(innerValue(value));
        }
        return inner.filterIn(converted);
    }

    @Override
    public void appendValue(Object value) {
        ColumnChecks.checkAppend(columnType, value);
        inner.appendValue(innerValue(value));
    }

    @Override
    public void reorder(int[] permutation) {
        inner.reorder(permutation);
    }

    @Override
    public void deleteRecords(int[] sortedIndexes) {
        inner.deleteRecords(sortedIndexes);
    }

    @Override
    public SerializedColumn serialize() {
        var serialized = inner.serialize();
        return serialized.withExtrema(outer(serialized.columnMinimum()), outer(serialized.columnMaximum()));
    }

    @Override
    public void deserialize(SerializedColumn column) {
        ColumnChecks.checkValueType(columnType, column.columnMinimum());
        ColumnChecks.checkValueType(columnType, column.columnMaximum());
        inner.deserialize(column.withExtrema(innerValue(column.columnMinimum()), innerValue(column.columnMaximum())));
    }

    @Override
    public void clear() {
        inner.clear();
    }

    private Object innerValue(Object value) {
        return value == null ? null : toInner.apply(outerType.cast(value));
    }

    private Object outer(Object value) {
        return value == null ? null : toOuter.apply(innerType.cast(value));
    }
}
