package io.memblock.storage;

import io.memblock.core.ColumnType;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.IntFunction;

/**
 * Static registry mapping each {@link ColumnType} to its column implementation.
 */
public final class DataColumns {

    private static final Map<ColumnType, IntFunction<DataColumn>> FACTORIES = new EnumMap<>(ColumnType.class);

    static {
        FACTORIES.put(ColumnType.INT32, capacity -> new ArrayIntColumn(false, capacity));
        FACTORIES.put(ColumnType.INT32_NULLABLE, capacity -> new ArrayIntColumn(true, capacity));
        FACTORIES.put(ColumnType.INT64, capacity -> new ArrayLongColumn(false, capacity));
        FACTORIES.put(ColumnType.INT64_NULLABLE, capacity -> new ArrayLongColumn(true, capacity));
        FACTORIES.put(ColumnType.STRING, ArrayStringColumn::new);
        FACTORIES.put(ColumnType.BOOL, capacity -> new ArrayBoolColumn(false, capacity));
        FACTORIES.put(ColumnType.BOOL_NULLABLE, capacity -> new ArrayBoolColumn(true, capacity));
    }

    private DataColumns() {
    }

    public static DataColumn create(ColumnType columnType) {
        return create(columnType, 16);
    }

    public static DataColumn create(ColumnType columnType, int initialCapacity) {
        var factory = FACTORIES.get(columnType);
        if (factory == null) {
            throw new IllegalArgumentException("No column implementation for " + columnType);
        }
        return factory.apply(initialCapacity);
    }
}
