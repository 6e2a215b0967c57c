package io.memblock.core;

/**
 * Semantic type of a schema column.
 * <p>
 * The constant decides the concrete column implementation, its null policy and the
 * class filter values must carry.
 */
public enum ColumnType {
    INT32(Integer.class, false, true),
    INT32_NULLABLE(Integer.class, true, true),
    INT64(Long.class, false, true),
    INT64_NULLABLE(Long.class, true, true),
    STRING(String.class, true, true),
    BOOL(Boolean.class, false, false),
    BOOL_NULLABLE(Boolean.class, true, false);

    private final Class<?> valueType;
    private final boolean nullable;
    private final boolean ordered;

    ColumnType(Class<?> valueType, boolean nullable, boolean ordered) {
        this.valueType = valueType;
        this.nullable = nullable;
        this.ordered = ordered;
    }

    /**
     * Java class of non-null values stored in, and compared against, this column type.
     */
    public Class<?> valueType() {
        return valueType;
    }

    public boolean nullable() {
        return nullable;
    }

    /**
     * Whether ordering operators (LT, LTE, GT, GTE) apply to this type.
     */
    public boolean ordered() {
        return ordered;
    }
}
