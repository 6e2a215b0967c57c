package io.memblock.encoding;

/**
 * Out-of-band metadata of a compressed column payload.
 * <p>
 * A payload can only be decoded together with the stats produced alongside it:
 * there is no magic number nor version inside the payload itself. Minimum and
 * maximum are {@code null} when every item is null.
 *
 * @param itemCount     number of items, nulls included
 * @param hasNulls      whether at least one item is null
 * @param columnMinimum smallest non-null value, in the column's external type
 * @param columnMaximum largest non-null value, in the column's external type
 */
public record ColumnStats(int itemCount, boolean hasNulls, Object columnMinimum, Object columnMaximum) {
    public ColumnStats {
        if (itemCount < 0) {
            throw new IllegalArgumentException("itemCount must be non-negative: " + itemCount);
        }
    }
}
