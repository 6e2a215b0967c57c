package io.memblock.kernel;

import java.util.Arrays;

/**
 * Immutable set of row indexes, kept sorted ascending without duplicates.
 * <p>
 * <b>Performance characteristics:</b>
 * <ul>
 * <li>contains(): O(log n) binary search</li>
 * <li>intersect(): O(n+m) merge</li>
 * <li>union(): O(n+m) merge with dedupe</li>
 * <li>subtract(): O(n+m) merge</li>
 * </ul>
 */
public final class Selection {

    private static final Selection EMPTY = new Selection(new int[0]);

    private final int[] indexes;

    private Selection(int[] indexes) {
        this.indexes = indexes;
    }

    public static Selection empty() {
        return EMPTY;
    }

    /**
     * Selection of the given row indexes, in any order, duplicates allowed.
     */
    public static Selection of(int... indexes) {
        if (indexes.length == 0) {
            return EMPTY;
        }
        var copy = indexes.clone();
        Arrays.sort(copy);
        var k = 0;
        for (var i = 0; i < copy.length; i++) {
            if (copy[i] < 0) {
                throw new IllegalArgumentException("row index must be non-negative: " + copy[i]);
            }
            if (k == 0 || copy[k - 1] != copy[i]) {
                copy[k++] = copy[i];
            }
        }
        return new Selection(trim(copy, k));
    }

    /**
     * Create a Selection from scan-result row indexes.
     * <p>
     * Column scans produce strictly ascending indexes, so this skips sorting and
     * takes ownership of the array.
     *
     * @throws IllegalArgumentException if the indexes are not strictly ascending
     */
    public static Selection fromScanIndices(int[] indexes) {
        if (indexes.length == 0) {
            return EMPTY;
        }
        if (indexes[0] < 0) {
            throw new IllegalArgumentException("row index must be non-negative: " + indexes[0]);
        }
        for (var i = 1; i < indexes.length; i++) {
            if (indexes[i] <= indexes[i - 1]) {
                throw new IllegalArgumentException("scan indexes must be strictly ascending at position " + i);
            }
        }
        return new Selection(indexes);
    }

    /**
     * Every row index in {@code [fromInclusive, toExclusive)}.
     */
    public static Selection range(int fromInclusive, int toExclusive) {
        if (fromInclusive < 0 || toExclusive < fromInclusive) {
            throw new IllegalArgumentException("invalid range [" + fromInclusive + ", " + toExclusive + ")");
        }
        if (fromInclusive == toExclusive) {
            return EMPTY;
        }
        var result = new int[toExclusive - fromInclusive];
        for (var i = 0; i < result.length; i++) {
            result[i] = fromInclusive + i;
        }
        return new Selection(result);
    }

    public int size() {
        return indexes.length;
    }

    public boolean isEmpty() {
        return indexes.length == 0;
    }

    public boolean contains(int index) {
        return Arrays.binarySearch(indexes, index) >= 0;
    }

    /**
     * Row indexes in ascending order, as a fresh array.
     */
    public int[] toIntArray() {
        return indexes.clone();
    }

    public Selection union(Selection other) {
        var a = indexes;
        var b = other.indexes;

        if (a.length == 0) {
            return other;
        }
        if (b.length == 0) {
            return this;
        }

        var combined = new int[a.length + b.length];
        var i = 0;
        var j = 0;
        var k = 0;

        while (i < a.length && j < b.length) {
            var va = a[i];
            var vb = b[j];
            if (va == vb) {
                combined[k++] = va;
                i++;
                j++;
            } else if (va < vb) {
                combined[k++] = va;
                i++;
            } else {
                combined[k++] = vb;
                j++;
            }
        }

        while (i < a.length) {
            combined[k++] = a[i++];
        }
        while (j < b.length) {
            combined[k++] = b[j++];
        }

        return new Selection(trim(combined, k));
    }

    public Selection intersect(Selection other) {
        var a = indexes;
        var b = other.indexes;

        if (a.length == 0 || b.length == 0) {
            return EMPTY;
        }

        var result = new int[Math.min(a.length, b.length)];
        var i = 0;
        var j = 0;
        var k = 0;

        while (i < a.length && j < b.length) {
            var va = a[i];
            var vb = b[j];
            if (va == vb) {
                result[k++] = va;
                i++;
                j++;
            } else if (va < vb) {
                i++;
            } else {
                j++;
            }
        }

        return k == 0 ? EMPTY : new Selection(trim(result, k));
    }

    /**
     * Indexes of this selection that are not in {@code other}.
     */
    public Selection subtract(Selection other) {
        var a = indexes;
        var b = other.indexes;

        if (a.length == 0) {
            return EMPTY;
        }
        if (b.length == 0) {
            return this;
        }

        var result = new int[a.length];
        var i = 0;
        var j = 0;
        var k = 0;

        while (i < a.length && j < b.length) {
            var va = a[i];
            var vb = b[j];
            if (va == vb) {
                i++;
                j++;
            } else if (va < vb) {
                result[k++] = va;
                i++;
            } else {
                j++;
            }
        }

        while (i < a.length) {
            result[k++] = a[i++];
        }

        return k == 0 ? EMPTY : new Selection(trim(result, k));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Selection other && Arrays.equals(indexes, other.indexes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(indexes);
    }

    @Override
    public String toString() {
        return "Selection" + Arrays.toString(indexes);
    }

    private static int[] trim(int[] indexes, int length) {
        if (length == indexes.length) {
            return indexes;
        }
        return Arrays.copyOf(indexes, length);
    }
}
