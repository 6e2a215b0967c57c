package io.memblock.encoding;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

/**
 * Compression of a sequence of nullable 64-bit integers.
 * <p>
 * Nulls are carried in-band by a sentinel value chosen by the caller. Payload layout,
 * little-endian:
 * <pre>
 * [nonNullCount : u16]
 * [min : i64][max : i64]          if nonNullCount &gt; 0
 * [validity bitmap, 1 bit/item]   if 0 &lt; nonNullCount &lt; itemCount
 * [zero-based deltas, bit-packed] if nonNullCount &gt; 0 and min != max
 * </pre>
 * When every item is null, or none is, the bitmap is omitted. Deltas are
 * {@code value - min} for each non-null value in original order, packed with
 * {@code max - min} as bound.
 */
public final class Int64Codec {

    /** Item counts are stored on 16 bits. */
    public static final int MAX_ITEM_COUNT = 0xFFFF;

    private Int64Codec() {
    }

    /**
     * Compresses {@code count} non-nullable values.
     */
    public static SerializedColumn compress(long[] values, int count) {
        return compress(values, count, false, 0L);
    }

    /**
     * Compresses {@code count} values where {@code nullValue} stands for null.
     */
    public static SerializedColumn compress(long[] values, int count, long nullValue) {
        return compress(values, count, true, nullValue);
    }

    private static SerializedColumn compress(long[] values, int count, boolean nullable, long nullValue) {
        if (values == null || count <= 0) {
            throw new IllegalArgumentException("Sequence can't be empty");
        }
        if (count > MAX_ITEM_COUNT) {
            throw new IllegalArgumentException("Sequence is too large (" + count + ")");
        }
        if (count > values.length) {
            throw new IllegalArgumentException("count " + count + " exceeds array length " + values.length);
        }

        int nonNull = 0;
        long min = Long.MAX_VALUE;
        long max = Long.MIN_VALUE;
        for (int i = 0; i < count; i++) {
            long value = values[i];
            if (nullable && value == nullValue) {
                continue;
            }
            nonNull++;
            if (value < min) {
                min = value;
            }
            if (value > max) {
                max = value;
            }
        }

        boolean extremeNullRegime = nonNull == 0 || nonNull == count;
        boolean hasDeltas = nonNull != 0 && min != max;
        long maxDelta = hasDeltas ? toZeroBase(max, min) : 0L;
        int size = Short.BYTES
                + (nonNull == 0 ? 0 : 2 * Long.BYTES)
                + (extremeNullRegime ? 0 : BitPacker.packSize(count, 1L))
                + (hasDeltas ? BitPacker.packSize(nonNull, maxDelta) : 0);
        var buffer = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);

        buffer.putShort((short) nonNull);
        if (nonNull != 0) {
            buffer.putLong(min);
            buffer.putLong(max);
        }
        if (!extremeNullRegime) {
            var bitmap = new long[count];
            for (int i = 0; i < count; i++) {
                bitmap[i] = values[i] == nullValue ? 0L : 1L;
            }
            BitPacker.pack(bitmap, count, 1L, buffer);
        }
        if (hasDeltas) {
            var deltas = new long[nonNull];
            int j = 0;
            for (int i = 0; i < count; i++) {
                long value = values[i];
                if (!nullable || value != nullValue) {
                    deltas[j++] = toZeroBase(value, min);
                }
            }
            BitPacker.pack(deltas, nonNull, maxDelta, buffer);
        }

        return new SerializedColumn(
                count,
                nonNull < count,
                nonNull == 0 ? null : min,
                nonNull == 0 ? null : max,
                buffer.array());
    }

    /**
     * Decodes a payload produced by {@link #compress} into a new array.
     */
    public static long[] decompress(SerializedColumn column, long nullValue) {
        var values = new long[column.itemCount()];
        decompress(column.payloadBuffer(), column.itemCount(), nullValue, values);
        return values;
    }

    /**
     * Decodes {@code itemCount} values from the buffer's position, writing
     * {@code nullValue} for null items, and advances the buffer past the payload.
     *
     * @throws IllegalArgumentException if the payload is inconsistent with {@code itemCount}
     */
    public static void decompress(ByteBuffer payload, int itemCount, long nullValue, long[] values) {
        if (values.length < itemCount) {
            throw new IllegalArgumentException("target too small: " + values.length + " < " + itemCount);
        }
        var reader = payload.duplicate().order(ByteOrder.LITTLE_ENDIAN);
        int nonNull = reader.getShort() & 0xFFFF;
        if (nonNull > itemCount) {
            throw new IllegalArgumentException(
                    "Non-null (" + nonNull + ") should be <= to item count (" + itemCount + ")");
        }
        if (nonNull == 0) {
            // Only nulls
            Arrays.fill(values, 0, itemCount, nullValue);
            payload.position(reader.position());
            return;
        }

        long min = reader.getLong();
        long max = reader.getLong();
        boolean hasNulls = nonNull != itemCount;
        long[] bitmap = null;
        if (hasNulls) {
            bitmap = new long[itemCount];
            BitPacker.unpack(reader, itemCount, 1L, bitmap);
        }
        if (min == max) {
            // Single distinct value
            for (int i = 0; i < itemCount; i++) {
                values[i] = bitmap == null || bitmap[i] != 0L ? min : nullValue;
            }
        } else {
            var deltas = new long[nonNull];
            BitPacker.unpack(reader, nonNull, toZeroBase(max, min), deltas);
            int j = 0;
            for (int i = 0; i < itemCount; i++) {
                values[i] = bitmap == null || bitmap[i] != 0L
                        ? fromZeroBase(deltas[j++], min)
                        : nullValue;
            }
        }
        payload.position(reader.position());
    }

    /**
     * {@code value - min} as an unsigned 64-bit integer, valid for any {@code value >= min}.
     */
    static long toZeroBase(long value, long min) {
        long delta = value - min;
        // Signed overflow only when operands differ in sign and the result flips sign
        if (((value ^ min) & (value ^ delta)) >= 0) {
            return delta;
        }
        return BigInteger.valueOf(value).subtract(BigInteger.valueOf(min)).longValue();
    }

    static long fromZeroBase(long delta, long min) {
        if (delta >= 0) {
            long result = min + delta;
            if (((min ^ result) & (delta ^ result)) >= 0) {
                return result;
            }
        }
        return BigInteger.valueOf(min)
                .add(new BigInteger(Long.toUnsignedString(delta)))
                .longValueExact();
    }
}
