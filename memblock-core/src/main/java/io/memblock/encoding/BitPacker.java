package io.memblock.encoding;

import java.nio.BufferOverflowException;
import java.nio.ByteBuffer;

/**
 * Packs unsigned 64-bit integers into the minimal number of bits their maximum needs.
 * <p>
 * Values are written least-significant bit first, back to back, across byte
 * boundaries: a value may span several bytes and a byte may hold bits of two
 * consecutive values. All values are read as unsigned, so {@code -1L} is the
 * all-ones maximum and needs 64 bits.
 * <p>
 * A maximum of {@code 0} needs zero bits: nothing is written and unpacking yields
 * zeros.
 */
public final class BitPacker {

    private BitPacker() {
    }

    /**
     * Number of bits needed to store any value in {@code [0, maximumValue]}.
     */
    public static int bitsPerValue(long maximumValue) {
        return Long.SIZE - Long.numberOfLeadingZeros(maximumValue);
    }

    /**
     * Size in bytes of {@code itemCount} packed values bounded by {@code maximumValue}.
     */
    public static int packSize(int itemCount, long maximumValue) {
        if (itemCount < 0) {
            throw new IllegalArgumentException("itemCount must be non-negative: " + itemCount);
        }
        long totalBits = (long) itemCount * bitsPerValue(maximumValue);
        return (int) ((totalBits + 7) / 8);
    }

    /**
     * Packs the first {@code count} values at the buffer's position and advances it.
     *
     * @throws IllegalArgumentException if a value is greater (unsigned) than {@code maximumValue}
     * @throws BufferOverflowException if the buffer has less than
     *                                 {@link #packSize(int, long)} bytes remaining
     */
    public static void pack(long[] values, int count, long maximumValue, ByteBuffer target) {
        int bits = bitsPerValue(maximumValue);
        int size = packSize(count, maximumValue);
        if (target.remaining() < size) {
            throw new BufferOverflowException();
        }
        int base = target.position();
        // Partial bytes are OR-ed in, start from zeros
        for (int i = 0; i < size; i++) {
            target.put(base + i, (byte) 0);
        }
        long bitPosition = 0;
        for (int i = 0; i < count; i++) {
            long value = values[i];
            if (Long.compareUnsigned(value, maximumValue) > 0) {
                throw new IllegalArgumentException(
                        "value " + Long.toUnsignedString(value) + " exceeds maximum "
                                + Long.toUnsignedString(maximumValue));
            }
            int byteIndex = (int) (bitPosition >>> 3);
            int bitOffset = (int) (bitPosition & 7);
            int remainingBits = bits;
            long remainingValue = value;
            while (remainingBits > 0) {
                int bitsToWrite = Math.min(8 - bitOffset, remainingBits);
                int mask = (1 << bitsToWrite) - 1;
                int chunk = ((int) remainingValue & mask) << bitOffset;
                int index = base + byteIndex;
                target.put(index, (byte) (target.get(index) | chunk));
                remainingValue >>>= bitsToWrite;
                remainingBits -= bitsToWrite;
                byteIndex++;
                bitOffset = 0;
            }
            bitPosition += bits;
        }
        target.position(base + size);
    }

    /**
     * Unpacks {@code count} values from the buffer's position into {@code values}
     * and advances the buffer past the packed bytes.
     *
     * @throws IllegalArgumentException if an unpacked value exceeds {@code maximumValue},
     *                                  which means the payload does not match its metadata
     */
    public static void unpack(ByteBuffer source, int count, long maximumValue, long[] values) {
        int bits = bitsPerValue(maximumValue);
        int size = packSize(count, maximumValue);
        if (source.remaining() < size) {
            throw new IllegalArgumentException(
                    "packed payload too short: " + source.remaining() + " < " + size);
        }
        int base = source.position();
        long bitPosition = 0;
        for (int i = 0; i < count; i++) {
            int byteIndex = (int) (bitPosition >>> 3);
            int bitOffset = (int) (bitPosition & 7);
            int remainingBits = bits;
            int bitsProcessed = 0;
            long value = 0L;
            while (remainingBits > 0) {
                int bitsToRead = Math.min(8 - bitOffset, remainingBits);
                int mask = (1 << bitsToRead) - 1;
                int chunk = ((source.get(base + byteIndex) & 0xFF) >>> bitOffset) & mask;
                value |= ((long) chunk) << bitsProcessed;
                remainingBits -= bitsToRead;
                bitsProcessed += bitsToRead;
                byteIndex++;
                bitOffset = 0;
            }
            if (Long.compareUnsigned(value, maximumValue) > 0) {
                throw new IllegalArgumentException(
                        "unpacked value " + Long.toUnsignedString(value) + " exceeds maximum "
                                + Long.toUnsignedString(maximumValue));
            }
            values[i] = value;
            bitPosition += bits;
        }
        source.position(base + size);
    }
}
