package io.memblock.encoding;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.TreeSet;

/**
 * Dictionary compression of a sequence of nullable strings.
 * <p>
 * Built for short values with low cardinality. Payload layout, little-endian:
 * <pre>
 * [uniqueValueCount : u16]                      0 means every item is null, nothing follows
 * [valueSequenceLength : u16][valueSequenceMaxChar : u8]
 * [character stream, bit-packed]                bound valueSequenceMaxChar
 * [ordinal stream, bit-packed, itemCount items] bound uniqueValueCount
 * </pre>
 * The character stream holds the sorted unique values, each as UTF-8 bytes shifted by
 * one and followed by a {@code 0} terminator. Ordinals are 1-based positions in that
 * list, {@code 0} standing for null.
 */
public final class StringCodec {

    /** Item counts and sequence lengths are stored on 16 bits. */
    public static final int MAX_ITEM_COUNT = 0xFFFF;

    private StringCodec() {
    }

    public static SerializedColumn compress(String[] values, int count) {
        if (values == null || count <= 0) {
            throw new IllegalArgumentException("Sequence can't be empty");
        }
        if (count > MAX_ITEM_COUNT) {
            throw new IllegalArgumentException("Sequence is too large (" + count + ")");
        }
        if (count > values.length) {
            throw new IllegalArgumentException("count " + count + " exceeds array length " + values.length);
        }

        var uniqueValues = new TreeSet<String>();
        var hasNulls = false;
        for (int i = 0; i < count; i++) {
            if (values[i] == null) {
                hasNulls = true;
            } else {
                uniqueValues.add(values[i]);
            }
        }
        if (uniqueValues.isEmpty()) {
            var buffer = ByteBuffer.allocate(Short.BYTES).order(ByteOrder.LITTLE_ENDIAN);
            buffer.putShort((short) 0);
            return new SerializedColumn(count, true, null, null, buffer.array());
        }

        var ordinals = new HashMap<String, Integer>(uniqueValues.size() * 2);
        var sequenceLength = 0;
        var encoded = new ArrayList<byte[]>(uniqueValues.size());
        for (var value : uniqueValues) {
            var bytes = value.getBytes(StandardCharsets.UTF_8);
            encoded.add(bytes);
            sequenceLength += bytes.length + 1;
            ordinals.put(value, ordinals.size() + 1);
        }
        if (sequenceLength > MAX_ITEM_COUNT) {
            throw new IllegalArgumentException(
                    "Unique values are too long to be encoded (" + sequenceLength + " bytes)");
        }

        var characters = new long[sequenceLength];
        long maxChar = 0;
        var position = 0;
        for (var bytes : encoded) {
            for (var b : bytes) {
                long shifted = (b & 0xFF) + 1;
                characters[position++] = shifted;
                maxChar = Math.max(maxChar, shifted);
            }
            characters[position++] = 0L;
        }

        var rowOrdinals = new long[count];
        for (int i = 0; i < count; i++) {
            rowOrdinals[i] = values[i] == null ? 0L : ordinals.get(values[i]);
        }
        long uniqueCount = uniqueValues.size();

        int size = Short.BYTES + Short.BYTES + Byte.BYTES
                + BitPacker.packSize(sequenceLength, maxChar)
                + BitPacker.packSize(count, uniqueCount);
        var buffer = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        buffer.putShort((short) uniqueCount);
        buffer.putShort((short) sequenceLength);
        buffer.put((byte) maxChar);
        BitPacker.pack(characters, sequenceLength, maxChar, buffer);
        BitPacker.pack(rowOrdinals, count, uniqueCount, buffer);

        return new SerializedColumn(
                count,
                hasNulls,
                uniqueValues.first(),
                uniqueValues.last(),
                buffer.array());
    }

    public static String[] decompress(SerializedColumn column) {
        return decompress(column.payloadBuffer(), column.itemCount());
    }

    /**
     * Decodes {@code itemCount} strings from the buffer's position and advances the
     * buffer past the payload.
     *
     * @throws IllegalArgumentException if the payload is inconsistent with {@code itemCount}
     */
    public static String[] decompress(ByteBuffer payload, int itemCount) {
        var reader = payload.duplicate().order(ByteOrder.LITTLE_ENDIAN);
        var result = new String[itemCount];
        int uniqueCount = reader.getShort() & 0xFFFF;
        if (uniqueCount == 0) {
            // Only nulls
            payload.position(reader.position());
            return result;
        }
        if (uniqueCount > itemCount) {
            throw new IllegalArgumentException(
                    "Unique values (" + uniqueCount + ") should be <= to item count (" + itemCount + ")");
        }

        int sequenceLength = reader.getShort() & 0xFFFF;
        long maxChar = reader.get() & 0xFF;
        var characters = new long[sequenceLength];
        BitPacker.unpack(reader, sequenceLength, maxChar, characters);
        var uniqueValues = splitValues(characters, uniqueCount);

        var ordinals = new long[itemCount];
        BitPacker.unpack(reader, itemCount, uniqueCount, ordinals);
        for (int i = 0; i < itemCount; i++) {
            int ordinal = (int) ordinals[i];
            result[i] = ordinal == 0 ? null : uniqueValues.get(ordinal - 1);
        }
        payload.position(reader.position());
        return result;
    }

    private static List<String> splitValues(long[] characters, int uniqueCount) {
        var values = new ArrayList<String>(uniqueCount);
        var bytes = new byte[characters.length];
        var start = 0;
        for (int i = 0; i < characters.length; i++) {
            if (characters[i] == 0L) {
                values.add(new String(bytes, start, i - start, StandardCharsets.UTF_8));
                start = i + 1;
            } else {
                bytes[i] = (byte) (characters[i] - 1);
            }
        }
        if (start != characters.length || values.size() != uniqueCount) {
            throw new IllegalArgumentException(
                    "Character stream holds " + values.size() + " terminated values, expected " + uniqueCount);
        }
        return values;
    }
}
