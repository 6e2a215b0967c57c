package io.memblock.encoding;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StringCodecTest {

    @Test
    void repeatedValuesRoundTripWithSortedExtrema() {
        var values = new String[] {"Bob", "Alice", "Bob"};

        var column = StringCodec.compress(values, values.length);

        assertThat(column.hasNulls()).isFalse();
        assertThat(column.columnMinimum()).isEqualTo("Alice");
        assertThat(column.columnMaximum()).isEqualTo("Bob");
        assertThat(StringCodec.decompress(column)).containsExactly("Bob", "Alice", "Bob");
    }

    @Test
    void payloadLayoutFollowsDictionaryEncoding() {
        var column = StringCodec.compress(new String[] {"b", "a"}, 2);
        var payload = column.payloadBuffer();

        // "a" and "b" shifted by one, each followed by a terminator: 98 0 99 0
        assertThat(payload.getShort()).isEqualTo((short) 2);
        assertThat(payload.getShort()).isEqualTo((short) 4);
        assertThat(payload.get() & 0xFF).isEqualTo(99);
        // 4 chars of 7 bits then 2 ordinals of 2 bits
        assertThat(column.payload()).hasSize(5 + 4 + 1);
    }

    @Test
    void nullsMapToOrdinalZero() {
        var values = new String[] {null, "x", null, "y", "x"};

        var column = StringCodec.compress(values, values.length);

        assertThat(column.hasNulls()).isTrue();
        assertThat(column.columnMinimum()).isEqualTo("x");
        assertThat(column.columnMaximum()).isEqualTo("y");
        assertThat(StringCodec.decompress(column)).containsExactly(values);
    }

    @Test
    void allNullsOnlyWriteZeroUniqueCount() {
        var column = StringCodec.compress(new String[] {null, null}, 2);

        assertThat(column.payload()).containsExactly(0, 0);
        assertThat(column.hasNulls()).isTrue();
        assertThat(column.columnMinimum()).isNull();
        assertThat(StringCodec.decompress(column)).containsExactly(null, null);
    }

    @Test
    void emptyAndNonAsciiStringsRoundTrip() {
        var values = new String[] {"", "héllo", "日本語", "", "😀", null};

        var decoded = StringCodec.decompress(StringCodec.compress(values, values.length));

        assertThat(decoded).containsExactly(values);
    }

    @Test
    void randomLowCardinalitySequencesRoundTrip() {
        var random = new Random(7);
        var dictionary = new String[] {"alpha", "beta", "gamma", "delta", "epsilon", "zeta"};
        for (var run = 0; run < 20; run++) {
            var values = new String[1 + random.nextInt(3_000)];
            for (var i = 0; i < values.length; i++) {
                var pick = random.nextInt(dictionary.length + 1);
                values[i] = pick == dictionary.length ? null : dictionary[pick];
            }

            assertThat(StringCodec.decompress(StringCodec.compress(values, values.length)))
                    .containsExactly(values);
        }
    }

    @Test
    void decodingAdvancesPastThePayload() {
        var column = StringCodec.compress(new String[] {"a", "b", "a"}, 3);
        var buffer = ByteBuffer.allocate(column.payload().length + 1);
        buffer.put(column.payload()).put((byte) 42).flip();

        StringCodec.decompress(buffer, 3);

        assertThat(buffer.get()).isEqualTo((byte) 42);
    }

    @Test
    void rejectsEmptyAndOversizedSequences() {
        assertThatThrownBy(() -> StringCodec.compress(new String[0], 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("empty");
        assertThatThrownBy(() -> StringCodec.compress(new String[65_536], 65_536))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("too large");
    }

    @Test
    void rejectsDictionaryLongerThanSixteenBits() {
        var values = new String[2];
        values[0] = "a".repeat(40_000);
        values[1] = "b".repeat(40_000);

        assertThatThrownBy(() -> StringCodec.compress(values, 2))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("too long");
    }
}
