package io.memblock.block;

import io.memblock.core.BlockCapacityException;
import io.memblock.core.ColumnSchema;
import io.memblock.core.ColumnType;
import io.memblock.core.MemblockConfiguration;
import io.memblock.core.TableSchema;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BlockTruncationTest {

    private static final TableSchema SCHEMA = TableSchema.of("measures",
            new ColumnSchema("value", ColumnType.INT32));

    private static BlockBuilder sequential(int count, MemblockConfiguration configuration) {
        var block = new BlockBuilder(SCHEMA, configuration);
        for (var i = 0; i < count; i++) {
            block.appendRecord(i, i);
        }
        return block;
    }

    @Test
    @DisplayName("100k records truncated to 4000 bytes yield a fitting, strict prefix")
    void largeBlockIsTruncatedToBudget() {
        var source = sequential(100_000, MemblockConfiguration.defaults());

        var truncated = source.truncateBlock(4_000);

        var count = truncated.recordCount();
        assertThat(count).isGreaterThan(0).isLessThan(100_000);
        assertThat(truncated.serialize().size()).isLessThanOrEqualTo(4_000);
        assertThat(source.recordCount()).isEqualTo(100_000 - count);
        assertThat(truncated.recordId(0)).isZero();
        assertThat(truncated.recordId(count - 1)).isEqualTo(count - 1L);
        assertThat(source.recordId(0)).isEqualTo((long) count);
    }

    @Test
    void acceptedSizeIsCloseToBudget() {
        var source = sequential(20_000, MemblockConfiguration.defaults());

        var truncated = source.truncateBlock(4_000);

        assertThat(truncated.serializedSize()).isBetween(3_800, 4_000);
    }

    @Test
    void repeatedTruncationDrainsTheSource() {
        var source = sequential(10_000, MemblockConfiguration.defaults());
        var drained = 0;
        var blocks = 0;

        while (source.recordCount() > 0) {
            var truncated = source.truncateBlock(2_048);
            assertThat(truncated.serializedSize()).isLessThanOrEqualTo(2_048);
            drained += truncated.recordCount();
            blocks++;
        }

        assertThat(drained).isEqualTo(10_000);
        assertThat(blocks).isGreaterThan(1);
    }

    @Test
    void smallBlockMovesEntirely() {
        var source = sequential(10, MemblockConfiguration.defaults());

        var truncated = source.truncateBlock(4_000);

        assertThat(truncated.recordCount()).isEqualTo(10);
        assertThat(source.recordCount()).isZero();
    }

    @Test
    void noArgTruncationUsesConfiguredBlockSize() {
        var configuration = MemblockConfiguration.builder().maxBlockSize(512).build();
        var source = sequential(5_000, configuration);

        var truncated = source.truncateBlock();

        assertThat(truncated.serializedSize()).isLessThanOrEqualTo(512);
        assertThat(truncated.configuration()).isSameAs(configuration);
    }

    @Test
    void bisectionFindsAFitWhenInterpolationOvershoots() {
        var configuration = MemblockConfiguration.builder()
                .truncationSeedRecordCount(5_000)
                .maxTruncationRounds(1)
                .build();
        var source = sequential(8_000, configuration);

        var truncated = source.truncateBlock(300);

        assertThat(truncated.recordCount()).isPositive();
        assertThat(truncated.serializedSize()).isLessThanOrEqualTo(300);
        assertThat(source.recordCount()).isEqualTo(8_000 - truncated.recordCount());
    }

    @Test
    @DisplayName("A record larger than the budget is a capacity error")
    void singleRecordLargerThanBudget() {
        var source = sequential(3, MemblockConfiguration.defaults());

        assertThatThrownBy(() -> source.truncateBlock(10))
                .isInstanceOf(BlockCapacityException.class)
                .hasMessageContaining("single record")
                .satisfies(e -> assertThat(((BlockCapacityException) e).availableSize()).isEqualTo(10));
        assertThat(source.recordCount()).isEqualTo(3);
    }

    @Test
    void rejectsInvalidArguments() {
        assertThatThrownBy(() -> sequential(1, MemblockConfiguration.defaults()).truncateBlock(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BlockBuilder(SCHEMA).truncateBlock(100))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("empty");
    }

    @Test
    @DisplayName("Column payloads stay within 16 bits when the byte budget is larger")
    void largeBudgetRespectsColumnPayloadLimit() {
        var schema = TableSchema.of("samples", new ColumnSchema("value", ColumnType.INT64));
        var source = new BlockBuilder(schema);
        var random = new Random(42);
        for (var i = 0; i < 20_000; i++) {
            source.appendRecord(i, random.nextLong());
        }

        var truncated = source.truncateBlock(1_000_000);
        var serialized = truncated.serialize();

        assertThat(truncated.recordCount()).isPositive().isLessThan(20_000);
        assertThat(serialized.size()).isLessThanOrEqualTo(1_000_000);
        assertThat(serialized.columns())
                .allSatisfy(column -> assertThat(column.payload().length)
                        .isLessThanOrEqualTo(SerializedBlock.MAX_COLUMN_PAYLOAD_SIZE));
        assertThat(source.recordCount()).isEqualTo(20_000 - truncated.recordCount());
    }

    @Test
    void mixedColumnsAreDrainedWithinBudget() {
        var schema = TableSchema.of("visits",
                new ColumnSchema("user", ColumnType.STRING),
                new ColumnSchema("duration", ColumnType.INT64_NULLABLE),
                new ColumnSchema("bounced", ColumnType.BOOL_NULLABLE));
        var source = new BlockBuilder(schema);
        for (var i = 0; i < 5_000; i++) {
            source.appendRecord(i,
                    i % 11 == 0 ? null : "user-" + (i % 50),
                    i % 3 == 0 ? null : i * 7L,
                    i % 5 == 0 ? null : i % 2 == 0);
        }
        var recordIds = new ArrayList<Long>();

        while (source.recordCount() > 0) {
            var before = source.recordCount();
            var truncated = source.truncateBlock(2_048);

            assertThat(truncated.recordCount()).isPositive();
            assertThat(truncated.serialize().size()).isLessThanOrEqualTo(2_048);
            assertThat(source.recordCount()).isEqualTo(before - truncated.recordCount());
            for (var row = 0; row < truncated.recordCount(); row++) {
                recordIds.add(truncated.recordId(row));
            }
        }

        assertThat(recordIds).hasSize(5_000);
        assertThat(recordIds).isSorted();
        assertThat(recordIds.get(4_999)).isEqualTo(4_999L);
    }

    @Test
    void shrinkingSizeForALargerPrefixIsAnInvariantViolation() {
        var source = sequential(1_000, MemblockConfiguration.defaults());

        // 100 records measure 500 bytes, the interpolated 200 records only 400
        assertThatThrownBy(() -> source.truncateBlock(1_000,
                block -> block.recordCount() == 200 ? 400 : block.recordCount() * 5))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("Interpolation failed");
        assertThat(source.recordCount()).isEqualTo(1_000);
    }

    @Test
    void growingSizeForASmallerPrefixIsAnInvariantViolation() {
        var source = sequential(1_000, MemblockConfiguration.defaults());

        // 100 records measure 3000 bytes, the interpolated 33 records 4000
        assertThatThrownBy(() -> source.truncateBlock(1_000,
                block -> block.recordCount() == 33 ? 4_000 : block.recordCount() * 30))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("Interpolation failed");
        assertThat(source.recordCount()).isEqualTo(1_000);
    }
}
