package io.memblock.benchmarks;

import io.memblock.block.BlockBuilder;
import io.memblock.block.ReadOnlyBlock;
import io.memblock.core.ColumnSchema;
import io.memblock.core.ColumnType;
import io.memblock.core.TableSchema;
import io.memblock.kernel.Predicate;
import io.memblock.kernel.Predicates;
import io.memblock.kernel.Selection;

import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

@State(Scope.Thread)
@Fork(1)
@Warmup(iterations = 3, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@BenchmarkMode(Mode.AverageTime)
public class ColumnScanBenchmark {

    private static final TableSchema SCHEMA = TableSchema.of("events",
            new ColumnSchema("kind", ColumnType.STRING),
            new ColumnSchema("value", ColumnType.INT64_NULLABLE));

    @Param({"1000", "10000", "60000"})
    int rowCount;

    private BlockBuilder builder;
    private ReadOnlyBlock readOnly;
    private Predicate combined;

    @Setup(Level.Trial)
    public void setup() {
        builder = new BlockBuilder(SCHEMA);
        for (int i = 0; i < rowCount; i++) {
            builder.appendRecord(i, "kind-" + (i % 16), i % 7 == 0 ? null : (long) (i % 1000));
        }
        readOnly = builder.serialize().toReadOnlyBlock();
        combined = Predicates.and(
                Predicates.eq(0, "kind-3"),
                Predicates.or(Predicates.gt(1, 500L), Predicates.eq(1, null)));
    }

    @Benchmark
    public void builderEquality(Blackhole blackhole) {
        Selection result = builder.filter(Predicates.eq(1, 42L));
        blackhole.consume(result);
    }

    @Benchmark
    public void builderCombined(Blackhole blackhole) {
        blackhole.consume(builder.filter(combined));
    }

    @Benchmark
    public void readOnlyCombined(Blackhole blackhole) {
        blackhole.consume(readOnly.filter(combined));
    }

    @Benchmark
    public void readOnlyPruned(Blackhole blackhole) {
        blackhole.consume(readOnly.filter(Predicates.gt(1, 5_000L)));
    }

    @Benchmark
    public void serialize(Blackhole blackhole) {
        blackhole.consume(builder.serialize());
    }
}
