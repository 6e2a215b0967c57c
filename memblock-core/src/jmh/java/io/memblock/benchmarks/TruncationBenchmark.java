package io.memblock.benchmarks;

import io.memblock.block.BlockBuilder;
import io.memblock.core.ColumnSchema;
import io.memblock.core.ColumnType;
import io.memblock.core.TableSchema;

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
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@BenchmarkMode(Mode.AverageTime)
public class TruncationBenchmark {

    private static final TableSchema SCHEMA = TableSchema.of("metrics",
            new ColumnSchema("host", ColumnType.STRING),
            new ColumnSchema("value", ColumnType.INT32));

    @Param({"4096", "16384"})
    int maxBlockSize;

    private BlockBuilder source;

    @Setup(Level.Invocation)
    public void setup() {
        source = new BlockBuilder(SCHEMA);
        for (int i = 0; i < 100_000; i++) {
            source.appendRecord(i, "host-" + (i % 32), i % 10_000);
        }
    }

    @Benchmark
    public void drain(Blackhole blackhole) {
        while (source.recordCount() > 0) {
            blackhole.consume(source.truncateBlock(maxBlockSize));
        }
    }
}
