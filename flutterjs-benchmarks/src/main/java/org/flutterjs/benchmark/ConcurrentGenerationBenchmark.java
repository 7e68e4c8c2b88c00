package org.flutterjs.benchmark;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.flutterjs.benchmark.fixture.SampleUnits;
import org.flutterjs.gen.config.GenerationOptions;
import org.flutterjs.gen.pipeline.BatchGenerator;
import org.flutterjs.gen.pipeline.FileAssembler;
import org.flutterjs.gen.pipeline.GenerationResult;
import org.flutterjs.ir.ProgramUnit;
import org.openjdk.jmh.annotations.*;

/**
 * Two threads generating different units through one shared assembler, plus a batch of units
 * fanned out over a fixed pool. Gives a contention baseline for the shared read-only tables.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Fork(value = 2)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
@Threads(2)
public class ConcurrentGenerationBenchmark {

    @State(Scope.Benchmark)
    public static class SharedState {

        final ProgramUnit[] units = {
                SampleUnits.counterApp(0),
                SampleUnits.counterApp(1)
        };

        FileAssembler assembler;
        BatchGenerator batch;
        List<ProgramUnit> batchUnits;

        @Setup(Level.Trial)
        public void init() {
            assembler = new FileAssembler(GenerationOptions.defaults());
            batch = new BatchGenerator(4);
            batchUnits = SampleUnits.counterApps(16);
        }
    }

    @State(Scope.Thread)
    public static class ThreadState {

        private static final AtomicInteger THREAD_COUNTER = new AtomicInteger(0);
        int threadIndex;

        @Setup(Level.Trial)
        public void init() {
            threadIndex = THREAD_COUNTER.getAndIncrement() % 2;
        }
    }

    @Benchmark
    public GenerationResult concurrentGenerateDifferentUnits(SharedState shared, ThreadState local) {
        return shared.assembler.generate(shared.units[local.threadIndex]);
    }

    @Benchmark
    @Threads(1)
    public List<GenerationResult> batchOfSixteenUnits(SharedState shared) {
        return shared.batch.generateAll(shared.batchUnits, GenerationOptions.defaults());
    }
}
