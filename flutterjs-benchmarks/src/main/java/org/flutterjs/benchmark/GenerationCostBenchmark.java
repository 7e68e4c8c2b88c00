package org.flutterjs.benchmark;

import java.util.concurrent.TimeUnit;

import org.flutterjs.benchmark.fixture.SampleUnits;
import org.flutterjs.gen.config.GenerationOptions;
import org.flutterjs.gen.pipeline.FileAssembler;
import org.flutterjs.gen.pipeline.GenerationResult;
import org.flutterjs.ir.ProgramUnit;
import org.openjdk.jmh.annotations.*;

/**
 * Measures one full pipeline run over a single unit: analyze, generate, validate and, for the
 * optimized variant, a level 2 optimization pass.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class GenerationCostBenchmark {

    @State(Scope.Thread)
    public static class SimpleState {

        ProgramUnit unit;
        FileAssembler assembler;

        @Setup(Level.Trial)
        public void init() {
            unit = SampleUnits.greeting();
            assembler = new FileAssembler(GenerationOptions.defaults());
        }
    }

    @State(Scope.Thread)
    public static class AppState {

        ProgramUnit unit;
        FileAssembler assembler;
        FileAssembler optimizing;

        @Setup(Level.Trial)
        public void init() {
            unit = SampleUnits.counterApp(0);
            assembler = new FileAssembler(GenerationOptions.defaults());
            optimizing = new FileAssembler(GenerationOptions.builder().optimize(true).optimizationLevel(2).build());
        }
    }

    @Benchmark
    public GenerationResult generateStatelessWidget(SimpleState state) {
        return state.assembler.generate(state.unit);
    }

    @Benchmark
    public GenerationResult generateCounterApp(AppState state) {
        return state.assembler.generate(state.unit);
    }

    @Benchmark
    public GenerationResult generateAndOptimizeCounterApp(AppState state) {
        return state.optimizing.generate(state.unit);
    }
}
