package org.flutterjs.gen.pipeline;

import org.flutterjs.gen.FlutterJsGenException;
import org.flutterjs.gen.config.GenerationOptions;
import org.flutterjs.gen.imports.CircularImportTable;
import org.flutterjs.gen.imports.GlobalSymbolTable;
import org.flutterjs.gen.registry.WidgetRegistry;
import org.flutterjs.ir.ProgramUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Generates several units concurrently. Each unit gets its own pipeline run; the registry, the
 * global symbol table and the circular import table are the only objects the runs share, and
 * all three are read-only.
 */
public final class BatchGenerator {

    private static final Logger log = LoggerFactory.getLogger(BatchGenerator.class);

    private final WidgetRegistry registry;
    private final GlobalSymbolTable symbolTable;
    private final CircularImportTable circularImports;
    private final int parallelism;

    public BatchGenerator(WidgetRegistry registry, GlobalSymbolTable symbolTable,
                          CircularImportTable circularImports, int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be at least 1: " + parallelism);
        }
        this.registry = registry;
        this.symbolTable = symbolTable;
        this.circularImports = circularImports;
        this.parallelism = parallelism;
    }

    public BatchGenerator(int parallelism) {
        this(WidgetRegistry.standard(), GlobalSymbolTable.empty(), CircularImportTable.standard(), parallelism);
    }

    /**
     * @return one result per unit, in the order of {@code units}
     */
    public List<GenerationResult> generateAll(List<ProgramUnit> units, GenerationOptions options) {
        FileAssembler assembler = new FileAssembler(options, registry, symbolTable, circularImports);
        List<Callable<GenerationResult>> tasks = new ArrayList<>();
        for (ProgramUnit unit : units) {
            tasks.add(() -> assembler.generate(unit));
        }
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, Math.max(1, units.size())));
        try {
            List<GenerationResult> results = new ArrayList<>();
            List<Future<GenerationResult>> futures = executor.invokeAll(tasks);
            for (int i = 0; i < futures.size(); i++) {
                results.add(resultOf(futures.get(i), units.get(i).filePath()));
            }
            log.debug("Generated {} unit(s) on {} thread(s)", units.size(), parallelism);
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FlutterJsGenException("Batch generation was interrupted", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private static GenerationResult resultOf(Future<GenerationResult> future, String filePath) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return GenerationResult.failed(filePath, "Generation failed: " + cause.getMessage(), List.of());
        }
    }
}
