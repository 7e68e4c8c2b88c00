package org.flutterjs.gen.optimize;

import java.util.List;

/**
 * @param optimizedSize length of the optimized code, not counting the level 2 header comment
 * @param changes       descriptions of the transformations applied, or that would apply in a dry run
 */
public record OptimizationResult(String text,
                                 int originalSize,
                                 int optimizedSize,
                                 boolean dryRun,
                                 List<String> changes) {

    public OptimizationResult {
        changes = changes == null ? List.of() : List.copyOf(changes);
    }

    static OptimizationResult unchanged(String text) {
        return new OptimizationResult(text, text.length(), text.length(), false, List.of());
    }

    public double reductionPercent() {
        return reduction(originalSize, optimizedSize);
    }

    static double reduction(int before, int after) {
        return before == 0 ? 0.0 : (before - after) * 100.0 / before;
    }
}
