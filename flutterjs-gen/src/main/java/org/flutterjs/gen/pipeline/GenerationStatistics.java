package org.flutterjs.gen.pipeline;

import java.util.List;
import java.util.SortedSet;

/**
 * Counts and detections of one run, as shown in the generation report.
 *
 * @param generatedSize size of the assembled output before optimization
 * @param finalSize     size of the returned code
 */
public record GenerationStatistics(int classCount,
                                   int functionCount,
                                   int variableCount,
                                   int enumCount,
                                   int importCount,
                                   SortedSet<String> usedWidgets,
                                   SortedSet<String> usedTypes,
                                   List<String> usedHelpers,
                                   int generatedSize,
                                   int finalSize,
                                   long elapsedMillis) {

    public GenerationStatistics {
        usedHelpers = List.copyOf(usedHelpers);
    }
}
