package org.flutterjs.gen.pipeline;

import org.flutterjs.gen.emit.RuntimeHelper;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * What the analyze phase found in one program unit. Fixed before any text is emitted.
 *
 * @param usedSymbols   free names referenced by code, candidates for imports
 * @param usedTypes     class names the code instantiates, extends or tests against
 * @param usedWidgets   referenced names found in the widget registry
 * @param usedHelpers   runtime helpers the emitted code will call
 * @param declaredNames every name declared in the unit, at any nesting level
 */
public record AnalysisResult(SortedSet<String> usedSymbols,
                             SortedSet<String> usedTypes,
                             SortedSet<String> usedWidgets,
                             Set<RuntimeHelper> usedHelpers,
                             Set<String> declaredNames) {

    public AnalysisResult {
        usedSymbols = Collections.unmodifiableSortedSet(new TreeSet<>(usedSymbols));
        usedTypes = Collections.unmodifiableSortedSet(new TreeSet<>(usedTypes));
        usedWidgets = Collections.unmodifiableSortedSet(new TreeSet<>(usedWidgets));
        usedHelpers = usedHelpers.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(RuntimeHelper.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(usedHelpers));
        declaredNames = Set.copyOf(declaredNames);
    }
}
