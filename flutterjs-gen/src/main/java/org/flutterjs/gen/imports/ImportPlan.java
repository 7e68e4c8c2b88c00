package org.flutterjs.gen.imports;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.stream.Collectors;

/**
 * Result of import resolution for one file.
 *
 * @param namedImports     module path to the symbols imported from it; both levels sorted
 * @param namespaceImports module path to its namespace alias ({@code import * as alias})
 * @param deferred         symbols served through the deferred proxy instead of a static import
 * @param importedSymbols  every symbol made available by this plan
 */
public record ImportPlan(SortedMap<String, SortedSet<String>> namedImports,
                         SortedMap<String, String> namespaceImports,
                         List<CircularImportBreak> deferred,
                         Set<String> importedSymbols) {

    public ImportPlan {
        namedImports = Collections.unmodifiableSortedMap(namedImports);
        namespaceImports = Collections.unmodifiableSortedMap(namespaceImports);
        deferred = List.copyOf(deferred);
        importedSymbols = Set.copyOf(importedSymbols);
    }

    public Set<String> deferredSymbols() {
        return deferred.stream().map(CircularImportBreak::symbol).collect(Collectors.toUnmodifiableSet());
    }

    public boolean isDeferred(String symbol) {
        return deferred.stream().anyMatch(d -> d.symbol().equals(symbol));
    }

    public int importStatementCount() {
        return namedImports.size() + namespaceImports.size();
    }
}
