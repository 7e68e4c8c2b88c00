package org.flutterjs.gen.imports;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Cross-file table from symbol name to the library that declares it, plus the import edges
 * between libraries. Built once before a batch starts and read-only afterwards.
 */
public final class GlobalSymbolTable {

    public record SymbolEntry(String name, String libraryUri, SymbolKind kind) {
    }

    private static final GlobalSymbolTable EMPTY = new Builder().build();

    private final Map<String, SymbolEntry> symbols;
    private final Map<String, Set<String>> dependencies;

    private GlobalSymbolTable(Map<String, SymbolEntry> symbols, Map<String, Set<String>> dependencies) {
        this.symbols = Map.copyOf(symbols);
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        dependencies.forEach((k, v) -> copy.put(k, Set.copyOf(v)));
        this.dependencies = Map.copyOf(copy);
    }

    public static GlobalSymbolTable empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<SymbolEntry> lookup(String symbol) {
        return Optional.ofNullable(symbols.get(symbol));
    }

    public boolean isTypeOnly(String symbol) {
        SymbolEntry entry = symbols.get(symbol);
        return entry != null && entry.kind() == SymbolKind.TYPEDEF;
    }

    /**
     * Libraries imported by {@code libraryUri}, empty when unknown.
     */
    public Set<String> importsOf(String libraryUri) {
        return dependencies.getOrDefault(libraryUri, Set.of());
    }

    public int size() {
        return symbols.size();
    }

    public static final class Builder {

        private final Map<String, SymbolEntry> symbols = new LinkedHashMap<>();
        private final Map<String, Set<String>> dependencies = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder symbol(String name, String libraryUri, SymbolKind kind) {
            symbols.put(name, new SymbolEntry(name, libraryUri, kind));
            return this;
        }

        public Builder dependency(String fromLibrary, String toLibrary) {
            dependencies.computeIfAbsent(fromLibrary, k -> new TreeSet<>()).add(toLibrary);
            return this;
        }

        public GlobalSymbolTable build() {
            return new GlobalSymbolTable(symbols, dependencies);
        }
    }
}
