package org.flutterjs.gen.imports;

import org.flutterjs.gen.ImportResolutionException;
import org.flutterjs.gen.config.GenerationOptions;
import org.flutterjs.gen.config.Target;
import org.flutterjs.gen.diagnostic.Diagnostic;
import org.flutterjs.gen.diagnostic.DiagnosticCode;
import org.flutterjs.gen.diagnostic.DiagnosticCollector;
import org.flutterjs.gen.diagnostic.Severity;
import org.flutterjs.gen.printer.JsNames;
import org.flutterjs.gen.registry.WidgetRegistry;
import org.flutterjs.gen.registry.WidgetSpec;
import org.flutterjs.ir.ProgramUnit;
import org.flutterjs.ir.decl.ExportDirective;
import org.flutterjs.ir.decl.ImportDirective;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Computes the import and export sections of one generated file.
 * <p>
 * Every referenced external symbol is mapped to one module path; symbols are grouped per path
 * and both paths and symbols are sorted, so the same input always yields byte-identical text.
 * Known import cycles from the {@link CircularImportTable} are broken with a deferred proxy;
 * other cycles are reported. One resolver serves one file: the namespace alias counter is per file.
 */
public final class ImportResolver {

    private static final Logger log = LoggerFactory.getLogger(ImportResolver.class);

    private static final Pattern LOOP_VARIABLE = Pattern.compile("[a-z]");
    public static final String DEFERRED_PROXY = "__deferred";

    private final ProgramUnit unit;
    private final GenerationOptions options;
    private final WidgetRegistry registry;
    private final GlobalSymbolTable symbolTable;
    private final CircularImportTable circularImports;
    private final DiagnosticCollector diagnostics;
    private int aliasCounter;

    private record Resolution(String sourceUri, String modulePath) {
    }

    public ImportResolver(ProgramUnit unit,
                          GenerationOptions options,
                          WidgetRegistry registry,
                          GlobalSymbolTable symbolTable,
                          CircularImportTable circularImports,
                          DiagnosticCollector diagnostics) {
        this.unit = unit;
        this.options = options;
        this.registry = registry;
        this.symbolTable = symbolTable;
        this.circularImports = circularImports;
        this.diagnostics = diagnostics;
    }

    /**
     * @param usedSymbols free names referenced by the unit's code
     * @param localNames  names declared anywhere in the unit (classes, members, parameters, locals)
     */
    public ImportPlan resolve(Set<String> usedSymbols, Set<String> localNames) {
        SortedMap<String, SortedSet<String>> named = new TreeMap<>();
        SortedMap<String, String> namespaces = new TreeMap<>();
        List<CircularImportBreak> deferred = new ArrayList<>();
        Set<String> imported = new HashSet<>();
        Set<String> contributingUris = new HashSet<>();

        for (ImportDirective directive : unit.imports()) {
            if (directive.prefix() != null && usedSymbols.contains(directive.prefix())) {
                namespaces.put(ModulePaths.toModulePath(directive.uri(), unit), directive.prefix());
                imported.add(directive.prefix());
                contributingUris.add(directive.uri());
            }
        }

        for (String symbol : new TreeSet<>(usedSymbols)) {
            if (imported.contains(symbol) || isExcluded(symbol, localNames)) {
                continue;
            }
            Optional<Resolution> resolution;
            try {
                resolution = resolveSymbol(symbol);
            } catch (ImportResolutionException e) {
                diagnostics.add(Diagnostic.of(Severity.WARNING, DiagnosticCode.UNRESOLVED_IMPORT, e.getMessage())
                        .withNode(e.getNodeDescription()));
                continue;
            }
            if (resolution.isEmpty()) {
                continue;
            }
            Resolution r = resolution.get();
            if (r.sourceUri() != null) {
                contributingUris.add(r.sourceUri());
                Optional<CircularImportBreak> cycleBreak = findCycleBreak(r.sourceUri(), symbol);
                if (cycleBreak.isPresent()) {
                    log.debug("Breaking circular import of {} from {} in {}", symbol, r.sourceUri(), unit.filePath());
                    deferred.add(cycleBreak.get());
                    imported.add(symbol);
                    continue;
                }
                reportUnlistedCycle(r.sourceUri(), symbol);
            }
            named.computeIfAbsent(r.modulePath(), k -> new TreeSet<>()).add(symbol);
            imported.add(symbol);
        }

        // libraries that supplied no symbol still load, in a stable order, under a per-file alias
        for (ImportDirective directive : sortedByUri(unit.imports())) {
            if (ModulePaths.isRuntimeUri(directive.uri()) || contributingUris.contains(directive.uri())) {
                continue;
            }
            String path = ModulePaths.toModulePath(directive.uri(), unit);
            if (!named.containsKey(path) && !namespaces.containsKey(path)) {
                namespaces.put(path, "_import_" + aliasCounter++);
            }
        }

        deferred.sort(Comparator.comparing(CircularImportBreak::symbol));
        return new ImportPlan(named, namespaces, deferred, imported);
    }

    private static List<ImportDirective> sortedByUri(List<ImportDirective> directives) {
        List<ImportDirective> copy = new ArrayList<>(directives);
        copy.sort(Comparator.comparing(ImportDirective::uri));
        return copy;
    }

    /**
     * Names that never produce an import: local declarations, single-letter loop variables,
     * lowercase names that are not known exports, language globals and malformed identifiers.
     */
    boolean isExcluded(String symbol, Set<String> localNames) {
        if (localNames.contains(symbol)) {
            return true;
        }
        if (LOOP_VARIABLE.matcher(symbol).matches()) {
            return true;
        }
        if (!JsNames.isValidIdentifier(symbol) || RuntimeModules.isLanguageGlobal(symbol)) {
            return true;
        }
        if (Character.isLowerCase(symbol.charAt(0))) {
            boolean whitelisted = RuntimeModules.isLowercaseExport(symbol)
                    || symbolTable.lookup(symbol).map(e -> e.kind() != SymbolKind.CLASS).orElse(false);
            return !whitelisted;
        }
        return false;
    }

    private Optional<Resolution> resolveSymbol(String symbol) {
        Optional<WidgetSpec> widget = registry.lookup(symbol);
        if (widget.isPresent()) {
            return options.target() == Target.WEB
                    ? Optional.of(new Resolution(null, widget.get().module()))
                    : Optional.empty();
        }
        Optional<String> framework = RuntimeModules.frameworkModule(symbol);
        if (framework.isPresent()) {
            return options.target() == Target.WEB
                    ? Optional.of(new Resolution(null, framework.get()))
                    : Optional.empty();
        }
        Optional<String> core = RuntimeModules.coreLibrary(symbol);
        if (core.isPresent()) {
            return Optional.of(new Resolution(null, ModulePaths.toModulePath(core.get(), unit)));
        }
        Optional<GlobalSymbolTable.SymbolEntry> global = symbolTable.lookup(symbol);
        if (global.isPresent()) {
            if (global.get().kind() == SymbolKind.TYPEDEF) {
                return Optional.empty();
            }
            String uri = global.get().libraryUri();
            return Optional.of(new Resolution(uri, modulePath(symbol, uri)));
        }
        Optional<String> scored = bestImportFor(symbol);
        if (scored.isPresent()) {
            return Optional.of(new Resolution(scored.get(), modulePath(symbol, scored.get())));
        }
        diagnostics.add(Diagnostic.of(Severity.WARNING, DiagnosticCode.UNRESOLVED_IMPORT,
                        "No import provides '" + symbol + "'")
                .withNode(unit.filePath())
                .withSuggestion("Add the declaring library to the global symbol table or import it explicitly"));
        return Optional.empty();
    }

    private String modulePath(String symbol, String uri) {
        try {
            return ModulePaths.toModulePath(uri, unit);
        } catch (IllegalArgumentException e) {
            throw new ImportResolutionException(symbol, uri, e.getMessage());
        }
    }

    /**
     * Picks the unit import whose file name best matches the symbol: an explicit {@code show}
     * wins, then an exact normalized name (shorter paths preferred), then suffix matches.
     */
    Optional<String> bestImportFor(String symbol) {
        String symLower = symbol.toLowerCase();
        String best = null;
        int bestScore = 0;
        for (ImportDirective directive : sortedByUri(unit.imports())) {
            String uri = directive.uri();
            if (ModulePaths.isRuntimeUri(uri) || directive.prefix() != null || directive.hide().contains(symbol)) {
                continue;
            }
            int score;
            if (directive.show().contains(symbol)) {
                score = 1000;
            } else if (!directive.show().isEmpty()) {
                continue;
            } else {
                String fileName = ModulePaths.baseName(uri).toLowerCase().replace("_", "");
                if (symLower.equals(fileName)) {
                    score = 100 + Math.max(0, Math.min(9, 10 - ModulePaths.segmentCount(uri)));
                } else if (fileName.endsWith(symLower)) {
                    score = 60;
                } else if (symLower.endsWith(fileName)) {
                    score = 50;
                } else {
                    score = 0;
                }
            }
            if (score > bestScore) {
                bestScore = score;
                best = uri;
            }
        }
        return Optional.ofNullable(best);
    }

    private Optional<CircularImportBreak> findCycleBreak(String sourceUri, String symbol) {
        return unit.libraryUri().flatMap(self -> circularImports.find(self, sourceUri, symbol));
    }

    private void reportUnlistedCycle(String sourceUri, String symbol) {
        unit.libraryUri()
                .filter(self -> symbolTable.importsOf(sourceUri).contains(self))
                .ifPresent(self -> diagnostics.add(Diagnostic.of(Severity.WARNING, DiagnosticCode.CIRCULAR_IMPORT,
                                "Unresolved circular import: " + self + " and " + sourceUri + " import each other (symbol '" + symbol + "')")
                        .withNode(unit.filePath())
                        .withSuggestion("Register the pair in the circular import table or move '" + symbol + "' to a shared library")));
    }

    // ── Rendering ────────────────────────────────────────────────

    public String renderImports(ImportPlan plan) {
        StringBuilder sb = new StringBuilder();
        plan.namedImports().forEach((path, symbols) ->
                sb.append("import { ").append(String.join(", ", symbols)).append(" } from '").append(path).append("';\n"));
        plan.namespaceImports().forEach((path, alias) ->
                sb.append("import * as ").append(alias).append(" from '").append(path).append("';\n"));
        return sb.toString();
    }

    /**
     * The {@code __deferred} proxy for symbols whose static import would close a known cycle.
     */
    public String renderDeferred(ImportPlan plan) {
        if (plan.deferred().isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("const ").append(DEFERRED_PROXY).append(" = {\n");
        for (CircularImportBreak b : plan.deferred()) {
            sb.append("  get ").append(b.symbol()).append("() {\n")
              .append("    return globalThis.").append(b.symbol()).append(";\n")
              .append("  },\n");
        }
        return sb.append("};\n").toString();
    }

    /**
     * Local public declarations followed by the unit's re-export directives.
     */
    public String renderExports(SortedSet<String> localExports) {
        StringBuilder sb = new StringBuilder();
        if (!localExports.isEmpty()) {
            sb.append("export { ").append(String.join(", ", localExports)).append(" };\n");
        }
        for (ExportDirective directive : unit.exports()) {
            String path = ModulePaths.toModulePath(directive.uri(), unit);
            if (!directive.hide().isEmpty()) {
                diagnostics.add(Diagnostic.of(Severity.INFO, DiagnosticCode.EXPORT_HIDE_DROPPED,
                                "'hide " + String.join(", ", directive.hide()) + "' on export of " + directive.uri()
                                        + " cannot be expressed; everything is re-exported")
                        .withNode(unit.filePath()));
            }
            if (directive.show().isEmpty()) {
                sb.append("export * from '").append(path).append("';\n");
                continue;
            }
            SortedSet<String> shown = new TreeSet<>();
            for (String symbol : directive.show()) {
                if (!symbolTable.isTypeOnly(symbol) && !unit.typedefNames().contains(symbol)) {
                    shown.add(symbol);
                }
            }
            if (shown.isEmpty()) {
                log.debug("Export of {} only shows type aliases; nothing to re-export", directive.uri());
                continue;
            }
            sb.append("export { ").append(String.join(", ", shown)).append(" } from '").append(path).append("';\n");
        }
        return sb.toString();
    }
}
