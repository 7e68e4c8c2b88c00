package org.flutterjs.gen.imports;

import org.flutterjs.gen.config.GenerationOptions;
import org.flutterjs.gen.config.Target;
import org.flutterjs.gen.diagnostic.DiagnosticCode;
import org.flutterjs.gen.diagnostic.DiagnosticCollector;
import org.flutterjs.gen.diagnostic.Severity;
import org.flutterjs.gen.registry.WidgetRegistry;
import org.flutterjs.ir.ProgramUnit;
import org.flutterjs.ir.decl.ExportDirective;
import org.flutterjs.ir.decl.ImportDirective;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;

class ImportResolverTest {

    private DiagnosticCollector diagnostics;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticCollector();
    }

    private ImportResolver resolver(ProgramUnit unit, GlobalSymbolTable table, CircularImportTable cycles) {
        return resolver(unit, table, cycles, GenerationOptions.defaults());
    }

    private ImportResolver resolver(ProgramUnit unit, GlobalSymbolTable table, CircularImportTable cycles,
                                    GenerationOptions options) {
        return new ImportResolver(unit, options, WidgetRegistry.standard(), table, cycles, diagnostics);
    }

    private static ProgramUnit.Builder appUnit(String filePath) {
        return ProgramUnit.builder(filePath).packageName("app");
    }

    @Test
    void runtimeSymbolsAreGroupedAndSorted() {
        ProgramUnit unit = appUnit("lib/main.dart").build();
        Set<String> used = Set.of("Text", "Future", "StatefulWidget", "Center", "helper", "x", "Home", "Math");

        ImportResolver resolver = resolver(unit, GlobalSymbolTable.empty(), CircularImportTable.empty());
        String first = resolver.renderImports(resolver.resolve(used, Set.of("Home")));
        String second = resolver.renderImports(resolver.resolve(used, Set.of("Home")));

        assertThat(first).isEqualTo("""
                import { Future } from '@flutterjs/dart/async';
                import { Center, StatefulWidget, Text } from '@flutterjs/material';
                """);
        assertThat(second).isEqualTo(first);
        assertThat(diagnostics.isEmpty()).isTrue();
    }

    @Test
    void widgetsAreNotImportedForTheNodeTarget() {
        ProgramUnit unit = appUnit("bin/tool.dart").build();
        GenerationOptions node = GenerationOptions.builder().target(Target.NODE).build();

        ImportPlan plan = resolver(unit, GlobalSymbolTable.empty(), CircularImportTable.empty(), node)
                .resolve(Set.of("Text", "Timer"), Set.of());

        assertThat(plan.namedImports()).containsOnlyKeys("@flutterjs/dart/async");
        assertThat(diagnostics.isEmpty()).isTrue();
    }

    @Test
    void projectSymbolsResolveThroughTheGlobalTable() {
        ProgramUnit unit = appUnit("lib/main.dart")
                .addImport(ImportDirective.of("package:app/src/services/user_service.dart"))
                .addImport(ImportDirective.of("package:app/polyfills.dart"))
                .build();
        GlobalSymbolTable table = GlobalSymbolTable.builder()
                .symbol("UserService", "package:app/src/services/user_service.dart", SymbolKind.CLASS)
                .symbol("formatDate", "package:app/src/services/user_service.dart", SymbolKind.FUNCTION)
                .symbol("Callback", "package:app/src/types.dart", SymbolKind.TYPEDEF)
                .build();

        ImportResolver resolver = resolver(unit, table, CircularImportTable.empty());
        ImportPlan plan = resolver.resolve(Set.of("UserService", "formatDate", "Callback"), Set.of());

        assertThat(resolver.renderImports(plan)).isEqualTo("""
                import { UserService, formatDate } from './src/services/user_service.js';
                import * as _import_0 from './polyfills.js';
                """);
        assertThat(plan.importedSymbols()).doesNotContain("Callback");
        assertThat(diagnostics.isEmpty()).isTrue();
    }

    @Test
    void explicitShowOutranksFileNameMatches() {
        ProgramUnit unit = appUnit("lib/main.dart")
                .addImport(ImportDirective.of("package:app/avatar.dart"))
                .addImport(new ImportDirective("package:app/widgets.dart", null, List.of("Avatar"), List.of()))
                .addImport(ImportDirective.of("package:http/http_client.dart"))
                .build();

        ImportResolver resolver = resolver(unit, GlobalSymbolTable.empty(), CircularImportTable.empty());
        ImportPlan plan = resolver.resolve(Set.of("Avatar", "HttpClient"), Set.of());

        assertThat(plan.namedImports()).containsEntry("./widgets.js", new TreeSet<>(Set.of("Avatar")));
        assertThat(plan.namedImports()).containsEntry("@flutterjs/http/dist/http_client.js", new TreeSet<>(Set.of("HttpClient")));
        assertThat(plan.namespaceImports()).containsExactlyEntriesOf(Map.of("./avatar.js", "_import_0"));
    }

    @Test
    void prefixedImportBecomesANamespace() {
        ProgramUnit unit = appUnit("lib/api.dart")
                .addImport(new ImportDirective("package:http/http.dart", "http", List.of(), List.of()))
                .build();

        ImportResolver resolver = resolver(unit, GlobalSymbolTable.empty(), CircularImportTable.empty());

        assertThat(resolver.renderImports(resolver.resolve(Set.of("http"), Set.of())))
                .isEqualTo("import * as http from '@flutterjs/http';\n");
    }

    @Test
    void unknownSymbolIsReported() {
        ProgramUnit unit = appUnit("lib/main.dart").build();

        ImportPlan plan = resolver(unit, GlobalSymbolTable.empty(), CircularImportTable.empty())
                .resolve(Set.of("Mystery"), Set.of());

        assertThat(plan.importStatementCount()).isZero();
        assertThat(diagnostics.withCode(DiagnosticCode.UNRESOLVED_IMPORT)).singleElement().satisfies(d -> {
            assertThat(d.severity()).isEqualTo(Severity.WARNING);
            assertThat(d.message()).contains("'Mystery'");
        });
    }

    @Test
    void malformedLibraryUriIsReportedAndSkipped() {
        ProgramUnit unit = appUnit("lib/main.dart").build();
        GlobalSymbolTable table = GlobalSymbolTable.builder()
                .symbol("Broken", "package:/broken.dart", SymbolKind.CLASS)
                .symbol("Fine", "package:app/fine.dart", SymbolKind.CLASS)
                .build();

        ImportPlan plan = resolver(unit, table, CircularImportTable.empty()).resolve(Set.of("Broken", "Fine"), Set.of());

        assertThat(plan.namedImports()).containsOnlyKeys("./fine.js");
        assertThat(diagnostics.withCode(DiagnosticCode.UNRESOLVED_IMPORT)).singleElement().satisfies(d -> {
            assertThat(d.node()).isEqualTo("package:/broken.dart#Broken");
            assertThat(d.message()).startsWith("Cannot import 'Broken' from 'package:/broken.dart': ");
        });
    }

    @Test
    void knownCycleIsBrokenWithTheDeferredProxy() {
        ProgramUnit unit = ProgramUnit.builder("lib/path.dart")
                .packageName("path")
                .addImport(ImportDirective.of("package:path/src/context.dart"))
                .build();
        GlobalSymbolTable table = GlobalSymbolTable.builder()
                .symbol("Context", "package:path/src/context.dart", SymbolKind.CLASS)
                .dependency("package:path/src/context.dart", "package:path/path.dart")
                .build();

        ImportResolver resolver = resolver(unit, table, CircularImportTable.standard());
        ImportPlan plan = resolver.resolve(Set.of("Context"), Set.of());

        assertThat(plan.isDeferred("Context")).isTrue();
        assertThat(plan.namedImports()).isEmpty();
        assertThat(plan.namespaceImports()).isEmpty();
        assertThat(resolver.renderDeferred(plan)).isEqualTo("""
                const __deferred = {
                  get Context() {
                    return globalThis.Context;
                  },
                };
                """);
        assertThat(diagnostics.isEmpty()).isTrue();
    }

    @Test
    void unlistedCycleIsImportedAndReported() {
        ProgramUnit unit = appUnit("lib/a.dart").build();
        GlobalSymbolTable table = GlobalSymbolTable.builder()
                .symbol("B", "package:app/b.dart", SymbolKind.CLASS)
                .dependency("package:app/b.dart", "package:app/a.dart")
                .build();

        ImportResolver resolver = resolver(unit, table, CircularImportTable.empty());
        ImportPlan plan = resolver.resolve(Set.of("B"), Set.of());

        assertThat(resolver.renderImports(plan)).isEqualTo("import { B } from './b.js';\n");
        assertThat(resolver.renderDeferred(plan)).isEmpty();
        assertThat(diagnostics.withCode(DiagnosticCode.CIRCULAR_IMPORT)).singleElement()
                .satisfies(d -> assertThat(d.severity()).isEqualTo(Severity.WARNING));
    }

    @Test
    void exportsListLocalNamesThenReExports() {
        ProgramUnit unit = appUnit("lib/app.dart")
                .addExport(new ExportDirective("package:app/src/a.dart", List.of(), List.of("Secret")))
                .addExport(new ExportDirective("package:app/src/b.dart", List.of("Shown", "Alias"), List.of()))
                .addTypedef("Alias")
                .build();

        String text = resolver(unit, GlobalSymbolTable.empty(), CircularImportTable.empty())
                .renderExports(new TreeSet<>(Set.of("Home", "App")));

        assertThat(text).isEqualTo("""
                export { App, Home };
                export * from './src/a.js';
                export { Shown } from './src/b.js';
                """);
        assertThat(diagnostics.withCode(DiagnosticCode.EXPORT_HIDE_DROPPED)).singleElement()
                .satisfies(d -> assertThat(d.severity()).isEqualTo(Severity.INFO));
    }

    @Test
    void loopVariablesAndLowercaseLocalsAreNeverImported() {
        ImportResolver resolver = resolver(appUnit("lib/main.dart").build(), GlobalSymbolTable.empty(),
                CircularImportTable.empty());

        assertThat(resolver.isExcluded("i", Set.of())).isTrue();
        assertThat(resolver.isExcluded("counter", Set.of())).isTrue();
        assertThat(resolver.isExcluded("Home", Set.of("Home"))).isTrue();
        assertThat(resolver.isExcluded("undefined", Set.of())).isTrue();
        assertThat(resolver.isExcluded("runApp", Set.of())).isFalse();
        assertThat(resolver.isExcluded("Profile", Set.of())).isFalse();
    }
}
