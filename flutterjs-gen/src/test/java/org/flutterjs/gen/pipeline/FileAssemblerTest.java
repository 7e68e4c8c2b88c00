package org.flutterjs.gen.pipeline;

import org.flutterjs.gen.config.GenerationOptions;
import org.flutterjs.gen.diagnostic.Diagnostic;
import org.flutterjs.gen.diagnostic.DiagnosticCode;
import org.flutterjs.gen.diagnostic.Severity;
import org.flutterjs.ir.ProgramUnit;
import org.flutterjs.ir.decl.ClassDecl;
import org.flutterjs.ir.decl.EnumDecl;
import org.flutterjs.ir.decl.FunctionDecl;
import org.flutterjs.ir.decl.Parameter;
import org.flutterjs.ir.decl.VariableDecl;
import org.flutterjs.ir.expr.ListLiteralExpr;
import org.flutterjs.ir.expr.UnaryExpr;
import org.flutterjs.ir.expr.UnaryOperator;
import org.flutterjs.ir.type.TypeRef;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.flutterjs.ir.Ir.block;
import static org.flutterjs.ir.Ir.call;
import static org.flutterjs.ir.Ir.classDecl;
import static org.flutterjs.ir.Ir.create;
import static org.flutterjs.ir.Ir.field;
import static org.flutterjs.ir.Ir.forEach;
import static org.flutterjs.ir.Ir.id;
import static org.flutterjs.ir.Ir.local;
import static org.flutterjs.ir.Ir.method;
import static org.flutterjs.ir.Ir.named;
import static org.flutterjs.ir.Ir.nul;
import static org.flutterjs.ir.Ir.num;
import static org.flutterjs.ir.Ir.ret;
import static org.flutterjs.ir.Ir.stmt;
import static org.flutterjs.ir.Ir.str;

class FileAssemblerTest {

    private static final List<Parameter> BUILD_PARAMETERS =
            List.of(Parameter.positional("context", TypeRef.of("BuildContext")));

    private static GenerationResult generate(ProgramUnit unit) {
        return new FileAssembler(GenerationOptions.defaults()).generate(unit);
    }

    private static ProgramUnit.Builder unit(String filePath) {
        return ProgramUnit.builder(filePath).packageName("app");
    }

    private static FunctionDecl mainPrinting(String text) {
        return method("main", List.of(), stmt(call("print", str(text))));
    }

    @Test
    void statelessWidgetWithAStableChildIsClean() {
        ClassDecl foo = classDecl("Foo")
                .extendsType("StatelessWidget")
                .method(method("build", BUILD_PARAMETERS, ret(call("Text", str("hi")))))
                .build();

        GenerationResult result = generate(unit("lib/foo.dart").addClass(foo).build());

        assertThat(result.success()).isTrue();
        assertThat(result.code()).contains("class Foo extends StatelessWidget {", "build(context) {",
                "return new Text({", "data: \"hi\",");
        assertThat(result.code()).contains("import { StatelessWidget, Text } from '@flutterjs/material';");
        assertThat(result.errors()).isEmpty();
        assertThat(result.statistics().usedWidgets()).contains("Text");
    }

    @Test
    void stateWithoutBuildIsOneErrorButStillGenerates() {
        ClassDecl counter = classDecl("Counter").extendsType("StatefulWidget").build();
        ClassDecl state = classDecl("_CounterState")
                .extendsType(TypeRef.of("State", TypeRef.of("Counter")))
                .method(method("reset", List.of()))
                .build();

        GenerationResult result = generate(unit("lib/counter.dart").addClass(counter).addClass(state).build());

        assertThat(result.success()).isTrue();
        assertThat(result.code()).contains("createState() {", "class _CounterState extends State {");
        assertThat(result.errors()).singleElement().satisfies(d -> {
            assertThat(d.code()).isEqualTo(DiagnosticCode.MISSING_BUILD_METHOD);
            assertThat(d.message()).contains("build");
        });
    }

    @Test
    void loopVariableIsScopedToTheLoopBody() {
        ClassDecl lister = classDecl("Lister")
                .method(method("show", List.of(Parameter.positional("items", TypeRef.of("List", TypeRef.of("String")))),
                        local("item", str("outer")),
                        forEach("item", id("items"), block(stmt(call("print", id("item"))))),
                        stmt(call("print", id("item")))))
                .build();

        GenerationResult result = generate(unit("lib/lister.dart").addClass(lister).build());

        assertThat(result.code()).contains("""
                    let item = "outer";
                    for (const item of items) {
                      print(item);
                    }
                    print(item);
                """);
        assertThat(result.code()).doesNotContain("unresolved");
        assertThat(result.diagnostics()).extracting(Diagnostic::code).doesNotContain(DiagnosticCode.UNRESOLVED_IDENTIFIER);
    }

    @Test
    void superclassIsEmittedBeforeItsSubclass() {
        ClassDecl b = classDecl("B").extendsType("A").build();
        ClassDecl a = classDecl("A").field(field("id", TypeRef.of("int"), num(1))).build();

        String code = generate(unit("lib/ab.dart").addClass(b).addClass(a).build()).code();

        assertThat(code.indexOf("class A {")).isPositive().isLessThan(code.indexOf("class B extends A {"));
    }

    @Test
    void emptyUnitFails() {
        GenerationResult result = generate(unit("lib/empty.dart").build());

        assertThat(result.success()).isFalse();
        assertThat(result.codeIfPresent()).isEmpty();
        assertThat(result.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.code()).isEqualTo(DiagnosticCode.EMPTY_PROGRAM_UNIT);
            assertThat(d.severity()).isEqualTo(Severity.FATAL);
        });
    }

    @Test
    void missingUnitIsReportedNotThrown() {
        GenerationResult result = generate(null);

        assertThat(result.success()).isFalse();
        assertThat(result.filePath()).isEqualTo("<none>");
        assertThat(result.diagnostics()).extracting(Diagnostic::code).containsExactly(DiagnosticCode.GENERATION_FAILED);
    }

    @Test
    void strictWidgetViolationFailsTheFile() {
        ClassDecl page = classDecl("Page")
                .extendsType("StatelessWidget")
                .method(method("build", BUILD_PARAMETERS, ret(create("FlatButton", named("onPressed", nul())))))
                .build();
        FileAssembler strict = new FileAssembler(GenerationOptions.builder().strictMode(true).build());

        GenerationResult result = strict.generate(unit("lib/page.dart").addClass(page).build());

        assertThat(result.success()).isFalse();
        assertThat(result.failureMessage()).contains("FlatButton");
        assertThat(result.withSeverity(Severity.FATAL)).extracting(Diagnostic::code)
                .containsExactly(DiagnosticCode.GENERATION_FAILED);
    }

    @Test
    void outOfRangeOptimizationLevelFallsBackToOne() {
        GenerationOptions options = GenerationOptions.builder().optimize(true).optimizationLevel(7).build();

        GenerationResult result = new FileAssembler(options)
                .generate(unit("lib/main.dart").addFunction(mainPrinting("hello")).build());

        assertThat(result.success()).isTrue();
        assertThat(result.optimizationResult()).isPresent();
        assertThat(result.code()).doesNotStartWith("// Optimized");
        assertThat(result.warnings()).extracting(Diagnostic::code).contains(DiagnosticCode.INVALID_OPTIMIZATION_LEVEL);
    }

    @Test
    void structurallyBrokenOutputIsKeptBehindABannerThatOptimizationKeeps() {
        // a malformed member name from the front end leaves an unmatched '(' in the class body
        ClassDecl odd = classDecl("Odd").method(method("run(", List.of(), ret(num(1)))).build();
        GenerationOptions options = GenerationOptions.builder().optimize(true).optimizationLevel(3).build();

        GenerationResult result = new FileAssembler(options).generate(unit("lib/odd.dart").addClass(odd).build());

        assertThat(result.success()).isTrue();
        assertThat(result.validationReport()).hasValueSatisfying(v -> assertThat(v.hasCriticalIssues()).isTrue());
        assertThat(result.code()).startsWith("/*\n * ========================================\n"
                + " * GENERATED CODE HAS STRUCTURAL ERRORS\n");
        assertThat(result.code()).contains(" * The output below is kept for inspection.\n", "class Odd {\nrun(() {");
        assertThat(result.diagnostics()).extracting(Diagnostic::code).contains(DiagnosticCode.VALIDATION);
    }

    @Test
    void bannerCanBeSwitchedOff() {
        ClassDecl odd = classDecl("Odd").method(method("run(", List.of(), ret(num(1)))).build();
        GenerationOptions options = GenerationOptions.builder().errorBanner(false).build();

        String code = new FileAssembler(options).generate(unit("lib/odd.dart").addClass(odd).build()).code();

        assertThat(code).startsWith("// Generated by FlutterJS from lib/odd.dart");
        assertThat(code).doesNotContain("GENERATED CODE HAS STRUCTURAL ERRORS");
    }

    @Test
    void outputIsDeterministic() {
        ProgramUnit unit = unit("lib/main.dart")
                .addClass(classDecl("Home").extendsType("StatelessWidget")
                        .method(method("build", BUILD_PARAMETERS,
                                ret(create("Column", named("children", new ListLiteralExpr(
                                        List.of(call("Text", str("a")), call("Text", str("b"))), false))))))
                        .build())
                .addFunction(mainPrinting("go"))
                .build();
        FileAssembler assembler = new FileAssembler(GenerationOptions.defaults());

        assertThat(assembler.generate(unit).code()).isEqualTo(assembler.generate(unit).code());
    }

    @Test
    void fileStartsWithTheHeaderAndEndsWithExportsAndMain() {
        FunctionDecl helper = method("_helper", List.of(), ret(num(1)));
        ProgramUnit unit = unit("lib/main.dart").addFunction(mainPrinting("hi")).addFunction(helper).build();

        String code = generate(unit).code();

        assertThat(code).startsWith("// Generated by FlutterJS from lib/main.dart\n// Do not edit by hand.\n\n");
        assertThat(code).contains("function main() {\n  print(\"hi\");\n}", "function _helper() {");
        assertThat(code).endsWith("export { main };\n\nmain();\n");

        String library = new FileAssembler(GenerationOptions.builder().invokeMain(false).build()).generate(unit).code();
        assertThat(library).endsWith("export { main };\n");
    }

    @Test
    void topLevelVariablesPickTheirKeyword() {
        ProgramUnit unit = unit("lib/config.dart")
                .addVariable(new VariableDecl("retries", TypeRef.of("int"), num(3), true, false))
                .addVariable(new VariableDecl("cache", TypeRef.nullable("String"), null, false, false))
                .build();

        String code = generate(unit).code();

        assertThat(code).contains("const retries = 3;\nlet cache;");
        assertThat(code).contains("export { cache, retries };");
    }

    @Test
    void enumsBecomeFrozenObjects() {
        ProgramUnit unit = unit("lib/status.dart").addEnum(new EnumDecl("Status", List.of("active", "inactive"))).build();

        String code = generate(unit).code();

        assertThat(code).contains("""
                const Status = (() => {
                  const active = Object.freeze({ index: 0, name: "active", toString() { return "Status.active"; } });
                  const inactive = Object.freeze({ index: 1, name: "inactive", toString() { return "Status.inactive"; } });
                  return Object.freeze({ active, inactive, values: Object.freeze([active, inactive]) });
                })();""");
        assertThat(code).contains("export { Status };");
    }

    @Test
    void usedRuntimeHelpersAreDefinedOnce() {
        FunctionDecl first = method("first", List.of(Parameter.positional("value", TypeRef.nullable("String"))),
                ret(new UnaryExpr(UnaryOperator.NULL_ASSERT, id("value"))));
        FunctionDecl second = method("second", List.of(Parameter.positional("value", TypeRef.nullable("String"))),
                ret(new UnaryExpr(UnaryOperator.NULL_ASSERT, id("value"))));

        GenerationResult result = generate(unit("lib/util.dart").addFunction(first).addFunction(second).build());

        assertThat(result.code()).contains(String.format(FileAssembler.HELPERS_BANNER, 1));
        assertThat(result.code()).containsOnlyOnce("function nullAssert(value) {");
        assertThat(result.statistics().usedHelpers()).containsExactly("nullAssert");
    }
}
