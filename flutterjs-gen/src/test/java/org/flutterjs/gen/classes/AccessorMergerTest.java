package org.flutterjs.gen.classes;

import org.flutterjs.gen.GenTestSupport;
import org.flutterjs.gen.IncompatibleAccessorException;
import org.flutterjs.gen.diagnostic.DiagnosticCode;
import org.flutterjs.gen.diagnostic.DiagnosticCollector;
import org.flutterjs.gen.emit.EmitContext;
import org.flutterjs.gen.emit.ExpressionEmitter;
import org.flutterjs.ir.decl.FunctionDecl;
import org.flutterjs.ir.decl.ParameterKind;
import org.flutterjs.ir.expr.BinaryOperator;
import org.flutterjs.ir.stmt.IfStmt;
import org.flutterjs.ir.stmt.ReturnStmt;
import org.flutterjs.ir.type.TypeRef;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.flutterjs.ir.Ir.assign;
import static org.flutterjs.ir.Ir.binary;
import static org.flutterjs.ir.Ir.getter;
import static org.flutterjs.ir.Ir.id;
import static org.flutterjs.ir.Ir.method;
import static org.flutterjs.ir.Ir.num;
import static org.flutterjs.ir.Ir.ret;
import static org.flutterjs.ir.Ir.setter;
import static org.flutterjs.ir.Ir.stmt;

class AccessorMergerTest {

    private static FunctionDecl counterGetter() {
        return getter("counter", ret(id("_counter")));
    }

    private static FunctionDecl counterSetter() {
        return setter("counter", "v", stmt(assign(id("_counter"), id("v"))));
    }

    @Test
    void mergedFunctionTakesOneOptionalValue() {
        FunctionDecl merged = AccessorMerger.mergePair("top level", counterGetter(), counterSetter());

        assertThat(merged.name()).isEqualTo("counter");
        assertThat(merged.isGetter()).isFalse();
        assertThat(merged.isSetter()).isFalse();
        assertThat(merged.parameters()).singleElement().satisfies(p -> {
            assertThat(p.name()).isEqualTo("v");
            assertThat(p.kind()).isEqualTo(ParameterKind.OPTIONAL_POSITIONAL);
        });
        assertThat(merged.body().statements()).hasSize(2);
        assertThat(merged.body().statements().get(0)).isInstanceOf(IfStmt.class);
        assertThat(merged.body().statements().get(1)).isInstanceOf(ReturnStmt.class);
    }

    @Test
    void mergePreservesDeclarationPositionOfTheFirstAccessor() {
        FunctionDecl before = method("reset", List.of(), stmt(assign(id("_counter"), num(0))));
        FunctionDecl after = method("describe", List.of());
        DiagnosticCollector diagnostics = new DiagnosticCollector();

        List<FunctionDecl> merged = AccessorMerger.merge("Store",
                List.of(before, counterSetter(), after, counterGetter()), diagnostics);

        assertThat(merged).extracting(FunctionDecl::name).containsExactly("reset", "counter", "describe");
        assertThat(AccessorMerger.mergedNames(List.of(before, counterSetter(), after, counterGetter()), merged))
                .containsExactly("counter");
        assertThat(diagnostics.isEmpty()).isTrue();
    }

    @Test
    void staticMismatchIsRejected() {
        FunctionDecl staticGetter = new FunctionDecl("counter", List.of(), TypeRef.DYNAMIC,
                counterGetter().body(), false, true, false, true);

        assertThatThrownBy(() -> AccessorMerger.mergePair("Store", staticGetter, counterSetter()))
                .isInstanceOf(IncompatibleAccessorException.class)
                .satisfies(e -> {
                    IncompatibleAccessorException ex = (IncompatibleAccessorException) e;
                    assertThat(ex.getOwnerName()).isEqualTo("Store");
                    assertThat(ex.getAccessorName()).isEqualTo("counter");
                    assertThat(ex.getMessage()).isEqualTo(
                            "Cannot merge getter/setter 'counter' on 'Store': one accessor is static and the other is not");
                });
    }

    @Test
    void unmergeablePairIsKeptAndReported() {
        FunctionDecl staticGetter = new FunctionDecl("counter", List.of(), TypeRef.DYNAMIC,
                counterGetter().body(), false, true, false, true);
        DiagnosticCollector diagnostics = new DiagnosticCollector();

        List<FunctionDecl> result = AccessorMerger.merge("Store", List.of(staticGetter, counterSetter()), diagnostics);

        assertThat(result).hasSize(2).allMatch(FunctionDecl::isAccessor);
        assertThat(diagnostics.withCode(DiagnosticCode.ACCESSOR_MERGE_FAILED)).hasSize(1);
    }

    @Test
    void mergedTopLevelAccessorReadsAndWrites() {
        EmitContext ctx = GenTestSupport.context();
        ctx.scope().defineGlobal("_counter");
        ctx.scope().defineGlobal("counter");
        ctx.addTopLevelAccessors(List.of("counter"));
        FunctionEmitter functions = new FunctionEmitter(new ExpressionEmitter(ctx));

        String text = functions.emitFunction(AccessorMerger.mergePair("top level", counterGetter(), counterSetter()));

        assertThat(text).isEqualTo("""
                function counter(v) {
                  if (v !== undefined) {
                    _counter = v;
                    return v;
                  }
                  return _counter;
                }""");
        String script = "var _counter = 1;\n" + text + "\n"
                + "var before = counter();\n"
                + "var written = counter(5);\n"
                + "before + ':' + written + ':' + counter();";
        assertThat(GenTestSupport.evaluate(script)).isEqualTo("1:5:5");
    }

    @Test
    void assignmentsThroughAMergedAccessorBecomeCalls() {
        EmitContext ctx = GenTestSupport.context();
        ctx.scope().defineGlobal("counter");
        ctx.addTopLevelAccessors(List.of("counter"));
        ExpressionEmitter expressions = new ExpressionEmitter(ctx);

        assertThat(expressions.emit(assign(id("counter"), num(3)))).isEqualTo("counter(3)");
        assertThat(expressions.emit(binary(id("counter"), BinaryOperator.ADD, num(1)))).isEqualTo("counter() + 1");
    }
}
