package org.flutterjs.gen.classes;

import org.flutterjs.gen.GenTestSupport;
import org.flutterjs.gen.diagnostic.DiagnosticCode;
import org.flutterjs.gen.diagnostic.Severity;
import org.flutterjs.gen.emit.EmitContext;
import org.flutterjs.gen.emit.ExpressionEmitter;
import org.flutterjs.ir.decl.FunctionDecl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.flutterjs.ir.Ir.method;
import static org.flutterjs.ir.Ir.num;
import static org.flutterjs.ir.Ir.ret;

class FunctionEmitterTest {

    private EmitContext ctx;
    private FunctionEmitter functions;

    @BeforeEach
    void setUp() {
        ctx = GenTestSupport.context();
        functions = new FunctionEmitter(new ExpressionEmitter(ctx));
    }

    @Test
    void failingMethodBecomesAStubThatThrows() {
        FunctionDecl reset = method("reset", List.of(), ret(num(0)));

        String text = functions.emitMethod("Counter", reset, out -> {
            throw new IllegalStateException("no receiver");
        }, FunctionEmitter.bodyOf(reset), out -> {
        });

        assertThat(text).isEqualTo("""
                reset(...args) {
                  /* GENERATION FAILED: no receiver */
                  throw new Error("Generation failed for Counter.reset");
                }""");
        assertThat(ctx.diagnostics().withCode(DiagnosticCode.METHOD_GENERATION_FAILED)).singleElement().satisfies(d -> {
            assertThat(d.severity()).isEqualTo(Severity.WARNING);
            assertThat(d.node()).isEqualTo("Counter.reset");
            assertThat(d.message()).contains("no receiver");
        });
        assertThat(ctx.scope().isBalanced()).isTrue();
    }

    @Test
    void otherMethodsAreUnaffectedByAFailedOne() {
        FunctionDecl broken = method("broken", List.of(), ret(num(0)));
        FunctionDecl fine = method("fine", List.of(), ret(num(1)));

        functions.emitMethod("Counter", broken, out -> {
            throw new IllegalStateException("boom");
        }, FunctionEmitter.bodyOf(broken), out -> {
        });
        String text = functions.emitMethod("Counter", fine);

        assertThat(text).isEqualTo("fine() {\n  return 1;\n}");
    }
}
