package org.flutterjs.gen.classes;

import org.flutterjs.gen.GenTestSupport;
import org.flutterjs.gen.config.GenerationOptions;
import org.flutterjs.gen.diagnostic.DiagnosticCode;
import org.flutterjs.gen.diagnostic.Severity;
import org.flutterjs.gen.emit.EmitContext;
import org.flutterjs.gen.emit.ExpressionEmitter;
import org.flutterjs.ir.decl.ClassDecl;
import org.flutterjs.ir.decl.FieldRole;
import org.flutterjs.ir.decl.FunctionDecl;
import org.flutterjs.ir.decl.Parameter;
import org.flutterjs.ir.decl.StateAnalysis;
import org.flutterjs.ir.decl.StateFieldInfo;
import org.flutterjs.ir.expr.SuperExpr;
import org.flutterjs.ir.expr.UnaryExpr;
import org.flutterjs.ir.expr.UnaryOperator;
import org.flutterjs.ir.type.TypeRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.flutterjs.ir.Ir.assign;
import static org.flutterjs.ir.Ir.call;
import static org.flutterjs.ir.Ir.classDecl;
import static org.flutterjs.ir.Ir.field;
import static org.flutterjs.ir.Ir.id;
import static org.flutterjs.ir.Ir.lambda;
import static org.flutterjs.ir.Ir.method;
import static org.flutterjs.ir.Ir.num;
import static org.flutterjs.ir.Ir.ret;
import static org.flutterjs.ir.Ir.stmt;
import static org.flutterjs.ir.Ir.str;

class StatefulWidgetEmitterTest {

    private static final TypeRef STATE_OF_COUNTER = TypeRef.of("State", TypeRef.of("Counter"));

    private EmitContext ctx;
    private StatefulWidgetEmitter emitter;

    @BeforeEach
    void setUp() {
        ctx = GenTestSupport.context();
        emitter = new StatefulWidgetEmitter(new ClassEmitter(new ExpressionEmitter(ctx)));
    }

    private static ClassDecl counterWidget() {
        return classDecl("Counter").extendsType("StatefulWidget").build();
    }

    private static StateAnalysis analysis() {
        return new StateAnalysis("_CounterState", List.of(
                new StateFieldInfo("count", FieldRole.REACTIVE, null),
                new StateFieldInfo("controller", FieldRole.INTERNAL, "dispose")));
    }

    private static FunctionDecl build() {
        return method("build", List.of(Parameter.positional("context", TypeRef.of("BuildContext"))),
                ret(call("Text", str("count"))));
    }

    private static ClassDecl fullState() {
        return classDecl("_CounterState")
                .extendsType(STATE_OF_COUNTER)
                .field(field("count", TypeRef.of("int"), num(0)))
                .field(field("controller", TypeRef.nullable("TextEditingController"), null))
                .method(build())
                .method(method("increment", List.of(),
                        stmt(call("setState", lambda(List.of(), stmt(new UnaryExpr(UnaryOperator.POST_INCREMENT, id("count"))))))))
                .method(method("dispose", List.of(),
                        stmt(call("print", str("bye"))),
                        stmt(call(new SuperExpr(), "dispose"))))
                .method(method("initState", List.of(),
                        stmt(call(new SuperExpr(), "initState")),
                        stmt(assign(id("count"), num(1)))))
                .build();
    }

    @Test
    void widgetCreatesItsState() {
        String text = emitter.emit(counterWidget(), fullState(), Optional.of(analysis()));

        assertThat(text).startsWith("""
                class Counter extends StatefulWidget {
                  createState() {
                    return new _CounterState();
                  }
                }

                class _CounterState extends State {""");
    }

    @Test
    void stateFieldsAreGroupedByRole() {
        String text = emitter.emit(counterWidget(), fullState(), Optional.of(analysis()));

        assertThat(text).contains("""
                  constructor(...args) {
                    super(...args);
                    // Reactive state
                    this.count = 0;
                    // Internal state
                    this.controller = null;
                  }
                """);
    }

    @Test
    void lifecycleMethodsFollowTheFrameworkOrder() {
        String text = emitter.emit(counterWidget(), fullState(), Optional.of(analysis()));

        int initState = text.indexOf("initState() {");
        int dispose = text.indexOf("dispose() {");
        int setState = text.indexOf("setState(update) {");
        int increment = text.indexOf("increment() {");
        int build = text.indexOf("build(context) {");
        assertThat(initState).isPositive();
        assertThat(initState).isLessThan(dispose);
        assertThat(dispose).isLessThan(setState);
        assertThat(setState).isLessThan(increment);
        assertThat(increment).isLessThan(build);
        assertThat(text.trim()).endsWith("}\n}");
    }

    @Test
    void superCallsAreNotDuplicated() {
        String text = emitter.emit(counterWidget(), fullState(), Optional.of(analysis()));

        assertThat(text).containsOnlyOnce("super.initState();");
        assertThat(text).containsOnlyOnce("super.dispose();");
        assertThat(text).contains("""
                  initState() {
                    super.initState();
                    this.count = 1;
                  }
                """);
        assertThat(text).contains("""
                  dispose() {
                    this.controller?.dispose();
                    print("bye");
                    super.dispose();
                  }
                """);
        assertThat(ctx.diagnostics().hasErrors()).isFalse();
    }

    @Test
    void setStateRunsTheUpdateCallback() {
        String text = emitter.emit(counterWidget(), fullState(), Optional.of(analysis()));

        assertThat(text).contains("this.setState(() => {\n      this.count++;\n    });");
        assertThat(text).contains("update.call(this);");
    }

    @Test
    void disposeIsSynthesizedForResourceFields() {
        ClassDecl state = classDecl("_CounterState")
                .extendsType(STATE_OF_COUNTER)
                .field(field("controller", TypeRef.nullable("TextEditingController"), null))
                .method(build())
                .build();

        String text = emitter.emit(counterWidget(), state, Optional.of(analysis()));

        assertThat(text).contains("""
                  dispose() {
                    this.controller?.dispose();
                    super.dispose();
                  }
                """);
    }

    @Test
    void superCallsCanBeSwitchedOff() {
        EmitContext quiet = GenTestSupport.context(GenerationOptions.builder().emitSuperCalls(false).build());
        StatefulWidgetEmitter withoutSuper = new StatefulWidgetEmitter(new ClassEmitter(new ExpressionEmitter(quiet)));

        String text = withoutSuper.emit(counterWidget(), fullState(), Optional.of(analysis()));

        assertThat(text).doesNotContain("super.initState();", "super.dispose();");
    }

    @Test
    void didUpdateWidgetForwardsTheOldWidget() {
        ClassDecl state = classDecl("_CounterState")
                .extendsType(STATE_OF_COUNTER)
                .method(method("didUpdateWidget", List.of(Parameter.positional("oldWidget", TypeRef.of("Counter"))),
                        stmt(call("print", id("oldWidget")))))
                .method(build())
                .build();

        String text = emitter.emit(counterWidget(), state, Optional.empty());

        assertThat(text).contains("didUpdateWidget(oldWidget) {\n    super.didUpdateWidget(oldWidget);\n    print(oldWidget);");
    }

    @Test
    void structuralProblemsAreReported() {
        ClassDecl state = classDecl("CounterLogic").build();

        String text = emitter.emit(counterWidget(), state, Optional.empty());

        assertThat(text).contains("class CounterLogic extends State {", "return new CounterLogic();");
        assertThat(ctx.diagnostics().withCode(DiagnosticCode.MISSING_BUILD_METHOD))
                .singleElement()
                .satisfies(d -> assertThat(d.severity()).isEqualTo(Severity.ERROR));
        assertThat(ctx.diagnostics().withCode(DiagnosticCode.STATE_NAMING)).hasSize(1);
        assertThat(ctx.diagnostics().withCode(DiagnosticCode.STATE_MISSING_SUPERCLASS)).hasSize(1);
    }
}
