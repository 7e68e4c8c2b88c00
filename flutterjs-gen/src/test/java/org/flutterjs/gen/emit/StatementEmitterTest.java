package org.flutterjs.gen.emit;

import org.flutterjs.gen.GenTestSupport;
import org.flutterjs.gen.diagnostic.DiagnosticCode;
import org.flutterjs.ir.expr.BinaryOperator;
import org.flutterjs.ir.expr.UnaryExpr;
import org.flutterjs.ir.expr.UnaryOperator;
import org.flutterjs.ir.stmt.BreakStmt;
import org.flutterjs.ir.stmt.CatchClause;
import org.flutterjs.ir.stmt.ForStmt;
import org.flutterjs.ir.stmt.Statement;
import org.flutterjs.ir.stmt.SwitchCase;
import org.flutterjs.ir.stmt.SwitchStmt;
import org.flutterjs.ir.stmt.TryStmt;
import org.flutterjs.ir.stmt.UnknownStmt;
import org.flutterjs.ir.stmt.WhileStmt;
import org.flutterjs.ir.type.TypeRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.flutterjs.ir.Ir.assign;
import static org.flutterjs.ir.Ir.binary;
import static org.flutterjs.ir.Ir.block;
import static org.flutterjs.ir.Ir.call;
import static org.flutterjs.ir.Ir.finalVar;
import static org.flutterjs.ir.Ir.forEach;
import static org.flutterjs.ir.Ir.id;
import static org.flutterjs.ir.Ir.ifThen;
import static org.flutterjs.ir.Ir.local;
import static org.flutterjs.ir.Ir.num;
import static org.flutterjs.ir.Ir.ret;
import static org.flutterjs.ir.Ir.stmt;
import static org.flutterjs.ir.Ir.str;

class StatementEmitterTest {

    private EmitContext ctx;
    private StatementEmitter statements;

    @BeforeEach
    void setUp() {
        ctx = GenTestSupport.context();
        statements = new ExpressionEmitter(ctx).statements();
        ctx.scope().defineGlobal("items");
        ctx.scope().defineGlobal("risky");
    }

    private String emit(Statement s) {
        return statements.emit(s);
    }

    @Test
    void declarationsPickConstOrLet() {
        assertThat(emit(local("count", num(0)))).isEqualTo("let count = 0;\n");
        assertThat(emit(finalVar("limit", num(10)))).isEqualTo("const limit = 10;\n");
        assertThat(ctx.scope().isDefined("count")).isTrue();
    }

    @Test
    void loopVariableDoesNotLeakOutOfTheLoop() {
        String text = emit(forEach("item", id("items"), block(stmt(call("print", id("item"))))));

        assertThat(text).isEqualTo("""
                for (const item of items) {
                  print(item);
                }
                """);
        assertThat(ctx.scope().isDefined("item")).isFalse();
        assertThat(ctx.scope().isBalanced()).isTrue();

        String after = emit(stmt(call("print", id("item"))));
        assertThat(after).contains("/* unresolved: item */ item");
        assertThat(ctx.diagnostics().withCode(DiagnosticCode.UNRESOLVED_IDENTIFIER)).hasSize(1);
    }

    @Test
    void counterLoopRunsInAScriptEngine() {
        String declaration = emit(local("total", num(0)));
        String loop = emit(new ForStmt(
                List.of(local("i", num(0))),
                binary(id("i"), BinaryOperator.LESS_THAN, num(4)),
                List.of(new UnaryExpr(UnaryOperator.POST_INCREMENT, id("i"))),
                block(stmt(assign(id("total"), binary(id("total"), BinaryOperator.ADD, id("i")))))));

        assertThat(loop).startsWith("for (let i = 0; i < 4; i++) {");
        assertThat(GenTestSupport.evaluate(declaration + loop + "total;")).isEqualTo("6");
    }

    @Test
    void elseIfChainsStayFlat() {
        ctx.scope().defineGlobal("a");
        String text = emit(ifThen(binary(id("a"), BinaryOperator.GREATER_THAN, num(0)),
                block(ret(str("positive"))),
                ifThen(binary(id("a"), BinaryOperator.LESS_THAN, num(0)),
                        block(ret(str("negative"))),
                        block(ret(str("zero"))))));

        assertThat(text).isEqualTo("""
                if (a > 0) {
                  return "positive";
                } else if (a < 0) {
                  return "negative";
                } else {
                  return "zero";
                }
                """);
    }

    @Test
    void typedCatchClausesBecomeAnInstanceofChain() {
        TryStmt tryStmt = new TryStmt(
                block(stmt(call("risky"))),
                List.of(new CatchClause(TypeRef.of("FormatException"), "e", null, block(stmt(call("print", id("e"))))),
                        new CatchClause(null, "e", "st", block(stmt(call("print", id("st")))))),
                block(stmt(call("print", str("done")))));

        assertThat(emit(tryStmt)).isEqualTo("""
                try {
                  risky();
                } catch (e) {
                  if (e instanceof FormatException) {
                    print(e);
                  } else {
                    const st = e?.stack;
                    print(st);
                  }
                } finally {
                  print("done");
                }
                """);
    }

    @Test
    void typedCatchWithoutCatchAllRethrows() {
        TryStmt tryStmt = new TryStmt(
                block(stmt(call("risky"))),
                List.of(new CatchClause(TypeRef.of("StateError"), null, null, block())),
                null);

        assertThat(emit(tryStmt)).contains("if (error instanceof StateError) {", "throw error;");
    }

    @Test
    void switchCasesAlwaysBreak() {
        ctx.scope().defineGlobal("code");
        SwitchStmt switchStmt = new SwitchStmt(id("code"),
                List.of(new SwitchCase(List.of(num(1), num(2)), List.of(stmt(call("print", str("low"))))),
                        new SwitchCase(List.of(num(3)), List.of(stmt(call("print", str("three"))), new BreakStmt(null)))),
                List.of());

        assertThat(emit(switchStmt)).isEqualTo("""
                switch (code) {
                  case 1:
                  case 2: {
                    print("low");
                    break;
                  }
                  case 3: {
                    print("three");
                    break;
                  }
                  default: {
                    break;
                  }
                }
                """);
    }

    @Test
    void failedStatementLeavesAMarkerAndTheRestContinues() {
        ForStmt mixed = new ForStmt(
                List.of(local("i", num(0)), stmt(call("risky"))),
                null, List.of(), block());

        String text = emit(mixed);

        assertThat(text).startsWith("/* STATEMENT FAILED: ");
        assertThat(ctx.diagnostics().withCode(DiagnosticCode.UNSUPPORTED_STATEMENT)).hasSize(1);
        assertThat(ctx.scope().isBalanced()).isTrue();
        assertThat(emit(stmt(call("risky")))).isEqualTo("risky();\n");
    }

    @Test
    void unknownStatementIsMarked() {
        String text = emit(new WhileStmt(id("items"), new UnknownStmt("yield* items")));

        assertThat(text).contains("/* UNSUPPORTED STATEMENT: yield* items */");
        assertThat(ctx.diagnostics().hasErrors()).isTrue();
    }
}
