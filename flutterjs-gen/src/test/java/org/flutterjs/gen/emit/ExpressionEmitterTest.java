package org.flutterjs.gen.emit;

import org.flutterjs.gen.GenTestSupport;
import org.flutterjs.gen.diagnostic.DiagnosticCode;
import org.flutterjs.gen.diagnostic.Severity;
import org.flutterjs.ir.expr.AsExpr;
import org.flutterjs.ir.expr.AwaitExpr;
import org.flutterjs.ir.expr.BinaryOperator;
import org.flutterjs.ir.expr.ConditionalExpr;
import org.flutterjs.ir.expr.Expression;
import org.flutterjs.ir.expr.InterpolationPart;
import org.flutterjs.ir.expr.IsExpr;
import org.flutterjs.ir.expr.ListLiteralExpr;
import org.flutterjs.ir.expr.LiteralExpr;
import org.flutterjs.ir.expr.MapEntryExpr;
import org.flutterjs.ir.expr.MapLiteralExpr;
import org.flutterjs.ir.expr.StringInterpolationExpr;
import org.flutterjs.ir.expr.UnaryExpr;
import org.flutterjs.ir.expr.UnaryOperator;
import org.flutterjs.ir.expr.UnknownExpr;
import org.flutterjs.ir.type.TypeRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.flutterjs.ir.Ir.binary;
import static org.flutterjs.ir.Ir.call;
import static org.flutterjs.ir.Ir.id;
import static org.flutterjs.ir.Ir.nul;
import static org.flutterjs.ir.Ir.num;
import static org.flutterjs.ir.Ir.str;

class ExpressionEmitterTest {

    private EmitContext ctx;
    private ExpressionEmitter emitter;

    @BeforeEach
    void setUp() {
        ctx = GenTestSupport.context();
        emitter = new ExpressionEmitter(ctx);
        for (String name : List.of("a", "b", "c", "name")) {
            ctx.scope().addVariable(name, TypeRef.DYNAMIC, false, false, false);
        }
    }

    private String emit(Expression e) {
        return emitter.emit(e);
    }

    @Test
    void equalityUsesStrictOperators() {
        assertThat(emit(binary(id("a"), BinaryOperator.EQUALS, id("b")))).isEqualTo("a === b");
        assertThat(emit(binary(id("a"), BinaryOperator.NOT_EQUALS, id("b")))).isEqualTo("a !== b");
    }

    @Test
    void comparisonWithNullStaysLoose() {
        assertThat(emit(binary(id("a"), BinaryOperator.EQUALS, nul()))).isEqualTo("a == null");
        assertThat(emit(binary(nul(), BinaryOperator.NOT_EQUALS, id("a")))).isEqualTo("null != a");
    }

    @Test
    void floorDivisionTruncatesTowardNegativeInfinity() {
        String text = emit(binary(id("a"), BinaryOperator.FLOOR_DIVIDE, id("b")));

        assertThat(text).isEqualTo("Math.floor(a / b)");
        assertThat(GenTestSupport.evaluate("var a = 7; var b = 2; " + text)).isEqualTo("3");
        assertThat(GenTestSupport.evaluate("var a = -7; var b = 2; " + text)).isEqualTo("-4");
    }

    @Test
    void parenthesesFollowPrecedence() {
        assertThat(emit(binary(binary(id("a"), BinaryOperator.ADD, id("b")), BinaryOperator.MULTIPLY, id("c"))))
                .isEqualTo("(a + b) * c");
        assertThat(emit(binary(id("a"), BinaryOperator.SUBTRACT, binary(id("b"), BinaryOperator.SUBTRACT, id("c")))))
                .isEqualTo("a - (b - c)");
        assertThat(emit(binary(binary(id("a"), BinaryOperator.MULTIPLY, id("b")), BinaryOperator.ADD, id("c"))))
                .isEqualTo("a * b + c");
    }

    @Test
    void nullishMixedWithLogicalOperatorIsParenthesized() {
        String text = emit(binary(binary(id("a"), BinaryOperator.IF_NULL, id("b")), BinaryOperator.LOGICAL_OR, id("c")));

        assertThat(text).isEqualTo("(a ?? b) || c");
    }

    @Test
    void nullAssertionUsesTheRuntimeHelper() {
        String text = emit(new UnaryExpr(UnaryOperator.NULL_ASSERT, id("a")));

        assertThat(text).isEqualTo("nullAssert(a)");
        assertThat(ctx.usedHelpers()).containsExactly(RuntimeHelper.NULL_ASSERT);
    }

    @Test
    void classCastIsCheckedAtRuntime() {
        String text = emit(new AsExpr(id("a"), TypeRef.of("User")));

        assertThat(text).isEqualTo("typeAssertion(a, User, \"a\")");
        assertThat(ctx.usedHelpers()).contains(RuntimeHelper.TYPE_ASSERTION);
    }

    @Test
    void primitiveCastPassesThrough() {
        assertThat(emit(new AsExpr(id("a"), TypeRef.of("int")))).isEqualTo("a");
        assertThat(ctx.usedHelpers()).isEmpty();
    }

    @Test
    void typeTestsMapToRuntimePredicates() {
        assertThat(emit(new IsExpr(id("a"), TypeRef.of("String"), false))).isEqualTo("typeof a === 'string'");
        assertThat(emit(new IsExpr(id("a"), TypeRef.of("int"), true))).isEqualTo("!(Number.isInteger(a))");
        assertThat(emit(new IsExpr(id("a"), TypeRef.of("User"), false))).isEqualTo("a instanceof User");
    }

    @Test
    void awaitOutsideAsyncIsDroppedWithWarning() {
        String text = emit(new AwaitExpr(id("a")));

        assertThat(text).isEqualTo("a");
        assertThat(ctx.diagnostics().withCode(DiagnosticCode.AWAIT_OUTSIDE_ASYNC))
                .singleElement()
                .satisfies(d -> assertThat(d.severity()).isEqualTo(Severity.WARNING));
    }

    @Test
    void awaitInsideAsyncIsKept() {
        String text = ctx.inFunction(true, () -> emit(new AwaitExpr(call(id("a"), "load"))));

        assertThat(text).isEqualTo("await a.load()");
        assertThat(ctx.diagnostics().isEmpty()).isTrue();
    }

    @Test
    void unknownExpressionLeavesAMarker() {
        String text = emit(new UnknownExpr("a?..b"));

        assertThat(text).isEqualTo("/* UNSUPPORTED EXPRESSION: a?..b */ undefined");
        assertThat(ctx.diagnostics().withCode(DiagnosticCode.UNSUPPORTED_EXPRESSION)).hasSize(1);
        assertThat(ctx.diagnostics().hasErrors()).isTrue();
    }

    @Test
    void unresolvedIdentifierIsMarkedButStillEmitted() {
        String text = emit(binary(id("ghost"), BinaryOperator.ADD, num(1)));

        assertThat(text).isEqualTo("/* unresolved: ghost */ ghost + 1");
        assertThat(ctx.diagnostics().withCode(DiagnosticCode.UNRESOLVED_IDENTIFIER)).hasSize(1);
    }

    @Test
    void runtimeNamesNeedNoDeclaration() {
        assertThat(emit(call("print", str("hi")))).isEqualTo("print(\"hi\")");
        assertThat(emit(call(id("Math"), "max", id("a"), id("b")))).isEqualTo("Math.max(a, b)");
        assertThat(ctx.diagnostics().isEmpty()).isTrue();
    }

    @Test
    void interpolationBecomesTemplateLiteral() {
        String text = emit(new StringInterpolationExpr(List.of(
                InterpolationPart.text("Hello, "),
                InterpolationPart.expression(id("name")),
                InterpolationPart.text("! Cost: $5"))));

        assertThat(text).isEqualTo("`Hello, ${name}! Cost: \\$5`");
    }

    @Test
    void literalsAndCollections() {
        assertThat(emit(LiteralExpr.decimal(1.5))).isEqualTo("1.5");
        assertThat(emit(LiteralExpr.bool(true))).isEqualTo("true");
        assertThat(emit(str("say \"hi\"\n"))).isEqualTo("\"say \\\"hi\\\"\\n\"");
        assertThat(emit(new ListLiteralExpr(List.of(num(1), num(2)), true))).isEqualTo("Object.freeze([1, 2])");
        assertThat(emit(new MapLiteralExpr(List.of(
                new MapEntryExpr(str("key"), num(1)),
                new MapEntryExpr(str("two words"), num(2))), false)))
                .isEqualTo("{ key: 1, \"two words\": 2 }");
    }

    @Test
    void memberCallOnNumberLiteralIsParenthesized() {
        assertThat(emit(call(num(5), "toString"))).isEqualTo("(5).toString()");
    }

    @Test
    void conditionalParenthesizesEachBranch() {
        String text = emit(new ConditionalExpr(id("a"), id("b"), id("c")));

        assertThat(text).isEqualTo("(a) ? (b) : (c)");
        assertThat(GenTestSupport.evaluate("var a = false; var b = 1; var c = 2; " + text)).isEqualTo("2");
    }

    @Test
    void capitalizedUnknownCallIsRoutedAsWidget() {
        String text = emit(call("Text", str("hi")));

        assertThat(text).startsWith("new Text({");
        assertThat(text).contains("data: \"hi\"");
    }
}
