package org.flutterjs.ir.visitor;

import org.flutterjs.ir.expr.IdentifierExpr;
import org.flutterjs.ir.expr.BinaryOperator;
import org.flutterjs.ir.stmt.Statement;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.flutterjs.ir.Ir.binary;
import static org.flutterjs.ir.Ir.block;
import static org.flutterjs.ir.Ir.call;
import static org.flutterjs.ir.Ir.create;
import static org.flutterjs.ir.Ir.forEach;
import static org.flutterjs.ir.Ir.id;
import static org.flutterjs.ir.Ir.ifThen;
import static org.flutterjs.ir.Ir.lambda;
import static org.flutterjs.ir.Ir.local;
import static org.flutterjs.ir.Ir.named;
import static org.flutterjs.ir.Ir.num;
import static org.flutterjs.ir.Ir.ret;
import static org.flutterjs.ir.Ir.stmt;

class TreeVisitorTest {

    private static final class IdentifierCollector extends TreeVisitor<List<String>> {

        @Override
        public Void visit(IdentifierExpr n, List<String> names) {
            names.add(n.name());
            return null;
        }
    }

    @Test
    void walksEveryNestedExpression() {
        Statement body = block(
                local("total", num(0)),
                forEach("item", id("items"), block(
                        ifThen(binary(id("item"), BinaryOperator.GREATER_THAN, id("limit")),
                                block(stmt(call("print", id("item")))), null))),
                stmt(create("Button", named("onPressed", lambda(List.of(), stmt(call("save", id("total"))))))),
                ret(id("total")));
        List<String> names = new ArrayList<>();

        body.accept(new IdentifierCollector(), names);

        assertThat(names).containsExactly("items", "item", "limit", "item", "total", "total");
    }
}
