package org.flutterjs.benchmark.fixture;

import org.flutterjs.ir.ProgramUnit;
import org.flutterjs.ir.decl.ClassDecl;
import org.flutterjs.ir.decl.EnumDecl;
import org.flutterjs.ir.decl.FieldRole;
import org.flutterjs.ir.decl.ImportDirective;
import org.flutterjs.ir.decl.Parameter;
import org.flutterjs.ir.decl.StateAnalysis;
import org.flutterjs.ir.decl.StateFieldInfo;
import org.flutterjs.ir.expr.BinaryOperator;
import org.flutterjs.ir.expr.ListLiteralExpr;
import org.flutterjs.ir.expr.UnaryExpr;
import org.flutterjs.ir.expr.UnaryOperator;
import org.flutterjs.ir.type.TypeRef;

import java.util.ArrayList;
import java.util.List;

import static org.flutterjs.ir.Ir.binary;
import static org.flutterjs.ir.Ir.block;
import static org.flutterjs.ir.Ir.call;
import static org.flutterjs.ir.Ir.classDecl;
import static org.flutterjs.ir.Ir.create;
import static org.flutterjs.ir.Ir.field;
import static org.flutterjs.ir.Ir.forEach;
import static org.flutterjs.ir.Ir.id;
import static org.flutterjs.ir.Ir.ifThen;
import static org.flutterjs.ir.Ir.lambda;
import static org.flutterjs.ir.Ir.local;
import static org.flutterjs.ir.Ir.method;
import static org.flutterjs.ir.Ir.named;
import static org.flutterjs.ir.Ir.num;
import static org.flutterjs.ir.Ir.prop;
import static org.flutterjs.ir.Ir.ret;
import static org.flutterjs.ir.Ir.stmt;
import static org.flutterjs.ir.Ir.str;

/**
 * Program units shaped like a small counter app, used as benchmark input.
 */
public final class SampleUnits {

    private static final List<Parameter> BUILD = List.of(Parameter.positional("context", TypeRef.of("BuildContext")));

    private SampleUnits() {
    }

    /**
     * A stateless widget with one text child.
     */
    public static ProgramUnit greeting() {
        ClassDecl greeting = classDecl("Greeting")
                .extendsType("StatelessWidget")
                .field(field("name", TypeRef.of("String"), str("world")))
                .method(method("build", BUILD,
                        ret(create("Center", named("child", call("Text", id("name")))))))
                .build();
        return ProgramUnit.builder("lib/greeting.dart")
                .packageName("sample")
                .addImport(ImportDirective.of("package:flutter/material.dart"))
                .addClass(greeting)
                .build();
    }

    /**
     * A stateful counter, a model class with a loop, an enum and a {@code main} entry point.
     */
    public static ProgramUnit counterApp(int index) {
        String widget = "Counter" + index;
        String state = "_" + widget + "State";
        ClassDecl counter = classDecl(widget).extendsType("StatefulWidget").build();
        ClassDecl counterState = classDecl(state)
                .extendsType(TypeRef.of("State", TypeRef.of(widget)))
                .field(field("count", TypeRef.of("int"), num(0)))
                .method(method("increment", List.of(),
                        stmt(call("setState", lambda(List.of(),
                                stmt(new UnaryExpr(UnaryOperator.POST_INCREMENT, id("count"))))))))
                .method(method("build", BUILD,
                        ret(create("Column", named("children", new ListLiteralExpr(List.of(
                                call("Text", str("Count")),
                                call("Text", call(id("count"), "toString")),
                                create("ElevatedButton",
                                        named("onPressed", id("increment")),
                                        named("child", call("Text", str("Add"))))), false))))))
                .build();
        ClassDecl history = classDecl("History" + index)
                .field(field("entries", TypeRef.of("List", TypeRef.of("int")), new ListLiteralExpr(List.of(), false)))
                .method(method("total", List.of(),
                        local("sum", num(0)),
                        forEach("entry", id("entries"), block(
                                ifThen(binary(id("entry"), BinaryOperator.GREATER_THAN, num(0)),
                                        block(stmt(call("print", id("entry")))), null))),
                        ret(id("sum"))))
                .method(method("latest", List.of(), ret(prop(id("entries"), "last"))))
                .build();
        return ProgramUnit.builder("lib/counter_" + index + ".dart")
                .packageName("sample")
                .addImport(ImportDirective.of("package:flutter/material.dart"))
                .addClass(counter)
                .addClass(counterState)
                .addClass(history)
                .addEnum(new EnumDecl("Mode" + index, List.of("idle", "counting", "done")))
                .addFunction(method("main", List.of(), stmt(call("runApp", create(widget)))))
                .addStateAnalysis(new StateAnalysis(state, List.of(new StateFieldInfo("count", FieldRole.REACTIVE, null))))
                .build();
    }

    public static List<ProgramUnit> counterApps(int count) {
        List<ProgramUnit> units = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            units.add(counterApp(i));
        }
        return units;
    }
}
