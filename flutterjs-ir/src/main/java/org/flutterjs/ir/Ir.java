package org.flutterjs.ir;

import org.flutterjs.ir.decl.ClassDecl;
import org.flutterjs.ir.decl.ConstructorDecl;
import org.flutterjs.ir.decl.FieldDecl;
import org.flutterjs.ir.decl.FunctionDecl;
import org.flutterjs.ir.decl.Parameter;
import org.flutterjs.ir.expr.AssignmentExpr;
import org.flutterjs.ir.expr.AssignmentOperator;
import org.flutterjs.ir.expr.BinaryExpr;
import org.flutterjs.ir.expr.BinaryOperator;
import org.flutterjs.ir.expr.Expression;
import org.flutterjs.ir.expr.IdentifierExpr;
import org.flutterjs.ir.expr.InstanceCreationExpr;
import org.flutterjs.ir.expr.LambdaExpr;
import org.flutterjs.ir.expr.LiteralExpr;
import org.flutterjs.ir.expr.MethodCallExpr;
import org.flutterjs.ir.expr.NamedArgument;
import org.flutterjs.ir.expr.PropertyAccessExpr;
import org.flutterjs.ir.expr.ThisExpr;
import org.flutterjs.ir.stmt.BlockStmt;
import org.flutterjs.ir.stmt.ExpressionStmt;
import org.flutterjs.ir.stmt.ForEachStmt;
import org.flutterjs.ir.stmt.IfStmt;
import org.flutterjs.ir.stmt.ReturnStmt;
import org.flutterjs.ir.stmt.Statement;
import org.flutterjs.ir.stmt.VariableDeclarationStmt;
import org.flutterjs.ir.type.TypeRef;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Static factories for building IR by hand. The front end builds the same records directly;
 * these helpers keep synthesized nodes and fixtures short.
 */
public final class Ir {

    private Ir() {
    }

    // ── Expressions ──────────────────────────────────────────────

    public static IdentifierExpr id(String name) {
        return new IdentifierExpr(name);
    }

    public static LiteralExpr str(String value) {
        return LiteralExpr.string(value);
    }

    public static LiteralExpr num(long value) {
        return LiteralExpr.integer(value);
    }

    public static LiteralExpr nul() {
        return LiteralExpr.nullValue();
    }

    public static ThisExpr self() {
        return new ThisExpr();
    }

    public static PropertyAccessExpr prop(Expression target, String name) {
        return new PropertyAccessExpr(target, name, false);
    }

    public static PropertyAccessExpr thisProp(String name) {
        return prop(self(), name);
    }

    public static BinaryExpr binary(Expression left, BinaryOperator op, Expression right) {
        return new BinaryExpr(left, op, right);
    }

    public static AssignmentExpr assign(Expression target, Expression value) {
        return new AssignmentExpr(target, AssignmentOperator.ASSIGN, value);
    }

    public static MethodCallExpr call(String name, Expression... args) {
        return new MethodCallExpr(null, name, List.of(args), List.of(), false);
    }

    public static MethodCallExpr call(Expression target, String name, Expression... args) {
        return new MethodCallExpr(target, name, List.of(args), List.of(), false);
    }

    public static NamedArgument named(String name, Expression value) {
        return new NamedArgument(name, value);
    }

    public static InstanceCreationExpr create(String type, NamedArgument... namedArgs) {
        return new InstanceCreationExpr(TypeRef.of(type), null, List.of(), List.of(namedArgs), false);
    }

    public static LambdaExpr lambda(List<Parameter> parameters, Statement... body) {
        return new LambdaExpr(parameters, null, block(body), false);
    }

    public static LambdaExpr arrow(List<Parameter> parameters, Expression body) {
        return new LambdaExpr(parameters, body, null, false);
    }

    // ── Statements ───────────────────────────────────────────────

    public static BlockStmt block(Statement... statements) {
        return new BlockStmt(List.of(statements));
    }

    public static ExpressionStmt stmt(Expression expression) {
        return new ExpressionStmt(expression);
    }

    public static ReturnStmt ret(Expression expression) {
        return new ReturnStmt(expression);
    }

    public static VariableDeclarationStmt local(String name, Expression initializer) {
        return new VariableDeclarationStmt(name, null, initializer, false, false, false);
    }

    public static VariableDeclarationStmt finalVar(String name, Expression initializer) {
        return new VariableDeclarationStmt(name, null, initializer, true, false, false);
    }

    public static IfStmt ifThen(Expression condition, Statement then, Statement otherwise) {
        return new IfStmt(condition, then, otherwise);
    }

    public static ForEachStmt forEach(String variable, Expression iterable, Statement body) {
        return new ForEachStmt(variable, null, true, iterable, body, false);
    }

    // ── Declarations ─────────────────────────────────────────────

    public static FieldDecl field(String name, TypeRef type, Expression initializer) {
        return new FieldDecl(name, type, initializer, false, false, false, false);
    }

    public static FunctionDecl method(String name, List<Parameter> parameters, Statement... body) {
        return new FunctionDecl(name, parameters, TypeRef.DYNAMIC, block(body), false, false, false, false);
    }

    public static FunctionDecl asyncMethod(String name, List<Parameter> parameters, Statement... body) {
        return new FunctionDecl(name, parameters, TypeRef.DYNAMIC, block(body), true, false, false, false);
    }

    public static FunctionDecl getter(String name, Statement... body) {
        return new FunctionDecl(name, List.of(), TypeRef.DYNAMIC, block(body), false, true, false, false);
    }

    public static FunctionDecl setter(String name, String parameter, Statement... body) {
        return new FunctionDecl(name, List.of(Parameter.positional(parameter, TypeRef.DYNAMIC)), TypeRef.VOID,
                block(body), false, false, true, false);
    }

    public static ClassBuilder classDecl(String name) {
        return new ClassBuilder(name);
    }

    public static final class ClassBuilder {

        private final String name;
        private TypeRef superclass;
        private final List<TypeRef> interfaces = new ArrayList<>();
        private final List<FieldDecl> fields = new ArrayList<>();
        private final List<ConstructorDecl> constructors = new ArrayList<>();
        private final List<FunctionDecl> methods = new ArrayList<>();
        private final Set<String> flags = new LinkedHashSet<>();
        private boolean isAbstract;

        private ClassBuilder(String name) {
            this.name = name;
        }

        public ClassBuilder extendsType(TypeRef type) {
            this.superclass = type;
            return this;
        }

        public ClassBuilder extendsType(String type) {
            return extendsType(TypeRef.of(type));
        }

        public ClassBuilder implementsType(String type) {
            interfaces.add(TypeRef.of(type));
            return this;
        }

        public ClassBuilder field(FieldDecl field) {
            fields.add(field);
            return this;
        }

        public ClassBuilder constructor(ConstructorDecl constructor) {
            constructors.add(constructor);
            return this;
        }

        public ClassBuilder method(FunctionDecl method) {
            methods.add(method);
            return this;
        }

        public ClassBuilder flag(String flag) {
            flags.add(flag);
            return this;
        }

        public ClassBuilder makeAbstract() {
            this.isAbstract = true;
            return this;
        }

        public ClassDecl build() {
            return new ClassDecl(name, superclass, interfaces, List.of(), fields, constructors, methods, isAbstract, flags);
        }
    }
}
