package org.flutterjs.ir.visitor;

import org.flutterjs.ir.decl.Parameter;
import org.flutterjs.ir.expr.AsExpr;
import org.flutterjs.ir.expr.AssignmentExpr;
import org.flutterjs.ir.expr.AwaitExpr;
import org.flutterjs.ir.expr.BinaryExpr;
import org.flutterjs.ir.expr.CascadeExpr;
import org.flutterjs.ir.expr.CascadeReceiverExpr;
import org.flutterjs.ir.expr.ConditionalExpr;
import org.flutterjs.ir.expr.Expression;
import org.flutterjs.ir.expr.IdentifierExpr;
import org.flutterjs.ir.expr.IndexAccessExpr;
import org.flutterjs.ir.expr.InstanceCreationExpr;
import org.flutterjs.ir.expr.InterpolationPart;
import org.flutterjs.ir.expr.IsExpr;
import org.flutterjs.ir.expr.LambdaExpr;
import org.flutterjs.ir.expr.ListLiteralExpr;
import org.flutterjs.ir.expr.LiteralExpr;
import org.flutterjs.ir.expr.MapEntryExpr;
import org.flutterjs.ir.expr.MapLiteralExpr;
import org.flutterjs.ir.expr.MethodCallExpr;
import org.flutterjs.ir.expr.NamedArgument;
import org.flutterjs.ir.expr.ParenthesizedExpr;
import org.flutterjs.ir.expr.PropertyAccessExpr;
import org.flutterjs.ir.expr.SetLiteralExpr;
import org.flutterjs.ir.expr.StringInterpolationExpr;
import org.flutterjs.ir.expr.SuperExpr;
import org.flutterjs.ir.expr.ThisExpr;
import org.flutterjs.ir.expr.ThrowExpr;
import org.flutterjs.ir.expr.UnaryExpr;
import org.flutterjs.ir.expr.UnknownExpr;
import org.flutterjs.ir.stmt.BlockStmt;
import org.flutterjs.ir.stmt.BreakStmt;
import org.flutterjs.ir.stmt.CatchClause;
import org.flutterjs.ir.stmt.ContinueStmt;
import org.flutterjs.ir.stmt.DoWhileStmt;
import org.flutterjs.ir.stmt.ExpressionStmt;
import org.flutterjs.ir.stmt.ForEachStmt;
import org.flutterjs.ir.stmt.ForStmt;
import org.flutterjs.ir.stmt.IfStmt;
import org.flutterjs.ir.stmt.ReturnStmt;
import org.flutterjs.ir.stmt.Statement;
import org.flutterjs.ir.stmt.SwitchCase;
import org.flutterjs.ir.stmt.SwitchStmt;
import org.flutterjs.ir.stmt.ThrowStmt;
import org.flutterjs.ir.stmt.TryStmt;
import org.flutterjs.ir.stmt.UnknownStmt;
import org.flutterjs.ir.stmt.VariableDeclarationStmt;
import org.flutterjs.ir.stmt.WhileStmt;

import java.util.List;

/**
 * Walks every node of an expression or statement tree depth-first. Subclasses override the
 * variants they inspect and call {@code super.visit(n, arg)} to keep descending.
 */
public abstract class TreeVisitor<A> implements ExpressionVisitor<Void, A>, StatementVisitor<Void, A> {

    protected void walk(Expression expression, A arg) {
        if (expression != null) {
            expression.accept(this, arg);
        }
    }

    protected void walk(Statement statement, A arg) {
        if (statement != null) {
            statement.accept(this, arg);
        }
    }

    protected void walkAll(List<? extends Expression> expressions, A arg) {
        for (Expression e : expressions) {
            walk(e, arg);
        }
    }

    protected void walkStatements(List<? extends Statement> statements, A arg) {
        for (Statement s : statements) {
            walk(s, arg);
        }
    }

    protected void walkParameters(List<Parameter> parameters, A arg) {
        for (Parameter p : parameters) {
            walk(p.defaultValue(), arg);
        }
    }

    private void walkNamed(List<NamedArgument> namedArguments, A arg) {
        for (NamedArgument named : namedArguments) {
            walk(named.value(), arg);
        }
    }

    // ── Expressions ──────────────────────────────────────────────

    @Override
    public Void visit(LiteralExpr n, A arg) {
        return null;
    }

    @Override
    public Void visit(IdentifierExpr n, A arg) {
        return null;
    }

    @Override
    public Void visit(ThisExpr n, A arg) {
        return null;
    }

    @Override
    public Void visit(SuperExpr n, A arg) {
        return null;
    }

    @Override
    public Void visit(BinaryExpr n, A arg) {
        walk(n.left(), arg);
        walk(n.right(), arg);
        return null;
    }

    @Override
    public Void visit(UnaryExpr n, A arg) {
        walk(n.operand(), arg);
        return null;
    }

    @Override
    public Void visit(AssignmentExpr n, A arg) {
        walk(n.target(), arg);
        walk(n.value(), arg);
        return null;
    }

    @Override
    public Void visit(MethodCallExpr n, A arg) {
        walk(n.target(), arg);
        walkAll(n.arguments(), arg);
        walkNamed(n.namedArguments(), arg);
        return null;
    }

    @Override
    public Void visit(InstanceCreationExpr n, A arg) {
        walkAll(n.arguments(), arg);
        walkNamed(n.namedArguments(), arg);
        return null;
    }

    @Override
    public Void visit(PropertyAccessExpr n, A arg) {
        walk(n.target(), arg);
        return null;
    }

    @Override
    public Void visit(IndexAccessExpr n, A arg) {
        walk(n.target(), arg);
        walk(n.index(), arg);
        return null;
    }

    @Override
    public Void visit(ConditionalExpr n, A arg) {
        walk(n.condition(), arg);
        walk(n.thenExpression(), arg);
        walk(n.elseExpression(), arg);
        return null;
    }

    @Override
    public Void visit(ListLiteralExpr n, A arg) {
        walkAll(n.elements(), arg);
        return null;
    }

    @Override
    public Void visit(MapLiteralExpr n, A arg) {
        for (MapEntryExpr entry : n.entries()) {
            walk(entry.key(), arg);
            walk(entry.value(), arg);
        }
        return null;
    }

    @Override
    public Void visit(SetLiteralExpr n, A arg) {
        walkAll(n.elements(), arg);
        return null;
    }

    @Override
    public Void visit(LambdaExpr n, A arg) {
        walkParameters(n.parameters(), arg);
        walk(n.expressionBody(), arg);
        walk(n.blockBody(), arg);
        return null;
    }

    @Override
    public Void visit(CascadeExpr n, A arg) {
        walk(n.target(), arg);
        walkAll(n.sections(), arg);
        return null;
    }

    @Override
    public Void visit(CascadeReceiverExpr n, A arg) {
        return null;
    }

    @Override
    public Void visit(AwaitExpr n, A arg) {
        walk(n.expression(), arg);
        return null;
    }

    @Override
    public Void visit(StringInterpolationExpr n, A arg) {
        for (InterpolationPart part : n.parts()) {
            walk(part.expression(), arg);
        }
        return null;
    }

    @Override
    public Void visit(IsExpr n, A arg) {
        walk(n.expression(), arg);
        return null;
    }

    @Override
    public Void visit(AsExpr n, A arg) {
        walk(n.expression(), arg);
        return null;
    }

    @Override
    public Void visit(ThrowExpr n, A arg) {
        walk(n.exception(), arg);
        return null;
    }

    @Override
    public Void visit(ParenthesizedExpr n, A arg) {
        walk(n.expression(), arg);
        return null;
    }

    @Override
    public Void visit(UnknownExpr n, A arg) {
        return null;
    }

    // ── Statements ───────────────────────────────────────────────

    @Override
    public Void visit(ExpressionStmt n, A arg) {
        walk(n.expression(), arg);
        return null;
    }

    @Override
    public Void visit(VariableDeclarationStmt n, A arg) {
        walk(n.initializer(), arg);
        return null;
    }

    @Override
    public Void visit(BlockStmt n, A arg) {
        walkStatements(n.statements(), arg);
        return null;
    }

    @Override
    public Void visit(IfStmt n, A arg) {
        walk(n.condition(), arg);
        walk(n.thenStatement(), arg);
        walk(n.elseStatement(), arg);
        return null;
    }

    @Override
    public Void visit(ForStmt n, A arg) {
        walkStatements(n.initializers(), arg);
        walk(n.condition(), arg);
        walkAll(n.updaters(), arg);
        walk(n.body(), arg);
        return null;
    }

    @Override
    public Void visit(ForEachStmt n, A arg) {
        walk(n.iterable(), arg);
        walk(n.body(), arg);
        return null;
    }

    @Override
    public Void visit(WhileStmt n, A arg) {
        walk(n.condition(), arg);
        walk(n.body(), arg);
        return null;
    }

    @Override
    public Void visit(DoWhileStmt n, A arg) {
        walk(n.body(), arg);
        walk(n.condition(), arg);
        return null;
    }

    @Override
    public Void visit(SwitchStmt n, A arg) {
        walk(n.selector(), arg);
        for (SwitchCase c : n.cases()) {
            walkAll(c.patterns(), arg);
            walkStatements(c.body(), arg);
        }
        if (n.hasDefault()) {
            walkStatements(n.defaultBody(), arg);
        }
        return null;
    }

    @Override
    public Void visit(TryStmt n, A arg) {
        walk(n.body(), arg);
        for (CatchClause clause : n.catchClauses()) {
            walk(clause.body(), arg);
        }
        walk(n.finallyBlock(), arg);
        return null;
    }

    @Override
    public Void visit(ReturnStmt n, A arg) {
        walk(n.expression(), arg);
        return null;
    }

    @Override
    public Void visit(BreakStmt n, A arg) {
        return null;
    }

    @Override
    public Void visit(ContinueStmt n, A arg) {
        return null;
    }

    @Override
    public Void visit(ThrowStmt n, A arg) {
        walk(n.exception(), arg);
        return null;
    }

    @Override
    public Void visit(UnknownStmt n, A arg) {
        return null;
    }
}
