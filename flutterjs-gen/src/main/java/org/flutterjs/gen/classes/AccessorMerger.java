package org.flutterjs.gen.classes;

import org.flutterjs.gen.IncompatibleAccessorException;
import org.flutterjs.gen.diagnostic.Diagnostic;
import org.flutterjs.gen.diagnostic.DiagnosticCode;
import org.flutterjs.gen.diagnostic.DiagnosticCollector;
import org.flutterjs.gen.diagnostic.Severity;
import org.flutterjs.ir.decl.FunctionDecl;
import org.flutterjs.ir.decl.Parameter;
import org.flutterjs.ir.decl.ParameterKind;
import org.flutterjs.ir.expr.BinaryExpr;
import org.flutterjs.ir.expr.BinaryOperator;
import org.flutterjs.ir.expr.IdentifierExpr;
import org.flutterjs.ir.stmt.BlockStmt;
import org.flutterjs.ir.stmt.IfStmt;
import org.flutterjs.ir.stmt.ReturnStmt;
import org.flutterjs.ir.stmt.Statement;
import org.flutterjs.ir.type.TypeRef;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges getter/setter pairs into one function taking an optional value:
 * <pre>
 * x(v) {
 *   if (v !== undefined) {
 *     // setter body
 *     return v;
 *   }
 *   // getter body
 * }
 * </pre>
 * The merge builds an IR {@link FunctionDecl}, so the statement emitter stays the only producer of text.
 */
public final class AccessorMerger {

    static final String DEFAULT_VALUE_PARAMETER = "value";

    private AccessorMerger() {
    }

    /**
     * @throws IncompatibleAccessorException when exactly one of the pair is static
     */
    public static FunctionDecl mergePair(String ownerName, FunctionDecl getter, FunctionDecl setter) {
        if (!getter.isGetter() || !setter.isSetter()) {
            throw new IllegalArgumentException("Expected a getter and a setter for '" + getter.name() + "'");
        }
        if (getter.isStatic() != setter.isStatic()) {
            throw new IncompatibleAccessorException(ownerName, getter.name(), "one accessor is static and the other is not");
        }
        if (getter.isAsync() || setter.isAsync()) {
            throw new IncompatibleAccessorException(ownerName, getter.name(), "accessors cannot be async");
        }
        String valueName = setter.parameters().isEmpty() ? DEFAULT_VALUE_PARAMETER : setter.parameters().get(0).name();
        TypeRef valueType = setter.parameters().isEmpty() ? TypeRef.DYNAMIC : setter.parameters().get(0).type();
        Parameter value = new Parameter(valueName, valueType, null, ParameterKind.OPTIONAL_POSITIONAL, false, false, false);

        List<Statement> setterBranch = new ArrayList<>(statementsOf(setter));
        setterBranch.add(new ReturnStmt(new IdentifierExpr(valueName)));
        List<Statement> body = new ArrayList<>();
        body.add(new IfStmt(
                new BinaryExpr(new IdentifierExpr(valueName), BinaryOperator.NOT_EQUALS, new IdentifierExpr("undefined")),
                new BlockStmt(setterBranch),
                null));
        body.addAll(statementsOf(getter));

        return new FunctionDecl(getter.name(), List.of(value), getter.returnType(), new BlockStmt(body),
                false, false, false, getter.isStatic());
    }

    private static List<Statement> statementsOf(FunctionDecl accessor) {
        return accessor.hasBody() ? accessor.body().statements() : List.of();
    }

    /**
     * Replaces every getter/setter pair in {@code functions} with its merged function, placed where
     * the first of the two was declared. A pair that cannot be merged stays as two accessors and
     * is reported.
     */
    public static List<FunctionDecl> merge(String ownerName, List<FunctionDecl> functions, DiagnosticCollector diagnostics) {
        Map<String, FunctionDecl> getters = new LinkedHashMap<>();
        Map<String, FunctionDecl> setters = new LinkedHashMap<>();
        for (FunctionDecl f : functions) {
            if (f.isGetter()) {
                getters.put(f.name(), f);
            } else if (f.isSetter()) {
                setters.put(f.name(), f);
            }
        }
        Map<String, FunctionDecl> merged = new LinkedHashMap<>();
        for (Map.Entry<String, FunctionDecl> getter : getters.entrySet()) {
            FunctionDecl setter = setters.get(getter.getKey());
            if (setter == null) {
                continue;
            }
            try {
                merged.put(getter.getKey(), mergePair(ownerName, getter.getValue(), setter));
            } catch (IncompatibleAccessorException e) {
                diagnostics.add(Diagnostic.of(Severity.ERROR, DiagnosticCode.ACCESSOR_MERGE_FAILED, e.getMessage())
                        .withNode(e.getNodeDescription())
                        .withSuggestion("Declare both accessors static, or neither"));
            }
        }
        List<FunctionDecl> result = new ArrayList<>();
        for (FunctionDecl f : functions) {
            FunctionDecl replacement = f.isAccessor() ? merged.get(f.name()) : null;
            if (replacement == null) {
                result.add(f);
            } else if (!result.contains(replacement)) {
                result.add(replacement);
            }
        }
        return result;
    }

    public static List<String> mergedNames(List<FunctionDecl> original, List<FunctionDecl> merged) {
        List<String> names = new ArrayList<>();
        for (FunctionDecl f : merged) {
            if (!f.isAccessor() && original.stream().anyMatch(o -> o.isAccessor() && o.name().equals(f.name()))) {
                names.add(f.name());
            }
        }
        return names;
    }
}
