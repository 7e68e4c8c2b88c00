package org.flutterjs.gen.pipeline;

import org.flutterjs.gen.diagnostic.Diagnostic;
import org.flutterjs.gen.diagnostic.DiagnosticCode;
import org.flutterjs.gen.diagnostic.DiagnosticCollector;
import org.flutterjs.gen.diagnostic.Severity;
import org.flutterjs.ir.decl.ClassDecl;
import org.flutterjs.ir.type.TypeRef;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Orders the classes of one unit so that a superclass, interface or mixin declared in the same
 * unit precedes the classes depending on it. Otherwise declaration order is kept.
 */
final class ClassOrdering {

    private final Map<String, ClassDecl> byName = new LinkedHashMap<>();
    private final Set<String> visited = new HashSet<>();
    private final Set<String> inProgress = new HashSet<>();
    private final List<ClassDecl> ordered = new ArrayList<>();
    private final DiagnosticCollector diagnostics;

    private ClassOrdering(List<ClassDecl> classes, DiagnosticCollector diagnostics) {
        for (ClassDecl c : classes) {
            byName.putIfAbsent(c.name(), c);
        }
        this.diagnostics = diagnostics;
    }

    static List<ClassDecl> order(List<ClassDecl> classes, DiagnosticCollector diagnostics) {
        ClassOrdering ordering = new ClassOrdering(classes, diagnostics);
        for (ClassDecl c : ordering.byName.values()) {
            ordering.visit(c);
        }
        return ordering.ordered;
    }

    private void visit(ClassDecl cls) {
        if (visited.contains(cls.name())) {
            return;
        }
        if (!inProgress.add(cls.name())) {
            diagnostics.add(Diagnostic.of(Severity.WARNING, DiagnosticCode.INHERITANCE_CYCLE,
                            "Class '" + cls.name() + "' is part of an inheritance cycle")
                    .withNode(cls.name()));
            return;
        }
        for (String dependency : dependencies(cls)) {
            ClassDecl declared = byName.get(dependency);
            if (declared != null && !declared.name().equals(cls.name())) {
                visit(declared);
            }
        }
        inProgress.remove(cls.name());
        visited.add(cls.name());
        ordered.add(cls);
    }

    private static List<String> dependencies(ClassDecl cls) {
        List<String> names = new ArrayList<>();
        if (cls.superclass() != null) {
            names.add(cls.superclass().name());
        }
        for (TypeRef t : cls.interfaces()) {
            names.add(t.name());
        }
        for (TypeRef t : cls.mixins()) {
            names.add(t.name());
        }
        return names;
    }
}
