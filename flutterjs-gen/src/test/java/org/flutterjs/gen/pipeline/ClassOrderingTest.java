package org.flutterjs.gen.pipeline;

import org.flutterjs.gen.diagnostic.DiagnosticCode;
import org.flutterjs.gen.diagnostic.DiagnosticCollector;
import org.flutterjs.ir.decl.ClassDecl;
import org.flutterjs.ir.type.TypeRef;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.flutterjs.ir.Ir.classDecl;

class ClassOrderingTest {

    @Test
    void dependenciesComeFirstAndOtherwiseOrderIsKept() {
        ClassDecl c = classDecl("C").extendsType("B").build();
        ClassDecl unrelated = classDecl("Unrelated").build();
        ClassDecl b = classDecl("B").extendsType("A").build();
        ClassDecl a = classDecl("A").extendsType("ExternalBase").build();
        DiagnosticCollector diagnostics = new DiagnosticCollector();

        List<ClassDecl> ordered = ClassOrdering.order(List.of(c, unrelated, b, a), diagnostics);

        assertThat(ordered).extracting(ClassDecl::name).containsExactly("A", "B", "C", "Unrelated");
        assertThat(diagnostics.isEmpty()).isTrue();
    }

    @Test
    void inheritanceCycleIsReportedAndEveryClassKept() {
        ClassDecl a = classDecl("A").extendsType("B").build();
        ClassDecl b = classDecl("B").extendsType(TypeRef.of("A")).build();
        DiagnosticCollector diagnostics = new DiagnosticCollector();

        List<ClassDecl> ordered = ClassOrdering.order(List.of(a, b), diagnostics);

        assertThat(ordered).extracting(ClassDecl::name).containsExactlyInAnyOrder("A", "B");
        assertThat(diagnostics.withCode(DiagnosticCode.INHERITANCE_CYCLE)).hasSize(1);
    }
}
