package org.flutterjs.gen.validate;

import org.flutterjs.gen.diagnostic.Severity;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OutputValidatorTest {

    private final OutputValidator validator = new OutputValidator(0);

    @Test
    void balancedCodeIsClean() {
        ValidationReport report = validator.validate("function f() {\n  return [1, (2)];\n}\n");

        assertThat(report.isClean()).isTrue();
    }

    @Test
    void delimitersInsideStringsAndCommentsAreIgnored() {
        String source = """
                const s = "{";
                // }
                const t = '(';
                /* ] */
                """;

        assertThat(validator.validate(source).isClean()).isTrue();
    }

    @Test
    void templateExpressionsAreScannedAsCode() {
        assertThat(validator.validate("const s = `a ${ {x: 1}.x } b`;\n").isClean()).isTrue();
        assertThat(validator.validate("const s = `a { b`;\n").isClean()).isTrue();
    }

    @Test
    void unclosedBraceIsCritical() {
        ValidationReport report = validator.validate("function f() {\n  return 1;\n");

        assertThat(report.criticalIssues()).singleElement().satisfies(issue -> {
            assertThat(issue.message()).isEqualTo("Unclosed '{'");
            assertThat(issue.line()).isEqualTo(1);
            assertThat(issue.severity()).isEqualTo(Severity.ERROR);
        });
    }

    @Test
    void mismatchedAndStrayClosersAreCritical() {
        ValidationReport mismatched = validator.validate("call(a];\n");
        assertThat(mismatched.hasCriticalIssues()).isTrue();
        assertThat(mismatched.issues().get(0).message()).startsWith("Mismatched ']'");

        ValidationReport stray = validator.validate("x;\n}\n");
        assertThat(stray.criticalIssues()).singleElement().satisfies(issue -> {
            assertThat(issue.message()).isEqualTo("Unexpected '}' with nothing open");
            assertThat(issue.line()).isEqualTo(2);
        });
    }

    @Test
    void unterminatedStringIsCritical() {
        ValidationReport report = validator.validate("const s = \"abc;\nnext();\n");

        assertThat(report.criticalIssues()).extracting(ValidationIssue::message)
                .containsExactly("Unterminated string literal");
    }

    @Test
    void leftoverMarkersOnlyWarn() {
        ValidationReport report = validator.validate("f();\n// TODO remove\n");

        assertThat(report.hasCriticalIssues()).isFalse();
        assertThat(report.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.severity()).isEqualTo(Severity.WARNING);
            assertThat(issue.line()).isEqualTo(2);
        });
    }

    @Test
    void shortOutputWarns() {
        ValidationReport report = new OutputValidator(100).validate("x;\n");

        assertThat(report.hasCriticalIssues()).isFalse();
        assertThat(report.issues()).singleElement()
                .satisfies(issue -> assertThat(issue.message()).contains("only 2 characters"));
    }
}
