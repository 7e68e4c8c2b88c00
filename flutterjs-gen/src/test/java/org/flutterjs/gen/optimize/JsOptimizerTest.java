package org.flutterjs.gen.optimize;

import org.flutterjs.gen.GenTestSupport;
import org.flutterjs.gen.diagnostic.DiagnosticCode;
import org.flutterjs.gen.diagnostic.DiagnosticCollector;
import org.flutterjs.gen.diagnostic.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsOptimizerTest {

    private static final String FUNCTION = """
            // helper
            function f() {
              /* note */
              return 1;
              dead();
            }
            """;

    private DiagnosticCollector diagnostics;
    private JsOptimizer optimizer;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticCollector();
        optimizer = new JsOptimizer(diagnostics);
    }

    @Test
    void levelOneNormalisesWhitespace() {
        OptimizationResult once = optimizer.optimize("a();   \n\n\n\nb();\n\n", 1, false);

        assertThat(once.text()).isEqualTo("a();\n\nb();\n");
        assertThat(once.changes()).hasSize(2);
        assertThat(optimizer.optimize(once.text(), 1, false).text()).isEqualTo(once.text());
    }

    @Test
    void dryRunReportsWithoutChanging() {
        String source = "a();   \n\n\n\nb();\n";

        OptimizationResult result = optimizer.optimize(source, 1, true);

        assertThat(result.text()).isSameAs(source);
        assertThat(result.dryRun()).isTrue();
        assertThat(result.optimizedSize()).isLessThan(result.originalSize());
        assertThat(result.changes()).isNotEmpty();
    }

    @Test
    void levelTwoDropsCommentsAndUnreachableCode() {
        OptimizationResult result = optimizer.optimize(FUNCTION, 2, false);

        assertThat(result.text()).isEqualTo("""
                // Optimized (level 2): reduced 32.3% (62 -> 42 bytes)
                function f() {
                  /* note */
                  return 1;
                }
                """);
        assertThat(result.originalSize()).isEqualTo(62);
        assertThat(result.optimizedSize()).isEqualTo(42);
        assertThat(result.reductionPercent()).isPositive();
    }

    @Test
    void multiLineBlockCommentIsKeptWholeWhenAnyLineSaysKeep() {
        String source = """
                /*
                 * GENERATED CODE HAS STRUCTURAL ERRORS
                 */
                /*
                 * KEEP sourceMappingURL=x.map
                 */
                function f() {
                  /* plain
                     note */
                  return 1; /* trailing */
                }
                """;

        OptimizationResult result = optimizer.optimize(source, 3, false);

        assertThat(result.text()).isEqualTo("""
                /*
                 * KEEP sourceMappingURL=x.map
                 */
                function f() {
                return 1; /* trailing */
                }
                """);
        assertThat(result.changes()).contains("Removed 5 block comment line(s)");
    }

    @Test
    void failingPassFallsBackToTheInput() {
        JsOptimizer failing = new JsOptimizer(diagnostics, (text, changes) -> {
            throw new IllegalStateException("unterminated template literal");
        });

        OptimizationResult result = failing.optimize(FUNCTION, 3, false);

        assertThat(result.text()).isSameAs(FUNCTION);
        assertThat(result.reductionPercent()).isZero();
        assertThat(result.changes()).isEmpty();
        assertThat(diagnostics.withCode(DiagnosticCode.OPTIMIZATION_FAILED)).singleElement().satisfies(d -> {
            assertThat(d.severity()).isEqualTo(Severity.WARNING);
            assertThat(d.message()).isEqualTo("Optimization failed: unterminated template literal");
        });
    }

    @Test
    void levelThreeMinifiesAndStillRuns() {
        String text = optimizer.optimize(FUNCTION, 3, false).text();

        assertThat(text).isEqualTo("function f() {\nreturn 1;\n}\n");
        assertThat(GenTestSupport.evaluate(text + "f();")).isEqualTo("1");
    }

    @Test
    void keepCommentsSurviveEveryLevel() {
        String source = "// KEEP license\n/* KEEP banner */\nfoo();\n";

        for (int level = JsOptimizer.MIN_LEVEL; level <= JsOptimizer.MAX_LEVEL; level++) {
            assertThat(optimizer.optimize(source, level, false).text())
                    .contains("// KEEP license", "/* KEEP banner */");
        }
    }

    @Test
    void levelOutOfRangeIsRejected() {
        assertThatThrownBy(() -> optimizer.optimize("x;\n", 4, false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("between 1 and 3");
        assertThat(diagnostics.isEmpty()).isTrue();
    }
}
