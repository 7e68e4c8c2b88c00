package org.flutterjs.gen.pipeline;

import org.flutterjs.gen.config.GenerationOptions;
import org.flutterjs.ir.ProgramUnit;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.flutterjs.ir.Ir.call;
import static org.flutterjs.ir.Ir.method;
import static org.flutterjs.ir.Ir.stmt;
import static org.flutterjs.ir.Ir.str;

class BatchGeneratorTest {

    private static ProgramUnit unit(int i) {
        return ProgramUnit.builder("lib/unit_" + i + ".dart")
                .packageName("app")
                .addFunction(method("run" + i, List.of(), stmt(call("print", str("unit " + i)))))
                .build();
    }

    @Test
    void resultsFollowTheInputOrder() {
        List<ProgramUnit> units = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            units.add(unit(i));
        }
        units.add(ProgramUnit.builder("lib/empty.dart").build());

        List<GenerationResult> results = new BatchGenerator(4).generateAll(units, GenerationOptions.defaults());

        assertThat(results).hasSize(13);
        for (int i = 0; i < 12; i++) {
            GenerationResult result = results.get(i);
            assertThat(result.filePath()).isEqualTo("lib/unit_" + i + ".dart");
            assertThat(result.success()).isTrue();
            assertThat(result.code()).contains("function run" + i + "()", "print(\"unit " + i + "\");");
        }
        assertThat(results.get(12).success()).isFalse();
    }

    @Test
    void concurrentRunsMatchSequentialOutput() {
        List<ProgramUnit> units = List.of(unit(1), unit(2), unit(3));
        FileAssembler sequential = new FileAssembler(GenerationOptions.defaults());

        List<GenerationResult> results = new BatchGenerator(3).generateAll(units, GenerationOptions.defaults());

        for (int i = 0; i < units.size(); i++) {
            assertThat(results.get(i).code()).isEqualTo(sequential.generate(units.get(i)).code());
        }
    }

    @Test
    void emptyBatchGivesNoResults() {
        assertThat(new BatchGenerator(2).generateAll(List.of(), GenerationOptions.defaults())).isEmpty();
    }

    @Test
    void parallelismMustBePositive() {
        assertThatThrownBy(() -> new BatchGenerator(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least 1");
    }
}
