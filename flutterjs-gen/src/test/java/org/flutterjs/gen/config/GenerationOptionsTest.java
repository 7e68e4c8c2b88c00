package org.flutterjs.gen.config;

import org.flutterjs.gen.GenerationOptionsException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GenerationOptionsTest {

    @Test
    void defaultsMatchTheDocumentedValues() {
        GenerationOptions options = GenerationOptions.defaults();

        assertThat(options.validate()).isTrue();
        assertThat(options.optimize()).isFalse();
        assertThat(options.optimizationLevel()).isEqualTo(1);
        assertThat(options.prettyPrint()).isTrue();
        assertThat(options.strictMode()).isFalse();
        assertThat(options.strictPropertyValidation()).isTrue();
        assertThat(options.emitSuperCalls()).isTrue();
        assertThat(options.invokeMain()).isTrue();
        assertThat(options.errorBanner()).isTrue();
        assertThat(options.target()).isEqualTo(Target.WEB);
    }

    @Test
    void systemPropertiesOverrideDefaults() {
        System.setProperty(GenerationOptions.PROPERTY_PREFIX + "optimizationLevel", "3");
        System.setProperty(GenerationOptions.PROPERTY_PREFIX + "strict", "true");
        try {
            GenerationOptions options = GenerationOptions.defaults();
            assertThat(options.optimizationLevel()).isEqualTo(3);
            assertThat(options.strictMode()).isTrue();
        } finally {
            System.clearProperty(GenerationOptions.PROPERTY_PREFIX + "optimizationLevel");
            System.clearProperty(GenerationOptions.PROPERTY_PREFIX + "strict");
        }
    }

    @Test
    void malformedIntegerPropertyIsRejected() {
        System.setProperty(GenerationOptions.PROPERTY_PREFIX + "optimizationLevel", "high");
        try {
            assertThatThrownBy(GenerationOptions::defaults)
                    .isInstanceOf(GenerationOptionsException.class)
                    .satisfies(e -> assertThat(((GenerationOptionsException) e).getOption()).isEqualTo("optimizationLevel"));
        } finally {
            System.clearProperty(GenerationOptions.PROPERTY_PREFIX + "optimizationLevel");
        }
    }

    @Test
    void targetPropertyIsCaseInsensitiveAndValidated() {
        System.setProperty(GenerationOptions.PROPERTY_PREFIX + "target", "node");
        try {
            assertThat(GenerationOptions.defaults().target()).isEqualTo(Target.NODE);

            System.setProperty(GenerationOptions.PROPERTY_PREFIX + "target", "browser");
            assertThatThrownBy(GenerationOptions::defaults)
                    .isInstanceOf(GenerationOptionsException.class)
                    .hasMessage("Invalid generation option 'target': 'browser' is not one of [WEB, NODE]")
                    .satisfies(e -> assertThat(((GenerationOptionsException) e).getOption()).isEqualTo("target"));
        } finally {
            System.clearProperty(GenerationOptions.PROPERTY_PREFIX + "target");
        }
    }

    @Test
    void outOfRangeLevelIsStoredAsGiven() {
        assertThat(GenerationOptions.builder().optimizationLevel(9).build().optimizationLevel()).isEqualTo(9);
    }

    @Test
    void invalidBuilderInputIsRejected() {
        assertThatThrownBy(() -> GenerationOptions.builder().minimumOutputSize(-1))
                .isInstanceOf(GenerationOptionsException.class)
                .hasMessage("Invalid generation option 'minimumOutputSize': must not be negative");
        assertThatThrownBy(() -> GenerationOptions.builder().target(null))
                .isInstanceOf(GenerationOptionsException.class)
                .satisfies(e -> assertThat(((GenerationOptionsException) e).getOption()).isEqualTo("target"));
    }

    @Test
    void toBuilderCopiesEverySetting() {
        GenerationOptions original = GenerationOptions.builder()
                .optimize(true)
                .optimizationLevel(2)
                .dryRun(true)
                .prettyPrint(false)
                .emitTypeComments(true)
                .minimumOutputSize(10)
                .target(Target.NODE)
                .build();

        GenerationOptions copy = original.toBuilder().strictMode(true).build();

        assertThat(copy.optimize()).isTrue();
        assertThat(copy.optimizationLevel()).isEqualTo(2);
        assertThat(copy.dryRun()).isTrue();
        assertThat(copy.prettyPrint()).isFalse();
        assertThat(copy.emitTypeComments()).isTrue();
        assertThat(copy.minimumOutputSize()).isEqualTo(10);
        assertThat(copy.target()).isEqualTo(Target.NODE);
        assertThat(copy.strictMode()).isTrue();
        assertThat(original.strictMode()).isFalse();
    }
}
