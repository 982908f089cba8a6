package org.llasm.compiler.config;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class LoweringOptionsTest {

    @Test
    void defaultsComeFromReferenceConf() {
        LoweringOptions options = LoweringOptions.defaults();

        assertThat(options.maxErrors()).isEqualTo(25);
        assertThat(options.continueAfterError()).isTrue();
    }

    @Test
    void missingKeysFallBackToDefaults() {
        LoweringOptions options = LoweringOptions.from(ConfigFactory.parseString("llasm.lowering.max-errors = 3"));

        assertThat(options.maxErrors()).isEqualTo(3);
        assertThat(options.continueAfterError()).isTrue();
    }

    @Test
    void maxErrorsBelowOneIsRejected() {
        assertThatThrownBy(() -> LoweringOptions.from(ConfigFactory.parseString("llasm.lowering.max-errors = 0")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("max-errors");
    }
}
