package org.llasm.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.llasm.junit.extensions.logging.AllowLog;
import org.llasm.junit.extensions.logging.LogLevel;
import org.llasm.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    private static final String MAX_ERRORS = "llasm.lowering.max-errors";

    @AfterEach
    void clearSystemProperty() {
        System.clearProperty(MAX_ERRORS);
        ConfigFactory.invalidateCaches();
    }

    @Test
    void loadsReferenceDefaultsWithoutFile(@TempDir Path dir) {
        Config config = ConfigLoader.load(dir.resolve("absent.conf").toFile());

        assertThat(config.getInt(MAX_ERRORS)).isEqualTo(25);
        assertThat(config.getBoolean("llasm.lowering.continue-after-error")).isTrue();
    }

    @Test
    @AllowLog(level = LogLevel.INFO, loggerPattern = ".*ConfigLoader")
    void fileOverridesDefaults(@TempDir Path dir) throws IOException {
        File file = dir.resolve("llasm.conf").toFile();
        Files.writeString(file.toPath(), "llasm.lowering { max-errors = 4, continue-after-error = false }");

        LoweringOptions options = LoweringOptions.from(ConfigLoader.load(file));

        assertThat(options.maxErrors()).isEqualTo(4);
        assertThat(options.continueAfterError()).isFalse();
    }

    @Test
    @AllowLog(level = LogLevel.INFO, loggerPattern = ".*ConfigLoader")
    void systemPropertyOverridesFile(@TempDir Path dir) throws IOException {
        File file = dir.resolve("llasm.conf").toFile();
        Files.writeString(file.toPath(), "llasm.lowering.max-errors = 4");
        System.setProperty(MAX_ERRORS, "9");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.load(file);

        assertThat(config.getInt(MAX_ERRORS)).isEqualTo(9);
    }

    @Test
    void directoryInPlaceOfFileIsSkipped(@TempDir Path dir) {
        Config config = ConfigLoader.load(dir.toFile());

        assertThat(config.getInt(MAX_ERRORS)).isEqualTo(25);
    }
}
