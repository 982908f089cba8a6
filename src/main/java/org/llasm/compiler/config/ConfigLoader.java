package org.llasm.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Assembles the configuration read by {@link LoweringOptions}.
 * <p>
 * Layers, highest priority first: environment variables, system properties such as
 * {@code -Dllasm.lowering.max-errors=5}, an optional {@value #CONFIG_FILE_NAME} and the
 * {@code reference.conf} defaults shipped with the library.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final String CONFIG_FILE_NAME = "llasm.conf";

    private ConfigLoader() {}

    /**
     * Loads the configuration with {@value #CONFIG_FILE_NAME} looked up in the working directory.
     *
     * @return A resolved {@link Config}.
     * @see #load(File)
     */
    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    /**
     * Loads the configuration with the given file as the project-level layer.
     *
     * @param overrides The project file; skipped if it does not exist.
     * @return A resolved {@link Config} holding at least the {@code llasm.lowering} defaults.
     */
    public static Config load(final File overrides) {
        return ConfigFactory.systemEnvironment()
            .withFallback(ConfigFactory.systemProperties())
            .withFallback(projectLayer(overrides))
            .withFallback(ConfigFactory.parseResources("reference.conf"))
            .resolve();
    }

    private static Config projectLayer(final File file) {
        if (!file.isFile()) {
            LOG.debug("No lowering configuration at '{}', using defaults", file.getPath());
            return ConfigFactory.empty();
        }
        LOG.info("Reading lowering configuration from {}", file.getAbsolutePath());
        return ConfigFactory.parseFile(file);
    }
}
