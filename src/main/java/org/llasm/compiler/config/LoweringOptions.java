package org.llasm.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Error policy of the module lowering driver.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * llasm.lowering {
 *   max-errors = 25              # stop lowering further units once this many errors were recorded
 *   continue-after-error = true  # false: stop at the first failed unit
 * }
 * </pre>
 *
 * @param maxErrors Upper bound on recorded errors before lowering is abandoned; at least 1.
 * @param continueAfterError Whether later units are lowered after one failed.
 */
public record LoweringOptions(int maxErrors, boolean continueAfterError) {

    private static final String PATH = "llasm.lowering";

    public LoweringOptions {
        if (maxErrors < 1) {
            throw new IllegalArgumentException("max-errors must be at least 1, got " + maxErrors);
        }
    }

    /**
     * Reads the options from the {@code llasm.lowering} block of the given configuration,
     * falling back to the classpath defaults for missing keys.
     *
     * @param config The application configuration.
     * @return The options.
     */
    public static LoweringOptions from(Config config) {
        Config c = config.withFallback(ConfigFactory.defaultReference()).getConfig(PATH);
        return new LoweringOptions(c.getInt("max-errors"), c.getBoolean("continue-after-error"));
    }

    /**
     * @return The options defined in {@code reference.conf}.
     */
    public static LoweringOptions defaults() {
        return from(ConfigFactory.empty());
    }
}
