package org.llasm.junit.extensions.logging;

/**
 * Log levels understood by {@link LogWatchExtension} annotations.
 */
public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR
}
