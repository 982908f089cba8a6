package org.llasm.compiler.api;

/**
 * An exception that is thrown when one or more units of a module failed to lower.
 * <p>
 * It is part of the public API and hides the per-unit exception types of the lowering core;
 * the message is the formatted summary of all collected diagnostics.
 */
public class LoweringFailedException extends Exception {

    private final int errorCount;

    /**
     * Constructs a new exception with the specified diagnostics summary.
     * @param summary The formatted diagnostics.
     * @param errorCount The number of errors that were recorded.
     */
    public LoweringFailedException(String summary, int errorCount) {
        super(summary, null);
        this.errorCount = errorCount;
    }

    public int errorCount() {
        return errorCount;
    }
}
