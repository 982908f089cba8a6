package org.llasm.compiler.diagnostics;

/**
 * Represents a single diagnostic message that occurs while lowering a module.
 *
 * @param type The type of the diagnostic (e.g., ERROR).
 * @param code A stable machine-readable code, e.g. {@code UNRESOLVED_REFERENCE} or {@code UNIMPLEMENTED}.
 * @param message The diagnostic message.
 * @param fileName The name of the file where the issue occurred.
 * @param lineNumber The line number of the issue.
 */
public record Diagnostic(
        Type type,
        String code,
        String message,
        String fileName,
        int lineNumber
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents the module from lowering. */
        ERROR
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d: %s (%s)", type, fileName, lineNumber, message, code);
    }
}
