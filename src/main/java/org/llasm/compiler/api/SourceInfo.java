package org.llasm.compiler.api;

/**
 * A pure data class representing a position in the assembly source.
 * It is part of the public lowering API and free of implementation details.
 *
 * @param fileName The file where the construct is located.
 * @param lineNumber The line number.
 * @param columnNumber The column number.
 * @param text The source text of the representative token.
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber, String text) {

    /** Position used when a construct carries no token. */
    public static final SourceInfo UNKNOWN = new SourceInfo("unknown", -1, -1, "");

    @Override
    public String toString() {
        return String.format("%s:%d:%d", fileName, lineNumber, columnNumber);
    }
}
