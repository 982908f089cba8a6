package org.llasm.compiler.frontend.lexer;

import org.llasm.compiler.api.SourceInfo;

/**
 * Represents a single token of IR assembly as delivered by the parser.
 *
 * @param type The type of the token (e.g., global identifier, integer literal, keyword).
 * @param text The exact text of the token from the source code, including sigils and quotes.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The logical file name from which this token originates.
 */
public record Token(
        TokenType type,
        String text,
        int line,
        int column,
        String fileName
) {

    /**
     * @return The position of this token for diagnostics.
     */
    public SourceInfo source() {
        return new SourceInfo(fileName, line, column, text);
    }
}
