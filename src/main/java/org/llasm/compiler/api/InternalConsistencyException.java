package org.llasm.compiler.api;

/**
 * Signals a contract mismatch between the parser and the lowering core: a syntax node reached
 * the lowering in a shape the grammar is supposed to exclude (an identifier without its sigil,
 * a boolean literal that is neither {@code true} nor {@code false}, ...).
 * <p>
 * This is never a user-facing diagnostic and is never caught by the lowering driver.
 */
public class InternalConsistencyException extends IllegalStateException {

    /**
     * @param message The detail message.
     */
    public InternalConsistencyException(String message) {
        super(message);
    }

    /**
     * @param message The detail message.
     * @param cause The underlying failure.
     */
    public InternalConsistencyException(String message, Throwable cause) {
        super(message, cause);
    }
}
