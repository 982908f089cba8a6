package org.llasm.compiler.api;

/**
 * A semantic failure raised while lowering one unit (an instruction, a function, a global).
 * <p>
 * The input was grammatically valid but does not describe a valid program: an unresolved
 * name, a name of the wrong kind, a redefinition and so on. The exception carries the
 * offending spelling and the construct being lowered so the driver can report it.
 */
public class LoweringException extends Exception {

    private final LoweringErrorCode code;
    private final String offending;
    private final String construct;
    private final SourceInfo source;

    /**
     * Constructs a new lowering exception.
     * @param code The error code.
     * @param offending The offending name or spelling.
     * @param construct A short description of the construct being lowered (e.g. "phi incoming").
     * @param message The detail message.
     * @param source The source position, or {@code null} if unknown.
     */
    public LoweringException(LoweringErrorCode code, String offending, String construct, String message, SourceInfo source) {
        this(code, offending, construct, message, source, null);
    }

    /**
     * Constructs a new lowering exception with a cause.
     * @param code The error code.
     * @param offending The offending name or spelling.
     * @param construct A short description of the construct being lowered.
     * @param message The detail message.
     * @param source The source position, or {@code null} if unknown.
     * @param cause The underlying failure.
     */
    public LoweringException(LoweringErrorCode code, String offending, String construct, String message,
                             SourceInfo source, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.offending = offending;
        this.construct = construct;
        this.source = source != null ? source : SourceInfo.UNKNOWN;
    }

    /**
     * Re-raises this failure attributed to an enclosing construct, keeping code, spelling and position.
     * @param enclosingConstruct The construct the failure is attributed to.
     * @return A new exception whose cause is this one.
     */
    public LoweringException within(String enclosingConstruct) {
        return new LoweringException(code, offending, enclosingConstruct,
                enclosingConstruct + ": " + getMessage(), source, this);
    }

    public LoweringErrorCode code() {
        return code;
    }

    public String offending() {
        return offending;
    }

    public String construct() {
        return construct;
    }

    public SourceInfo source() {
        return source;
    }
}
