package org.llasm.compiler.diagnostics;

import org.llasm.compiler.api.LoweringException;
import org.llasm.compiler.api.SourceInfo;
import org.llasm.compiler.api.UnimplementedFeatureException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting and managing diagnostic messages that occur while lowering a module.
 * <p>
 * This decouples error reporting from the lowering logic: lowering operations throw,
 * the driver decides what gets recorded here.
 */
public class DiagnosticsEngine {

    /** Code used for diagnostics that stem from an {@link UnimplementedFeatureException}. */
    public static final String UNIMPLEMENTED = "UNIMPLEMENTED";

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param code       The error code.
     * @param message    The error message.
     * @param fileName   The file in which the error occurred.
     * @param lineNumber The line number of the error.
     */
    public void reportError(String code, String message, String fileName, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, code, message, fileName, lineNumber));
    }

    /**
     * Reports a semantic lowering failure as an error.
     *
     * @param e The failure.
     */
    public void report(LoweringException e) {
        SourceInfo at = e.source();
        reportError(e.code().name(), e.getMessage(), at.fileName(), at.lineNumber());
    }

    /**
     * Reports an unimplemented feature as an error, tagged so it can be told apart from semantic errors.
     *
     * @param e The failure.
     * @param at Where the unit that hit the gap is located.
     */
    public void report(UnimplementedFeatureException e, SourceInfo at) {
        reportError(UNIMPLEMENTED, e.getMessage(), at.fileName(), at.lineNumber());
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * @return The number of reported errors.
     */
    public int errorCount() {
        return (int) diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).count();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
