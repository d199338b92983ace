package org.caretta.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A {@link DiagnosticHandler} that collects diagnostics instead of printing them.
 * <p>
 * Installing an engine on a registry decouples error reporting from the code that
 * detects the problems; the caller decides afterwards whether and how to show them.
 */
public class DiagnosticsEngine implements DiagnosticHandler {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    @Override
    public void handle(Diagnostic diagnostic, Object context) {
        report(diagnostic);
    }

    /**
     * Records a diagnostic.
     *
     * @param diagnostic The diagnostic; must not be {@code null}.
     */
    public void report(Diagnostic diagnostic) {
        if (diagnostic == null) {
            throw new IllegalArgumentException("diagnostic == null");
        }
        diagnostics.add(diagnostic);
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return count(DiagnosticKind.ERROR) > 0;
    }

    /**
     * @param kind A severity.
     * @return The number of diagnostics of that severity.
     */
    public long count(DiagnosticKind kind) {
        return diagnostics.stream().filter(d -> d.kind() == kind).count();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics, in report order.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public void clear() {
        diagnostics.clear();
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
