package org.caretta.diagnostics;

/**
 * Receives diagnostics instead of the default renderer. Installed per registry with
 * {@link org.caretta.source.BufferRegistry#setHandler(DiagnosticHandler, Object)}; once
 * installed it fully replaces rendering and printing, include stack included.
 */
@FunctionalInterface
public interface DiagnosticHandler {

    /**
     * @param diagnostic The diagnostic being reported.
     * @param context The opaque context object given when the handler was installed; may be {@code null}.
     */
    void handle(Diagnostic diagnostic, Object context);
}
