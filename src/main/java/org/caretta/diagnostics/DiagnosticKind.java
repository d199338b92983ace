package org.caretta.diagnostics;

/**
 * The severity of a diagnostic.
 */
public enum DiagnosticKind {
    /** A problem that prevents successful processing. */
    ERROR("error"),
    /** A problem that does not prevent processing. */
    WARNING("warning"),
    /** Additional information attached to another diagnostic. */
    NOTE("note"),
    /** An informational message, e.g. an optimization report. */
    REMARK("remark");

    private final String label;

    DiagnosticKind(String label) {
        this.label = label;
    }

    /**
     * @return The lower-case label printed in front of the message.
     */
    public String label() {
        return label;
    }
}
