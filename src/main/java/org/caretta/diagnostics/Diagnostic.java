package org.caretta.diagnostics;

import org.caretta.source.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An immutable snapshot of one reported event: severity, location, message and
 * the source line it refers to, with highlighted column ranges and suggested edits.
 * Fix-its are kept sorted by range start, then range end.
 *
 * @param location The reported location, or {@link SourceLocation#NONE}.
 * @param fileName The identifier of the buffer, {@code <unknown>} without a location.
 * @param lineNumber The 1-based line number, or -1 if the location is invalid.
 * @param columnNumber The 0-based byte column, or -1 if the location is invalid.
 * @param kind The severity.
 * @param message The message text.
 * @param lineContents The reported line without its line terminator.
 * @param ranges Highlighted column ranges clipped to the reported line.
 * @param fixIts Suggested edits.
 */
public record Diagnostic(
        SourceLocation location,
        String fileName,
        int lineNumber,
        int columnNumber,
        DiagnosticKind kind,
        String message,
        String lineContents,
        List<ColumnRange> ranges,
        List<FixIt> fixIts
) {

    public Diagnostic {
        Objects.requireNonNull(location, "location cannot be null");
        Objects.requireNonNull(fileName, "fileName cannot be null");
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(message, "message cannot be null");
        Objects.requireNonNull(lineContents, "lineContents cannot be null");
        ranges = List.copyOf(ranges);
        List<FixIt> sorted = new ArrayList<>(fixIts);
        Collections.sort(sorted);
        fixIts = Collections.unmodifiableList(sorted);
    }

    /**
     * Creates a message-only diagnostic that is not tied to a source line.
     * @param fileName The file to attribute the message to; may be empty.
     * @param kind The severity.
     * @param message The message text.
     * @return The diagnostic.
     */
    public static Diagnostic withoutLocation(String fileName, DiagnosticKind kind, String message) {
        return new Diagnostic(SourceLocation.NONE, fileName, -1, -1, kind, message, "", List.of(), List.of());
    }

    /**
     * @return {@code true} if line and column are known, so a source snippet can be shown.
     */
    public boolean hasLineAndColumn() {
        return lineNumber != -1 && columnNumber != -1;
    }

    @Override
    public String toString() {
        if (!hasLineAndColumn()) {
            return String.format("%s: %s: %s", fileName, kind.label(), message);
        }
        return String.format("%s:%d:%d: %s: %s", fileName, lineNumber, columnNumber + 1, kind.label(), message);
    }
}
