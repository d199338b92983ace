package org.caretta.source;

import java.util.Objects;

/**
 * A half-open range of locations, {@code [start, end)}. A range whose start equals
 * its end is empty, which fix-its use to express a pure insertion.
 *
 * @param start The first location.
 * @param end The location one past the last.
 */
public record SourceRange(SourceLocation start, SourceLocation end) {

    /** The sentinel for "no range". */
    public static final SourceRange NONE = new SourceRange(SourceLocation.NONE, SourceLocation.NONE);

    public SourceRange {
        Objects.requireNonNull(start, "start cannot be null");
        Objects.requireNonNull(end, "end cannot be null");
    }

    /**
     * Creates an empty range at the given location.
     * @param location The location.
     * @return The empty range.
     */
    public static SourceRange at(SourceLocation location) {
        return new SourceRange(location, location);
    }

    public boolean isValid() {
        return start.isValid() && end.isValid();
    }

    public boolean isEmpty() {
        return start.equals(end);
    }
}
