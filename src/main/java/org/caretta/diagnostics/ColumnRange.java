package org.caretta.diagnostics;

/**
 * A highlighted range on the reported line, as 0-based byte columns.
 *
 * @param start The first column, inclusive.
 * @param end The last column, exclusive.
 */
public record ColumnRange(int start, int end) {

    public ColumnRange {
        if (start < 0 || end < 0) {
            throw new IllegalArgumentException("Columns must not be negative: [" + start + ", " + end + ")");
        }
    }
}
