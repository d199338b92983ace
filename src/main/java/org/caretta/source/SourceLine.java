package org.caretta.source;

/**
 * One line of a registered buffer.
 *
 * @param lineNumber The 1-based line number.
 * @param startOffset Byte offset of the first byte of the line.
 * @param endOffset Byte offset one past the last byte, including the terminating newline if any.
 * @param text The line text decoded as UTF-8, newline included.
 */
public record SourceLine(int lineNumber, int startOffset, int endOffset, String text) {

    /**
     * @param offset A byte offset inside this line.
     * @return The 1-based column of that offset.
     */
    public int columnOf(int offset) {
        if (offset < startOffset || offset > endOffset) {
            throw new IllegalArgumentException("Offset " + offset + " is not on line " + lineNumber
                    + " [" + startOffset + ", " + endOffset + "]");
        }
        return offset - startOffset + 1;
    }

    public boolean isEmpty() {
        return startOffset == endOffset;
    }
}
