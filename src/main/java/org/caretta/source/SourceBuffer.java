package org.caretta.source;

import java.util.Objects;

/**
 * A source text registered with a {@link BufferRegistry}.
 * <p>
 * The buffer owns the address interval {@code [start, start + length]} of its registry;
 * the last address is the end-of-buffer position. It remembers the location of the
 * directive that included it ({@link SourceLocation#NONE} for top-level buffers) and
 * builds its newline {@link OffsetIndex} on the first line query.
 * <p>
 * The index is published through a volatile field. Two threads racing on the first
 * query would both build an equal index and one result is dropped, so lookups are
 * safe to share once registration has finished.
 */
public final class SourceBuffer {

    private final int id;
    private final SourceText text;
    private final long startAddress;
    private final SourceLocation includeLocation;
    private volatile OffsetIndex offsetIndex;

    SourceBuffer(int id, SourceText text, long startAddress, SourceLocation includeLocation) {
        this.id = id;
        this.text = Objects.requireNonNull(text, "text cannot be null");
        this.startAddress = startAddress;
        this.includeLocation = Objects.requireNonNull(includeLocation, "includeLocation cannot be null");
    }

    public int id() {
        return id;
    }

    public SourceText text() {
        return text;
    }

    public String identifier() {
        return text.identifier();
    }

    public int length() {
        return text.length();
    }

    /**
     * @return The location of the include directive, or {@link SourceLocation#NONE} for a top-level buffer.
     */
    public SourceLocation includeLocation() {
        return includeLocation;
    }

    public SourceLocation start() {
        return new SourceLocation(startAddress);
    }

    /**
     * @return The end-of-buffer location, one past the last byte.
     */
    public SourceLocation end() {
        return new SourceLocation(endAddress());
    }

    long startAddress() {
        return startAddress;
    }

    long endAddress() {
        return startAddress + text.length();
    }

    public boolean contains(SourceLocation location) {
        long address = location.address();
        return location.isValid() && address >= startAddress && address <= endAddress();
    }

    /**
     * @param offset A byte offset in {@code [0, length()]}.
     * @return The location of that byte.
     */
    public SourceLocation locationAt(int offset) {
        if (offset < 0 || offset > text.length()) {
            throw new IllegalArgumentException("Offset " + offset + " is outside of buffer '" + identifier()
                    + "' of length " + text.length());
        }
        return new SourceLocation(startAddress + offset);
    }

    /**
     * @param location A location inside this buffer.
     * @return Its byte offset.
     */
    public int offsetOf(SourceLocation location) {
        if (!contains(location)) {
            throw new IllegalArgumentException("Location " + location + " does not belong to buffer '" + identifier() + "'");
        }
        return (int) (location.address() - startAddress);
    }

    /**
     * @return The newline index, built on first use.
     */
    public OffsetIndex offsetIndex() {
        OffsetIndex index = offsetIndex;
        if (index == null) {
            index = OffsetIndex.build(text);
            offsetIndex = index;
        }
        return index;
    }

    /**
     * Finds the line containing a byte offset. A newline belongs to the line it ends.
     *
     * @param offset A byte offset in {@code [0, length()]}.
     * @return The line, newline inclusive except possibly for the last line.
     */
    public SourceLine lineContaining(int offset) {
        if (offset < 0 || offset > text.length()) {
            throw new IllegalArgumentException("Offset " + offset + " is outside of buffer '" + identifier() + "'");
        }
        OffsetIndex index = offsetIndex();
        int eol = index.lowerBound(offset);

        int lineStart = eol != 0 ? (int) index.offsetAt(eol - 1) + 1 : 0;
        int lineEnd = eol != index.count() ? (int) index.offsetAt(eol) + 1 : text.length();
        return new SourceLine(1 + eol, lineStart, lineEnd, text.decode(lineStart, lineEnd));
    }

    /**
     * Looks a line up by number. The last line may lack a trailing newline; a line
     * number past the end yields an empty line positioned at the end of the buffer.
     *
     * @param lineNumber The 1-based line number.
     * @return The line.
     */
    public SourceLine line(int lineNumber) {
        if (lineNumber < 1) {
            throw new IllegalArgumentException("Line number must be 1-based, got " + lineNumber);
        }
        OffsetIndex index = offsetIndex();
        int line = lineNumber - 1;
        int size = index.count();

        if (line < size) {
            int lineStart = line != 0 ? (int) index.offsetAt(line - 1) + 1 : 0;
            int lineEnd = (int) index.offsetAt(line) + 1;
            return new SourceLine(lineNumber, lineStart, lineEnd, text.decode(lineStart, lineEnd));
        }
        if (line == size) {
            int lineStart = size != 0 ? (int) index.offsetAt(size - 1) + 1 : 0;
            return new SourceLine(lineNumber, lineStart, text.length(), text.decode(lineStart, text.length()));
        }
        return new SourceLine(lineNumber, text.length(), text.length(), "");
    }

    @Override
    public String toString() {
        return "SourceBuffer[" + id + ", " + identifier() + "]";
    }
}
