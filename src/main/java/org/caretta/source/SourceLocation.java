package org.caretta.source;

/**
 * An opaque reference to one byte inside a buffer registered with a {@link BufferRegistry}.
 * <p>
 * Every registered buffer occupies a private, non-overlapping interval of the
 * registry's linear address space, so containment and ordering are plain integer
 * comparisons. Address {@code 0} is never handed out and stands for "no location".
 * Locations are obtained from {@link SourceBuffer#locationAt(int)} or
 * {@link BufferRegistry#getLocation(int, int)}.
 *
 * @param address The registry-scoped address.
 */
public record SourceLocation(long address) implements Comparable<SourceLocation> {

    /** The sentinel for "no location". */
    public static final SourceLocation NONE = new SourceLocation(0);

    public SourceLocation {
        if (address < 0) {
            throw new IllegalArgumentException("Location address must not be negative: " + address);
        }
    }

    public boolean isValid() {
        return address != 0;
    }

    @Override
    public int compareTo(SourceLocation other) {
        return Long.compare(address, other.address);
    }

    @Override
    public String toString() {
        return isValid() ? "@" + address : "<none>";
    }
}
