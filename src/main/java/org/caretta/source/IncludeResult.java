package org.caretta.source;

/**
 * Outcome of {@link BufferRegistry#addIncludeFile}. A missing include is an expected
 * outcome, not an error: it is signalled by {@link #NOT_FOUND}, whose buffer id is 0.
 *
 * @param bufferId The id of the new buffer, or 0 if the file was not found.
 * @param resolvedPath The path the file was read from, or {@code null} if not found.
 */
public record IncludeResult(int bufferId, String resolvedPath) {

    public static final IncludeResult NOT_FOUND = new IncludeResult(0, null);

    public boolean found() {
        return bufferId != 0;
    }
}
