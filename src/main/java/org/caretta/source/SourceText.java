package org.caretta.source;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * An immutable view over the bytes of one file or snippet together with the
 * identifier it is reported under (usually a path, or a synthetic name such as
 * {@code <memory>}). The identifier {@code "-"} denotes standard input.
 * <p>
 * Offsets into a source text are byte offsets; column arithmetic elsewhere in
 * Caretta is byte based as well.
 */
public final class SourceText {

    private final byte[] content;
    private final String identifier;

    private SourceText(byte[] content, String identifier) {
        this.content = content;
        this.identifier = Objects.requireNonNull(identifier, "identifier cannot be null");
    }

    /**
     * Creates a source text from a string, encoded as UTF-8.
     * @param content The source content.
     * @param identifier The name the text is reported under.
     * @return The new source text.
     */
    public static SourceText fromString(String content, String identifier) {
        Objects.requireNonNull(content, "content cannot be null");
        return new SourceText(content.getBytes(StandardCharsets.UTF_8), identifier);
    }

    /**
     * Creates a source text from raw bytes. The array is copied.
     * @param content The source bytes.
     * @param identifier The name the text is reported under.
     * @return The new source text.
     */
    public static SourceText fromBytes(byte[] content, String identifier) {
        Objects.requireNonNull(content, "content cannot be null");
        return new SourceText(content.clone(), identifier);
    }

    public String identifier() {
        return identifier;
    }

    public int length() {
        return content.length;
    }

    public byte byteAt(int offset) {
        return content[offset];
    }

    /**
     * Decodes the bytes in {@code [start, end)} as UTF-8.
     * @param start The first byte offset, inclusive.
     * @param end The last byte offset, exclusive.
     * @return The decoded text.
     */
    public String decode(int start, int end) {
        return new String(content, start, end - start, StandardCharsets.UTF_8);
    }

    /**
     * @return A copy of the full content.
     */
    public byte[] toByteArray() {
        return Arrays.copyOf(content, content.length);
    }

    // No copy; callers in this package must not modify the array.
    byte[] bytes() {
        return content;
    }

    @Override
    public String toString() {
        return identifier + " (" + content.length + " bytes)";
    }
}
