package org.caretta.io;

import org.caretta.source.SourceText;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Centralizes file loading for source buffers. Content is kept byte for byte;
 * line endings are not normalized because locations and columns refer to the
 * original bytes.
 */
public final class SourceLoader {

    /** Identifier used for text read from standard input. */
    public static final String STDIN_IDENTIFIER = "-";

    private SourceLoader() {}

    /**
     * Loads a file from the local filesystem. The path, with separators normalized
     * to {@code /}, becomes the identifier.
     *
     * @param path The file to read.
     * @return The loaded text.
     * @throws IOException If the file does not exist or cannot be read.
     */
    public static SourceText loadFile(Path path) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        byte[] content = Files.readAllBytes(path);
        return SourceText.fromBytes(content, logicalName(path));
    }

    /**
     * Reads a stream to its end.
     *
     * @param in The stream; it is not closed.
     * @param identifier The identifier for the text.
     * @return The loaded text.
     * @throws IOException If reading fails.
     */
    public static SourceText loadStream(InputStream in, String identifier) throws IOException {
        Objects.requireNonNull(in, "in cannot be null");
        return SourceText.fromBytes(in.readAllBytes(), identifier);
    }

    /**
     * Loads either standard input (for {@code "-"}) or a file.
     *
     * @param pathOrDash A path, or {@code "-"} for standard input.
     * @return The loaded text.
     * @throws IOException If reading fails.
     */
    public static SourceText load(String pathOrDash) throws IOException {
        if (STDIN_IDENTIFIER.equals(pathOrDash)) {
            return loadStream(System.in, STDIN_IDENTIFIER);
        }
        return loadFile(Path.of(pathOrDash));
    }

    /**
     * @param path A path.
     * @return The path as string with {@code /} separators.
     */
    public static String logicalName(Path path) {
        return path.toString().replace('\\', '/');
    }
}
