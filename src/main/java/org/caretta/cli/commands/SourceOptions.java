package org.caretta.cli.commands;

import org.caretta.io.SourceLoader;
import org.caretta.source.BufferRegistry;
import org.caretta.source.IncludeResult;
import org.caretta.source.SourceBuffer;
import org.caretta.source.SourceLocation;
import picocli.CommandLine.Option;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Options shared by the commands that load a source file, optionally followed by a
 * chain of include files.
 */
public class SourceOptions {

    @Option(names = {"-f", "--file"}, required = true, description = "The source file, or '-' for standard input.")
    String file;

    @Option(names = {"-I", "--include-dir"}, description = "Directory searched for include files (repeatable).")
    List<Path> includeDirectories = new ArrayList<>();

    @Option(names = {"-i", "--include"}, paramLabel = "NAME@OFFSET",
            description = "Include NAME from OFFSET of the previous buffer (repeatable). Offsets then refer to the last included file.")
    List<String> includes = new ArrayList<>();

    /**
     * Registers the main file and the include chain.
     *
     * @param registry The registry to fill; includes are searched in its include directories.
     * @return The id of the innermost buffer.
     * @throws IOException If the main file cannot be read or an include cannot be found.
     */
    int load(BufferRegistry registry) throws IOException {
        int bufferId = registry.addBuffer(SourceLoader.load(file));
        for (String include : includes) {
            int separator = include.lastIndexOf('@');
            if (separator <= 0) {
                throw new IllegalArgumentException("Invalid include '" + include + "', expected NAME@OFFSET");
            }
            String name = include.substring(0, separator);
            int offset = parseOffset(include.substring(separator + 1));
            SourceLocation includeLocation = locationIn(registry.getBuffer(bufferId), offset);

            IncludeResult result = registry.addIncludeFile(name, includeLocation);
            if (!result.found()) {
                throw new FileNotFoundException("Include file '" + name + "' not found");
            }
            bufferId = result.bufferId();
        }
        return bufferId;
    }

    static int parseOffset(String text) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid offset '" + text + "'", e);
        }
    }

    /**
     * @throws IllegalArgumentException If the offset lies outside the buffer.
     */
    static SourceLocation locationIn(SourceBuffer buffer, int offset) {
        if (offset < 0 || offset > buffer.length()) {
            throw new IllegalArgumentException("Offset " + offset + " is outside '" + buffer.identifier()
                    + "' (0.." + buffer.length() + ")");
        }
        return buffer.locationAt(offset);
    }
}
