package org.caretta.source;

import org.caretta.diagnostics.ColumnRange;
import org.caretta.diagnostics.Diagnostic;
import org.caretta.diagnostics.DiagnosticHandler;
import org.caretta.diagnostics.DiagnosticKind;
import org.caretta.diagnostics.FixIt;
import org.caretta.diagnostics.render.DiagnosticRenderer;
import org.caretta.diagnostics.render.OutputSink;
import org.caretta.io.SourceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Owns the source buffers of one compilation and maps locations back to them.
 * <p>
 * Buffers are append-only and immutable once registered, so a location stays
 * resolvable for the registry's whole lifetime. Ids are dense and start at 1; 0 means
 * "no buffer". Each buffer gets its own address interval, and a sorted map from
 * interval end to id gives O(log n) containment lookups. A one-slot cache of the
 * last resolved buffer makes the common case of successive lookups in the same
 * buffer O(1).
 * <p>
 * This class is not thread-safe. Registration and lookups mutate the buffer list,
 * the end map and the cache; callers sharing a registry must serialize access.
 * <p>
 * Passing a location that belongs to no registered buffer to a resolving method, or
 * buffer id 0 where one is required, is a programming error and fails with an
 * exception rather than producing a wrong answer.
 */
public class BufferRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(BufferRegistry.class);

    /** File name used for diagnostics without a location. */
    public static final String UNKNOWN_FILE = "<unknown>";

    private final List<SourceBuffer> buffers = new ArrayList<>();
    private final TreeMap<Long, Integer> bufferEnds = new TreeMap<>();
    private final DiagnosticRenderer renderer;

    private List<Path> includeDirectories = List.of();
    private long nextStartAddress = 1;

    // Not thread-safe; only a speed-up, never needed for correctness.
    private int lastFoundBufferId;

    private DiagnosticHandler handler;
    private Object handlerContext;

    /**
     * Creates a registry that renders with a default {@link DiagnosticRenderer}.
     */
    public BufferRegistry() {
        this(new DiagnosticRenderer());
    }

    /**
     * @param renderer The renderer used by {@link #printMessage} when no handler is installed.
     */
    public BufferRegistry(DiagnosticRenderer renderer) {
        this.renderer = Objects.requireNonNull(renderer, "renderer cannot be null");
    }

    // region Registration

    /**
     * Registers a buffer.
     *
     * @param text The buffer content.
     * @param includeLocation Where the buffer was included from, or {@link SourceLocation#NONE} for a top-level buffer.
     * @return The new 1-based buffer id.
     */
    public int addBuffer(SourceText text, SourceLocation includeLocation) {
        Objects.requireNonNull(text, "text cannot be null");
        Objects.requireNonNull(includeLocation, "includeLocation cannot be null");
        if (includeLocation.isValid() && findBufferContaining(includeLocation) == 0) {
            throw new IllegalArgumentException("Include location " + includeLocation + " does not belong to any registered buffer");
        }

        int id = buffers.size() + 1;
        SourceBuffer buffer = new SourceBuffer(id, text, nextStartAddress, includeLocation);
        buffers.add(buffer);
        bufferEnds.put(buffer.endAddress(), id);
        nextStartAddress = buffer.endAddress() + 1;

        LOG.debug("Registered buffer {} '{}' ({} bytes)", id, text.identifier(), text.length());
        return id;
    }

    /**
     * Registers a top-level buffer.
     * @param text The buffer content.
     * @return The new 1-based buffer id.
     */
    public int addBuffer(SourceText text) {
        return addBuffer(text, SourceLocation.NONE);
    }

    /**
     * Opens an include file and registers it. The file name is tried as given first,
     * then relative to each search directory in order; the first readable file wins.
     *
     * @param fileName The name from the include directive.
     * @param includeLocation The location of the include directive.
     * @param searchDirectories Directories to search if the file cannot be opened directly.
     * @return The new buffer id and the path it was read from, or {@link IncludeResult#NOT_FOUND}.
     */
    public IncludeResult addIncludeFile(String fileName, SourceLocation includeLocation, List<Path> searchDirectories) {
        Objects.requireNonNull(fileName, "fileName cannot be null");
        Objects.requireNonNull(searchDirectories, "searchDirectories cannot be null");

        Optional<Path> candidate = toPath(fileName);
        Optional<SourceText> text = candidate.flatMap(this::tryLoad);

        // If the file didn't exist directly, see if it's in an include path.
        for (int i = 0; i < searchDirectories.size() && text.isEmpty(); i++) {
            Path directory = searchDirectories.get(i);
            candidate = toPath(fileName).map(directory::resolve);
            text = candidate.flatMap(this::tryLoad);
        }

        if (text.isEmpty()) {
            LOG.debug("Include file '{}' not found directly or in {} search directories", fileName, searchDirectories.size());
            return IncludeResult.NOT_FOUND;
        }

        int id = addBuffer(text.get(), includeLocation);
        return new IncludeResult(id, text.get().identifier());
    }

    /**
     * Same as {@link #addIncludeFile(String, SourceLocation, List)} with the configured
     * {@linkplain #setIncludeDirectories include directories}.
     */
    public IncludeResult addIncludeFile(String fileName, SourceLocation includeLocation) {
        return addIncludeFile(fileName, includeLocation, includeDirectories);
    }

    public void setIncludeDirectories(List<Path> directories) {
        this.includeDirectories = List.copyOf(directories);
    }

    public List<Path> getIncludeDirectories() {
        return includeDirectories;
    }

    private Optional<Path> toPath(String fileName) {
        try {
            return Optional.of(Path.of(fileName));
        } catch (InvalidPathException e) {
            LOG.debug("'{}' is not a valid path: {}", fileName, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<SourceText> tryLoad(Path path) {
        try {
            return Optional.of(SourceLoader.loadFile(path));
        } catch (IOException e) {
            LOG.debug("Could not open include candidate {}: {}", path, e.toString());
            return Optional.empty();
        }
    }

    // endregion

    // region Buffer access

    public int getNumBuffers() {
        return buffers.size();
    }

    /**
     * @return The id of the first registered buffer, or 0 if there is none.
     */
    public int getMainBufferId() {
        return buffers.isEmpty() ? 0 : 1;
    }

    public boolean isValidBufferId(int id) {
        return id >= 1 && id <= buffers.size();
    }

    /**
     * @param id A valid buffer id.
     * @return The buffer.
     */
    public SourceBuffer getBuffer(int id) {
        if (!isValidBufferId(id)) {
            throw new IllegalArgumentException("Invalid buffer id " + id + " (registered buffers: " + buffers.size() + ")");
        }
        return buffers.get(id - 1);
    }

    /**
     * @param id A valid buffer id.
     * @return The location the buffer was included from, or {@link SourceLocation#NONE}.
     */
    public SourceLocation getParentIncludeLocation(int id) {
        return getBuffer(id).includeLocation();
    }

    /**
     * @param id A valid buffer id.
     * @param offset A byte offset in {@code [0, length]} of that buffer.
     * @return The location.
     */
    public SourceLocation getLocation(int id, int offset) {
        return getBuffer(id).locationAt(offset);
    }

    // endregion

    // region Location resolution

    /**
     * Finds the buffer a location belongs to.
     *
     * @param location A location.
     * @return The buffer id, or 0 if the location belongs to no registered buffer.
     */
    public int findBufferContaining(SourceLocation location) {
        if (!location.isValid()) {
            return 0;
        }

        // Most searches are in the same buffer as the previous one.
        if (lastFoundBufferId != 0 && buffers.get(lastFoundBufferId - 1).contains(location)) {
            return lastFoundBufferId;
        }

        Map.Entry<Long, Integer> entry = bufferEnds.ceilingEntry(location.address());
        if (entry != null && location.address() >= buffers.get(entry.getValue() - 1).startAddress()) {
            lastFoundBufferId = entry.getValue();
            return lastFoundBufferId;
        }
        return 0;
    }

    /**
     * Finds the line a location is on.
     *
     * @param location A location inside a registered buffer.
     * @param bufferId The id of the buffer holding the location, or 0 to look it up.
     * @return The line, newline inclusive except possibly for the last line of the buffer.
     */
    public SourceLine findLine(SourceLocation location, int bufferId) {
        SourceBuffer buffer = resolve(location, bufferId);
        return buffer.lineContaining(buffer.offsetOf(location));
    }

    public SourceLine findLine(SourceLocation location) {
        return findLine(location, 0);
    }

    /**
     * @param location A location inside a registered buffer.
     * @param bufferId The id of the buffer holding the location, or 0 to look it up.
     * @return The 1-based line number.
     */
    public int findLineNumber(SourceLocation location, int bufferId) {
        return findLine(location, bufferId).lineNumber();
    }

    /**
     * Looks a line up by number.
     *
     * @param lineNumber The 1-based line number.
     * @param bufferId The buffer id; must not be 0.
     * @return The line; an empty line at the buffer end if the number is past the last line.
     */
    public SourceLine getLineRef(int lineNumber, int bufferId) {
        if (bufferId == 0) {
            throw new IllegalArgumentException("Buffer id must be specified");
        }
        return getBuffer(bufferId).line(lineNumber);
    }

    /**
     * @param location A location inside a registered buffer.
     * @param bufferId The id of the buffer holding the location, or 0 to look it up.
     * @return The 1-based line and 1-based byte column.
     */
    public LineAndColumn getLineAndColumn(SourceLocation location, int bufferId) {
        SourceBuffer buffer = resolve(location, bufferId);
        int offset = buffer.offsetOf(location);
        SourceLine line = buffer.lineContaining(offset);
        return new LineAndColumn(line.lineNumber(), line.columnOf(offset));
    }

    private SourceBuffer resolve(SourceLocation location, int bufferId) {
        Objects.requireNonNull(location, "location cannot be null");
        int id = bufferId != 0 ? bufferId : findBufferContaining(location);
        if (id == 0) {
            throw new IllegalStateException("Invalid location " + location + ": not inside any registered buffer");
        }
        SourceBuffer buffer = getBuffer(id);
        if (!buffer.contains(location)) {
            throw new IllegalArgumentException("Location " + location + " is not inside buffer " + id);
        }
        return buffer;
    }

    // endregion

    // region Diagnostics

    /**
     * Builds a diagnostic for a location. The reported line is cut out by scanning to
     * the nearest line break on either side; ranges are clipped to that line and
     * converted to columns, and ranges not touching it are dropped.
     * <p>
     * The line number counts {@code '\n'} only, while both {@code '\n'} and {@code '\r'}
     * end the reported line. The column is taken relative to that reported line, so
     * after a lone {@code '\r'} it differs from {@link #getLineAndColumn}.
     *
     * @param location The location, or {@link SourceLocation#NONE} for a message-only diagnostic.
     * @param kind The severity.
     * @param message The message.
     * @param ranges Ranges to highlight.
     * @param fixIts Suggested edits.
     * @return The diagnostic.
     */
    public Diagnostic buildDiagnostic(SourceLocation location, DiagnosticKind kind, String message,
                                      List<SourceRange> ranges, List<FixIt> fixIts) {
        if (!location.isValid()) {
            return new Diagnostic(location, UNKNOWN_FILE, -1, -1, kind, message, "", List.of(), fixIts);
        }

        int id = findBufferContaining(location);
        if (id == 0) {
            throw new IllegalStateException("Invalid location " + location + ": not inside any registered buffer");
        }
        SourceBuffer buffer = getBuffer(id);
        SourceText text = buffer.text();
        int offset = buffer.offsetOf(location);

        int lineStart = offset;
        while (lineStart != 0 && !isLineBreak(text.byteAt(lineStart - 1))) {
            lineStart--;
        }
        int lineEnd = offset;
        while (lineEnd != text.length() && !isLineBreak(text.byteAt(lineEnd))) {
            lineEnd++;
        }
        String lineContents = text.decode(lineStart, lineEnd);

        long lineStartAddress = buffer.startAddress() + lineStart;
        long lineEndAddress = buffer.startAddress() + lineEnd;

        List<ColumnRange> columnRanges = new ArrayList<>();
        for (SourceRange range : ranges) {
            if (!range.isValid()) continue;

            long start = range.start().address();
            long end = range.end().address();
            if (start > lineEndAddress || end < lineStartAddress) continue;

            start = Math.max(start, lineStartAddress);
            end = Math.min(end, lineEndAddress);
            if (end < start) continue;

            columnRanges.add(new ColumnRange((int) (start - lineStartAddress), (int) (end - lineStartAddress)));
        }

        // Column is measured from the scanned line start so it matches lineContents even after a lone '\r'.
        int lineNumber = buffer.lineContaining(offset).lineNumber();
        return new Diagnostic(location, buffer.identifier(), lineNumber, offset - lineStart,
                kind, message, lineContents, columnRanges, fixIts);
    }

    public Diagnostic buildDiagnostic(SourceLocation location, DiagnosticKind kind, String message) {
        return buildDiagnostic(location, kind, message, List.of(), List.of());
    }

    private static boolean isLineBreak(byte b) {
        return b == '\n' || b == '\r';
    }

    /**
     * Prints the chain of include directives leading to {@code includeLocation},
     * outermost file first, one {@code Included from FILE:LINE:} line per level.
     *
     * @param includeLocation The include location of the buffer being reported on.
     * @param sink The output.
     */
    public void printIncludeStack(SourceLocation includeLocation, OutputSink sink) {
        if (!includeLocation.isValid()) {
            return; // Top of stack.
        }

        int id = findBufferContaining(includeLocation);
        if (id == 0) {
            throw new IllegalStateException("Invalid include location " + includeLocation);
        }
        SourceBuffer buffer = getBuffer(id);

        printIncludeStack(buffer.includeLocation(), sink);

        sink.append("Included from ")
                .append(buffer.identifier())
                .append(":")
                .append(Integer.toString(findLineNumber(includeLocation, id)))
                .append(":\n");
    }

    /**
     * Installs a handler that replaces rendering for every reported diagnostic.
     *
     * @param handler The handler, or {@code null} to restore default rendering.
     * @param context Passed to the handler with each diagnostic.
     */
    public void setHandler(DiagnosticHandler handler, Object context) {
        this.handler = handler;
        this.handlerContext = context;
    }

    public DiagnosticHandler getHandler() {
        return handler;
    }

    public Object getHandlerContext() {
        return handlerContext;
    }

    /**
     * Delivers a diagnostic: to the installed handler if there is one, otherwise by
     * printing the include stack of its buffer followed by the rendered diagnostic.
     *
     * @param sink The output used when no handler is installed.
     * @param diagnostic The diagnostic.
     * @param showColors Whether to use colors.
     */
    public void printMessage(OutputSink sink, Diagnostic diagnostic, boolean showColors) {
        if (handler != null) {
            handler.handle(diagnostic, handlerContext);
            return;
        }

        if (diagnostic.location().isValid()) {
            int id = findBufferContaining(diagnostic.location());
            if (id == 0) {
                throw new IllegalStateException("Invalid location " + diagnostic.location() + ": not inside any registered buffer");
            }
            printIncludeStack(getBuffer(id).includeLocation(), sink);
        }

        renderer.print(diagnostic, sink, showColors);
    }

    /**
     * Builds a diagnostic and delivers it through {@link #printMessage}.
     */
    public void report(OutputSink sink, SourceLocation location, DiagnosticKind kind, String message,
                       List<SourceRange> ranges, List<FixIt> fixIts, boolean showColors) {
        printMessage(sink, buildDiagnostic(location, kind, message, ranges, fixIts), showColors);
    }

    public void report(OutputSink sink, SourceLocation location, DiagnosticKind kind, String message) {
        report(sink, location, kind, message, List.of(), List.of(), true);
    }

    // endregion
}
