package org.caretta.diagnostics.render;

import org.caretta.diagnostics.ColumnRange;
import org.caretta.diagnostics.Diagnostic;
import org.caretta.diagnostics.DiagnosticKind;
import org.caretta.diagnostics.FixIt;
import org.caretta.source.SourceRange;

import java.util.Arrays;
import java.util.List;

/**
 * Turns a {@link Diagnostic} into annotated text:
 * <pre>
 * main.c:3:9: error: use of undeclared identifier 'cuont'
 *   return cuont + 1;
 *          ^~~~~
 *          count
 * </pre>
 * The source line, the caret line and the fix-it line are expanded with the same
 * tab stops so that annotations stay aligned with the source. Lines containing
 * non-ASCII bytes are printed without annotations, since byte columns no longer
 * match display columns there.
 * <p>
 * Instances are immutable and thread-safe.
 */
public class DiagnosticRenderer {

    /** Columns between tab stops. */
    public static final int TAB_STOP = 8;

    private final String programName;
    private final boolean showKindLabel;

    /**
     * Creates a renderer without program name prefix that prints kind labels.
     */
    public DiagnosticRenderer() {
        this(null, true);
    }

    /**
     * @param programName Printed as {@code name: } in front of every diagnostic; {@code null} or empty to omit.
     * @param showKindLabel Whether to print the {@code error: }/{@code warning: } label.
     */
    public DiagnosticRenderer(String programName, boolean showKindLabel) {
        this.programName = programName;
        this.showKindLabel = showKindLabel;
    }

    /**
     * Renders a diagnostic.
     *
     * @param diagnostic The diagnostic.
     * @param sink The output.
     * @param showColors Whether to use colors; ignored if the sink has none.
     */
    public void print(Diagnostic diagnostic, OutputSink sink, boolean showColors) {
        boolean colors = showColors && sink.hasColors();

        if (colors) sink.changeColor(TerminalColor.SAVED, true);

        if (programName != null && !programName.isEmpty()) {
            sink.append(programName).append(": ");
        }

        String fileName = diagnostic.fileName();
        if (!fileName.isEmpty()) {
            sink.append("-".equals(fileName) ? "<stdin>" : fileName);
            if (diagnostic.lineNumber() != -1) {
                sink.append(":").append(Integer.toString(diagnostic.lineNumber()));
                if (diagnostic.columnNumber() != -1) {
                    sink.append(":").append(Integer.toString(diagnostic.columnNumber() + 1));
                }
            }
            sink.append(": ");
        }

        if (showKindLabel) {
            if (colors) sink.changeColor(colorOf(diagnostic.kind()), true);
            sink.append(diagnostic.kind().label()).append(": ");
            if (colors) {
                sink.resetColor();
                sink.changeColor(TerminalColor.SAVED, true);
            }
        }

        sink.append(diagnostic.message()).append('\n');

        if (colors) sink.resetColor();

        if (!diagnostic.hasLineAndColumn()) {
            return;
        }

        String lineContents = diagnostic.lineContents();
        if (containsNonAscii(lineContents)) {
            sink.append(expandSourceLine(lineContents)).append('\n');
            return;
        }

        int numColumns = lineContents.length();
        int columnNumber = diagnostic.columnNumber();

        char[] caretLine = new char[numColumns + 1];
        Arrays.fill(caretLine, ' ');

        for (ColumnRange range : diagnostic.ranges()) {
            int from = Math.min(range.start(), caretLine.length);
            int to = Math.min(range.end(), caretLine.length);
            if (to > from) {
                Arrays.fill(caretLine, from, to, '~');
            }
        }

        long lineStart = diagnostic.location().address() - columnNumber;
        StringBuilder fixItLine = new StringBuilder();
        buildFixItLine(caretLine, fixItLine, diagnostic.fixIts(), lineStart, numColumns);

        caretLine[Math.min(columnNumber, numColumns)] = '^';

        String caret = trimTrailingSpaces(caretLine);

        sink.append(expandSourceLine(lineContents)).append('\n');

        if (colors) sink.changeColor(TerminalColor.GREEN, true);
        sink.append(expandCaretLine(caret, lineContents)).append('\n');
        if (colors) sink.resetColor();

        if (fixItLine.length() == 0) {
            return;
        }
        sink.append(expandFixItLine(fixItLine.toString(), lineContents)).append('\n');
    }

    /**
     * Renders a diagnostic into a string without colors.
     * @param diagnostic The diagnostic.
     * @return The rendered text, newline terminated.
     */
    public String render(Diagnostic diagnostic) {
        StringBuilder out = new StringBuilder();
        print(diagnostic, AnsiOutputSink.plain(out), false);
        return out.toString();
    }

    static TerminalColor colorOf(DiagnosticKind kind) {
        return switch (kind) {
            case ERROR -> TerminalColor.RED;
            case WARNING -> TerminalColor.MAGENTA;
            case NOTE -> TerminalColor.BLACK;
            case REMARK -> TerminalColor.BLUE;
        };
    }

    /**
     * Writes each renderable fix-it into {@code fixItLine} at its column and marks the
     * replaced source range with {@code ~} on the caret line. A fix-it that would start
     * inside the text of the previous one is pushed one column past its end, leaving a
     * space so the two do not read as a single edit. Fix-its starting exactly where the
     * previous text ends are not moved.
     */
    static void buildFixItLine(char[] caretLine, StringBuilder fixItLine, List<FixIt> fixIts,
                               long lineStart, int numColumns) {
        long lineEnd = lineStart + numColumns;
        int prevHintEndCol = 0;

        for (FixIt fixIt : fixIts) {
            if (!fixIt.isRenderable()) {
                continue;
            }

            SourceRange range = fixIt.range();
            long start = range.start().address();
            long end = range.end().address();

            if (start > lineEnd || end < lineStart) {
                continue;
            }

            // Pieces of the range on other lines are dropped.
            int firstCol = start < lineStart ? 0 : (int) (start - lineStart);

            int hintCol = firstCol;
            if (hintCol < prevHintEndCol) {
                hintCol = prevHintEndCol + 1;
            }

            String text = fixIt.text();
            int lastColumnModified = hintCol + text.length();
            while (fixItLine.length() < lastColumnModified) {
                fixItLine.append(' ');
            }
            fixItLine.replace(hintCol, lastColumnModified, text);

            prevHintEndCol = lastColumnModified;

            int lastCol = end >= lineEnd ? numColumns : (int) (end - lineStart);
            if (lastCol > firstCol) {
                Arrays.fill(caretLine, firstCol, lastCol, '~');
            }
        }
    }

    /**
     * Expands tabs in a source line to spaces up to the next tab stop.
     * @param line The source line.
     * @return The expanded line.
     */
    public static String expandSourceLine(String line) {
        StringBuilder out = new StringBuilder(line.length());
        int outCol = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c != '\t') {
                out.append(c);
                outCol++;
                continue;
            }
            // At least one space, then round up to the tab stop.
            do {
                out.append(' ');
                outCol++;
            } while (outCol % TAB_STOP != 0);
        }
        return out.toString();
    }

    /**
     * Expands a caret line under a source line: where the source has a tab, the caret
     * line character in that column is repeated up to the next tab stop.
     */
    static String expandCaretLine(String caretLine, String sourceLine) {
        StringBuilder out = new StringBuilder(caretLine.length());
        int outCol = 0;
        for (int i = 0; i < caretLine.length(); i++) {
            char c = caretLine.charAt(i);
            if (i >= sourceLine.length() || sourceLine.charAt(i) != '\t') {
                out.append(c);
                outCol++;
                continue;
            }
            do {
                out.append(c);
                outCol++;
            } while (outCol % TAB_STOP != 0);
        }
        return out.toString();
    }

    /**
     * Expands a fix-it line under a source line. Inside a tab run, non-space fix-it
     * characters are consumed one per output column so replacement text is not
     * stretched; spaces are repeated up to the tab stop.
     */
    static String expandFixItLine(String fixItLine, String sourceLine) {
        StringBuilder out = new StringBuilder(fixItLine.length());
        int e = fixItLine.length();
        int outCol = 0;
        for (int i = 0; i < e; i++) {
            if (i >= sourceLine.length() || sourceLine.charAt(i) != '\t') {
                out.append(fixItLine.charAt(i));
                outCol++;
                continue;
            }
            // TODO: adjacent replacements, or replacements containing a space, lose tab alignment here; needs a per-column width map.
            do {
                out.append(fixItLine.charAt(i));
                if (fixItLine.charAt(i) != ' ') {
                    i++;
                }
                outCol++;
            } while (outCol % TAB_STOP != 0 && i < e);
        }
        return out.toString();
    }

    private static String trimTrailingSpaces(char[] line) {
        int end = line.length;
        while (end > 0 && line[end - 1] == ' ') {
            end--;
        }
        return new String(line, 0, end);
    }

    private static boolean containsNonAscii(String line) {
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) > 0x7F) {
                return true;
            }
        }
        return false;
    }
}
