package org.caretta.diagnostics.render;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * An {@link OutputSink} over any {@link Appendable} that expresses colors as ANSI
 * escape sequences. With colors disabled, color calls write nothing.
 */
public class AnsiOutputSink implements OutputSink {

    private static final String ESC = "\u001B[";
    private static final String RESET = ESC + "0m";

    private final Appendable out;
    private final boolean colors;

    /**
     * @param out The target, e.g. {@code System.err} or a {@link StringBuilder}.
     * @param colors Whether to emit escape sequences.
     */
    public AnsiOutputSink(Appendable out, boolean colors) {
        this.out = Objects.requireNonNull(out, "out cannot be null");
        this.colors = colors;
    }

    /**
     * Creates a sink without colors, convenient for capturing output.
     * @param out The target.
     * @return The sink.
     */
    public static AnsiOutputSink plain(Appendable out) {
        return new AnsiOutputSink(out, false);
    }

    @Override
    public OutputSink append(CharSequence text) {
        try {
            out.append(text);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write diagnostic output", e);
        }
        return this;
    }

    @Override
    public boolean hasColors() {
        return colors;
    }

    @Override
    public void changeColor(TerminalColor color, boolean bold) {
        if (!colors) {
            return;
        }
        if (color == TerminalColor.SAVED) {
            append(bold ? ESC + "1m" : RESET);
        } else {
            append(ESC + (bold ? "1;" : "0;") + color.ansiCode() + "m");
        }
    }

    @Override
    public void resetColor() {
        if (colors) {
            append(RESET);
        }
    }
}
