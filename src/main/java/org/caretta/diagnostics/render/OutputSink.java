package org.caretta.diagnostics.render;

/**
 * Destination for rendered diagnostics.
 */
public interface OutputSink {

    /**
     * Appends text.
     * @param text The text.
     * @return This sink.
     */
    OutputSink append(CharSequence text);

    /**
     * Appends a single character.
     * @param c The character.
     * @return This sink.
     */
    default OutputSink append(char c) {
        return append(String.valueOf(c));
    }

    /**
     * @return {@code true} if color changes have a visible effect on this sink.
     */
    boolean hasColors();

    /**
     * Switches the color of subsequent text.
     * @param color The color.
     * @param bold Whether to use bold weight.
     */
    void changeColor(TerminalColor color, boolean bold);

    /**
     * Restores default color and weight.
     */
    void resetColor();
}
