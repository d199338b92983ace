package org.caretta.diagnostics.render;

/**
 * Colors an {@link OutputSink} can switch to. {@link #SAVED} keeps the current
 * foreground color and only changes the weight.
 */
public enum TerminalColor {
    BLACK(30),
    RED(31),
    GREEN(32),
    YELLOW(33),
    BLUE(34),
    MAGENTA(35),
    CYAN(36),
    WHITE(37),
    SAVED(-1);

    private final int ansiCode;

    TerminalColor(int ansiCode) {
        this.ansiCode = ansiCode;
    }

    /**
     * @return The ANSI SGR foreground code, or -1 for {@link #SAVED}.
     */
    public int ansiCode() {
        return ansiCode;
    }
}
