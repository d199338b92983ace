package org.caretta.cli;

import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.jline.utils.InfoCmp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Detects whether the process terminal can display colors.
 */
public final class TerminalColors {

    private static final Logger LOG = LoggerFactory.getLogger(TerminalColors.class);

    private TerminalColors() {}

    /**
     * @return {@code true} if the system terminal reports at least 8 colors.
     */
    public static boolean isSupported() {
        if (System.console() == null) {
            return false;
        }
        try (Terminal terminal = TerminalBuilder.builder().system(true).dumb(true).build()) {
            if (Terminal.TYPE_DUMB.equals(terminal.getType())) {
                return false;
            }
            Integer maxColors = terminal.getNumericCapability(InfoCmp.Capability.max_colors);
            return maxColors != null && maxColors >= 8;
        } catch (IOException e) {
            LOG.debug("Could not open system terminal, disabling colors: {}", e.getMessage());
            return false;
        }
    }
}
