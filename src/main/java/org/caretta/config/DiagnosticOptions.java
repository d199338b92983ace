package org.caretta.config;

import com.typesafe.config.Config;
import org.caretta.diagnostics.render.DiagnosticRenderer;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

/**
 * Rendering and include-search settings, read from the {@code caretta} configuration block.
 *
 * @param colorMode When to use colors.
 * @param showKindLabel Whether to print the severity label.
 * @param programName Prefix for every diagnostic, empty for none.
 * @param includeDirectories Directories searched for include files, in order.
 */
public record DiagnosticOptions(
        ColorMode colorMode,
        boolean showKindLabel,
        String programName,
        List<Path> includeDirectories
) {

    /**
     * When colored output is used.
     */
    public enum ColorMode {
        /** Use colors if the terminal supports them. */
        AUTO,
        /** Always emit color sequences. */
        ALWAYS,
        /** Never emit color sequences. */
        NEVER;

        /**
         * @param value {@code auto}, {@code always} or {@code never}, case-insensitive.
         * @return The mode.
         */
        public static ColorMode parse(String value) {
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown color mode '" + value + "', expected auto, always or never", e);
            }
        }
    }

    public DiagnosticOptions {
        includeDirectories = List.copyOf(includeDirectories);
    }

    /**
     * Reads the options from {@code caretta.diagnostics} and {@code caretta.include-directories}.
     *
     * @param config A resolved configuration including the reference defaults.
     * @return The options.
     */
    public static DiagnosticOptions fromConfig(Config config) {
        Config diagnostics = config.getConfig("caretta.diagnostics");
        List<Path> includeDirectories = config.getStringList("caretta.include-directories").stream()
                .map(Path::of)
                .collect(Collectors.toList());
        return new DiagnosticOptions(
                ColorMode.parse(diagnostics.getString("show-colors")),
                diagnostics.getBoolean("show-kind-label"),
                diagnostics.getString("program-name"),
                includeDirectories);
    }

    /**
     * @return A renderer configured with these options.
     */
    public DiagnosticRenderer createRenderer() {
        return new DiagnosticRenderer(programName, showKindLabel);
    }

    /**
     * @param terminalSupportsColors Asked only in {@link ColorMode#AUTO} mode.
     * @return Whether colors should be used.
     */
    public boolean useColors(BooleanSupplier terminalSupportsColors) {
        return switch (colorMode) {
            case ALWAYS -> true;
            case NEVER -> false;
            case AUTO -> terminalSupportsColors.getAsBoolean();
        };
    }

    /**
     * @param mode The color mode to use instead of the configured one.
     * @return A copy with the given color mode.
     */
    public DiagnosticOptions withColorMode(ColorMode mode) {
        return new DiagnosticOptions(mode, showKindLabel, programName, includeDirectories);
    }

    /**
     * @param directories Directories to search before the configured ones.
     * @return A copy with the given directories prepended.
     */
    public DiagnosticOptions withLeadingIncludeDirectories(List<Path> directories) {
        List<Path> merged = new ArrayList<>(directories);
        merged.addAll(includeDirectories);
        return new DiagnosticOptions(colorMode, showKindLabel, programName, merged);
    }
}
