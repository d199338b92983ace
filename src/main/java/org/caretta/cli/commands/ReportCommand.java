package org.caretta.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.caretta.cli.CommandLineInterface;
import org.caretta.cli.TerminalColors;
import org.caretta.config.DiagnosticOptions;
import org.caretta.config.DiagnosticOptions.ColorMode;
import org.caretta.diagnostics.Diagnostic;
import org.caretta.diagnostics.DiagnosticKind;
import org.caretta.diagnostics.FixIt;
import org.caretta.diagnostics.render.AnsiOutputSink;
import org.caretta.source.BufferRegistry;
import org.caretta.source.SourceBuffer;
import org.caretta.source.SourceLocation;
import org.caretta.source.SourceRange;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

@Command(name = "report", description = "Renders a diagnostic at a byte offset, with optional ranges and fix-its.")
public class ReportCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Mixin
    private SourceOptions source;

    @Option(names = {"-o", "--offset"}, required = true, description = "Byte offset of the diagnostic in the (innermost) file.")
    private int offset;

    @Option(names = {"-k", "--kind"}, defaultValue = "error", description = "error, warning, note or remark (default: ${DEFAULT-VALUE}).")
    private String kind;

    @Option(names = {"-m", "--message"}, required = true, description = "The diagnostic message.")
    private String message;

    @Option(names = {"-r", "--range"}, paramLabel = "START:END", description = "Byte range to underline (repeatable).")
    private List<String> ranges = new ArrayList<>();

    @Option(names = {"-x", "--fix-it"}, paramLabel = "START:END=TEXT", description = "Replace START:END with TEXT (repeatable).")
    private List<String> fixIts = new ArrayList<>();

    @Option(names = "--color", paramLabel = "MODE", description = "auto, always or never (default: from configuration).")
    private String color;

    @Option(names = "--format", defaultValue = "text", description = "text or json (default: ${DEFAULT-VALUE}).")
    private String format;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        DiagnosticOptions options = parent.getDiagnosticOptions().withLeadingIncludeDirectories(source.includeDirectories);
        BufferRegistry registry = new BufferRegistry(options.createRenderer());
        registry.setIncludeDirectories(options.includeDirectories());

        Diagnostic diagnostic;
        boolean json;
        try {
            json = parseFormat(format);
            if (color != null) {
                options = options.withColorMode(ColorMode.parse(color));
            }
            SourceBuffer buffer = registry.getBuffer(source.load(registry));
            SourceLocation location = SourceOptions.locationIn(buffer, offset);
            diagnostic = registry.buildDiagnostic(location, parseKind(kind), message,
                    parseRanges(buffer), parseFixIts(buffer));
        } catch (IOException | IllegalArgumentException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        }

        PrintWriter out = spec.commandLine().getOut();
        if (json) {
            Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
            out.println(gson.toJson(diagnostic));
        } else {
            boolean showColors = options.useColors(TerminalColors::isSupported);
            registry.printMessage(new AnsiOutputSink(out, showColors), diagnostic, showColors);
        }
        out.flush();
        return 0;
    }

    private static boolean parseFormat(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "text" -> false;
            case "json" -> true;
            default -> throw new IllegalArgumentException("Unknown format '" + value + "', expected text or json");
        };
    }

    private static DiagnosticKind parseKind(String value) {
        try {
            return DiagnosticKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown kind '" + value + "', expected error, warning, note or remark", e);
        }
    }

    private List<SourceRange> parseRanges(SourceBuffer buffer) {
        List<SourceRange> result = new ArrayList<>();
        for (String range : ranges) {
            result.add(parseRange(buffer, range));
        }
        return result;
    }

    private List<FixIt> parseFixIts(SourceBuffer buffer) {
        List<FixIt> result = new ArrayList<>();
        for (String fixIt : fixIts) {
            int equals = fixIt.indexOf('=');
            if (equals < 0) {
                throw new IllegalArgumentException("Invalid fix-it '" + fixIt + "', expected START:END=TEXT");
            }
            result.add(FixIt.replacement(parseRange(buffer, fixIt.substring(0, equals)), fixIt.substring(equals + 1)));
        }
        return result;
    }

    private static SourceRange parseRange(SourceBuffer buffer, String text) {
        String[] parts = text.split(":", -1);
        if (parts.length != 2) {
            throw new IllegalArgumentException("Invalid range '" + text + "', expected START:END");
        }
        int start = SourceOptions.parseOffset(parts[0]);
        int end = SourceOptions.parseOffset(parts[1]);
        if (end < start) {
            throw new IllegalArgumentException("Invalid range '" + text + "': end before start");
        }
        return new SourceRange(SourceOptions.locationIn(buffer, start), SourceOptions.locationIn(buffer, end));
    }
}
