package org.caretta.cli.commands;

import org.caretta.cli.CommandLineInterface;
import org.caretta.config.DiagnosticOptions;
import org.caretta.source.BufferRegistry;
import org.caretta.source.LineAndColumn;
import org.caretta.source.SourceBuffer;
import org.caretta.source.SourceLine;
import org.caretta.source.SourceLocation;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "locate", description = "Prints FILE:LINE:COLUMN and the line text for a byte offset.")
public class LocateCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Mixin
    private SourceOptions source;

    @Option(names = {"-o", "--offset"}, required = true, description = "Byte offset in the (innermost) file.")
    private int offset;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        BufferRegistry registry = new BufferRegistry();
        DiagnosticOptions options = parent.getDiagnosticOptions().withLeadingIncludeDirectories(source.includeDirectories);
        registry.setIncludeDirectories(options.includeDirectories());

        SourceBuffer buffer;
        SourceLocation location;
        try {
            buffer = registry.getBuffer(source.load(registry));
            location = SourceOptions.locationIn(buffer, offset);
        } catch (IOException | IllegalArgumentException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        }

        LineAndColumn lineAndColumn = registry.getLineAndColumn(location, buffer.id());
        SourceLine line = registry.findLine(location, buffer.id());

        PrintWriter out = spec.commandLine().getOut();
        out.println(buffer.identifier() + ":" + lineAndColumn);
        out.println(stripLineBreak(line.text()));
        return 0;
    }

    static String stripLineBreak(String text) {
        int end = text.length();
        while (end > 0 && (text.charAt(end - 1) == '\n' || text.charAt(end - 1) == '\r')) {
            end--;
        }
        return text.substring(0, end);
    }
}
