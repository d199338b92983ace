package org.caretta.cli.commands;

import org.caretta.cli.CommandLineInterface;
import org.caretta.io.SourceLoader;
import org.caretta.source.BufferRegistry;
import org.caretta.source.SourceLine;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.util.concurrent.Callable;

@Command(name = "line", description = "Prints a line of a file by its 1-based number.")
public class LineCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = {"-f", "--file"}, required = true, description = "The source file, or '-' for standard input.")
    private String file;

    @Option(names = {"-n", "--line"}, required = true, description = "The 1-based line number.")
    private int lineNumber;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        parent.getConfig();
        if (lineNumber < 1) {
            spec.commandLine().getErr().println("Error: line numbers start at 1, got " + lineNumber);
            return 1;
        }

        BufferRegistry registry = new BufferRegistry();
        int bufferId;
        try {
            bufferId = registry.addBuffer(SourceLoader.load(file));
        } catch (IOException e) {
            spec.commandLine().getErr().println("Error: cannot read '" + file + "': " + e.getMessage());
            return 1;
        }

        SourceLine line = registry.getLineRef(lineNumber, bufferId);
        spec.commandLine().getOut().println(LocateCommand.stripLineBreak(line.text()));
        return 0;
    }
}
