package com.sequence.editor.cli;

import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Root command. Does nothing on its own besides printing usage.
 */
@Command(
        name = "seqdiag",
        mixinStandardHelpOptions = true,
        version = "seqdiag 1.0.0",
        description = "Formats and checks sequence diagram sources.",
        subcommands = {FormatCommand.class, CheckCommand.class}
)
public class DiagramCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return ExitCodes.USAGE;
    }
}
