package com.sequence.editor;

import com.sequence.editor.cli.DiagramCommand;

import picocli.CommandLine;

/**
 * Main entry point for the {@code seqdiag} command line tool.
 * Formats sequence diagram sources and reports parse errors and layout statistics.
 */
public class DiagramApplication {

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    public static CommandLine createCommandLine() {
        return new CommandLine(new DiagramCommand())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }
}
