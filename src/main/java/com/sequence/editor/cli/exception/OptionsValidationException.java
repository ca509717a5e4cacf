package com.sequence.editor.cli.exception;

import java.util.List;

import lombok.Getter;

/**
 * Rejected command line options of one subcommand, with every problem found.
 */
@Getter
public class OptionsValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String command;
    private final List<String> errors;

    public OptionsValidationException(String command, List<String> errors) {
        super("Invalid options for '" + command + "': " + String.join("; ", errors));
        this.command = command;
        this.errors = List.copyOf(errors);
    }
}
