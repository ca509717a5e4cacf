package com.sequence.editor.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sequence.editor.cli.exception.OptionsValidationException;
import com.sequence.editor.cli.model.CheckOptions;
import com.sequence.editor.cli.model.ValidatedOptions;
import com.sequence.editor.cli.output.DiagramResultsPrinter;
import com.sequence.editor.cli.validation.DiagramOptionsValidator;
import com.sequence.editor.layout.LayoutConfig;
import com.sequence.editor.layout.LayoutEngine;
import com.sequence.editor.layout.LayoutResult;
import com.sequence.editor.model.DiagramDocument;
import com.sequence.editor.parser.DiagramParser;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * Parses and lays out a diagram, reporting every error node. Exits with 1 when any exist.
 */
@Command(
        name = "check",
        mixinStandardHelpOptions = true,
        description = "Reports parse errors and a layout summary for a diagram source."
)
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    @Mixin
    private CheckOptions options;

    private final DiagramOptionsValidator validator = new DiagramOptionsValidator();
    private final DiagramResultsPrinter printer = new DiagramResultsPrinter();

    @Override
    public Integer call() {
        ValidatedOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error("{}: {}", e.getCommand(), error));
            return ExitCodes.USAGE;
        }

        try {
            String source = Files.readString(validated.getInput(), validated.getCharset());
            DiagramDocument document = new DiagramParser().parse(source);
            LayoutResult layout = new LayoutEngine(layoutConfig()).calculateLayout(document);

            printer.printErrors(validated.getInput(), document);
            printer.printSummary(validated.getInput(), document, layout);
            if (options.isPrintLayout()) {
                printer.printLayout(layout);
            }
            return document.hasErrors() ? ExitCodes.FAILURE : ExitCodes.OK;
        } catch (IOException e) {
            log.error("Check failed for {}", validated.getInput(), e);
            return ExitCodes.FAILURE;
        }
    }

    private LayoutConfig layoutConfig() {
        if (options.getMessageSpacing() == null) {
            return LayoutConfig.defaults();
        }
        return LayoutConfig.defaults().toBuilder()
                .messageSpacing(options.getMessageSpacing())
                .build();
    }
}
