package com.sequence.editor.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sequence.editor.cli.exception.OptionsValidationException;
import com.sequence.editor.cli.model.FormatOptions;
import com.sequence.editor.cli.model.ValidatedOptions;
import com.sequence.editor.cli.output.DiagramResultsPrinter;
import com.sequence.editor.cli.validation.DiagramOptionsValidator;
import com.sequence.editor.model.DiagramDocument;
import com.sequence.editor.parser.DiagramParser;
import com.sequence.editor.serializer.DiagramSerializer;
import com.sequence.editor.serializer.StructuralSignatureCalculator;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Rewrites a diagram source in canonical form.
 *
 * Unparseable lines would come back as comments, so a diagram with errors is
 * only formatted when {@code --allow-errors} is given.
 */
@Command(
        name = "format",
        mixinStandardHelpOptions = true,
        description = "Prints a diagram source in canonical form, or rewrites the file with --in-place."
)
public class FormatCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(FormatCommand.class);

    @Mixin
    private FormatOptions options;

    @Spec
    private CommandSpec spec;

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
            if (document.hasErrors()) {
                printer.printErrors(validated.getInput(), document);
                if (!options.isAllowErrors()) {
                    log.error("Not formatting {}: fix the errors above or pass --allow-errors", validated.getInput());
                    return ExitCodes.FAILURE;
                }
            }

            String formatted = new DiagramSerializer().serialize(document);
            if (!document.hasErrors() && !preservesStructure(document, formatted)) {
                log.warn("Canonical form of {} does not parse back to the same diagram", validated.getInput());
            }
            if (!formatted.isEmpty() && !formatted.endsWith("\n")) {
                formatted = formatted + "\n";
            }

            if (validated.getTarget() == null) {
                PrintWriter out = spec.commandLine().getOut();
                out.print(formatted);
                out.flush();
            } else {
                Files.writeString(validated.getTarget(), formatted, validated.getCharset());
                printer.printFormatted(validated.getInput(), validated.getTarget());
            }
            return ExitCodes.OK;
        } catch (IOException e) {
            log.error("Formatting failed for {}", validated.getInput(), e);
            return ExitCodes.FAILURE;
        }
    }

    private static boolean preservesStructure(DiagramDocument original, String formatted) {
        DiagramDocument reparsed = new DiagramParser().parse(formatted);
        return StructuralSignatureCalculator.calculateSignature(original)
                .equals(StructuralSignatureCalculator.calculateSignature(reparsed));
    }
}
