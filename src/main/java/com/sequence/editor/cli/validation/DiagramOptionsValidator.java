package com.sequence.editor.cli.validation;

import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.sequence.editor.cli.exception.OptionsValidationException;
import com.sequence.editor.cli.model.CheckOptions;
import com.sequence.editor.cli.model.FormatOptions;
import com.sequence.editor.cli.model.ValidatedOptions;

public class DiagramOptionsValidator {

    public ValidatedOptions validate(FormatOptions o) {
        List<String> errors = new ArrayList<>();

        checkInput(o.getInput(), errors);
        Charset charset = parseCharset(o.getCharset(), errors);

        if (o.isInPlace() && o.getOutput() != null) {
            errors.add("--in-place and --output cannot be used together.");
        }
        if (o.getOutput() != null) {
            Path parent = o.getOutput().toAbsolutePath().getParent();
            if (parent != null && !Files.isDirectory(parent)) {
                errors.add("Output directory does not exist: " + parent);
            }
        }

        if (!errors.isEmpty()) {
            throw new OptionsValidationException("format", errors);
        }

        Path target = o.isInPlace() ? o.getInput() : o.getOutput();
        return new ValidatedOptions(o.getInput(), target, charset);
    }

    public ValidatedOptions validate(CheckOptions o) {
        List<String> errors = new ArrayList<>();

        checkInput(o.getInput(), errors);
        Charset charset = parseCharset(o.getCharset(), errors);

        if (o.getMessageSpacing() != null && o.getMessageSpacing() <= 0) {
            errors.add("Message spacing must be > 0. Got: " + o.getMessageSpacing());
        }

        if (!errors.isEmpty()) {
            throw new OptionsValidationException("check", errors);
        }
        return new ValidatedOptions(o.getInput(), null, charset);
    }

    private static void checkInput(Path input, List<String> errors) {
        if (input == null) {
            errors.add("An input file is required.");
        } else if (!Files.isRegularFile(input)) {
            errors.add("Input file does not exist or is not a regular file: " + input);
        }
    }

    private static Charset parseCharset(String name, List<String> errors) {
        try {
            return Charset.forName(name);
        } catch (IllegalArgumentException e) {
            errors.add("Unsupported charset: " + name);
            return null;
        }
    }
}
