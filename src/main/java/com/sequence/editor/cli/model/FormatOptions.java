package com.sequence.editor.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Options of the "format" command. Picocli fills the fields reflectively.
 */
@Getter
public class FormatOptions {

    @Parameters(index = "0", paramLabel = "FILE", description = "Diagram source to format")
    private Path input;

    @Option(names = {"--output", "-o"}, description = "Write the formatted diagram to this file instead of stdout")
    private Path output;

    @Option(names = {"--in-place", "-i"}, description = "Overwrite the input file with the formatted diagram")
    private boolean inPlace;

    @Option(names = {"--charset"}, defaultValue = "UTF-8", description = "Charset of the input and output files (default: UTF-8)")
    private String charset;

    @Option(names = {"--allow-errors"}, description = "Format even when the diagram contains unparseable lines")
    private boolean allowErrors;
}
