package com.sequence.editor.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Options of the "check" command.
 */
@Getter
public class CheckOptions {

    @Parameters(index = "0", paramLabel = "FILE", description = "Diagram source to check")
    private Path input;

    @Option(names = {"--charset"}, defaultValue = "UTF-8", description = "Charset of the input file (default: UTF-8)")
    private String charset;

    @Option(names = {"--message-spacing"}, description = "Base vertical distance between messages for the layout summary (default: 50)")
    private Double messageSpacing;

    @Option(names = {"--layout"}, description = "Print the computed geometry of every node")
    private boolean printLayout;
}
