package com.sequence.editor.cli.output;

import java.nio.file.Path;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sequence.editor.layout.LayoutResult;
import com.sequence.editor.layout.NodeGeometry;
import com.sequence.editor.model.DiagramDocument;
import com.sequence.editor.model.ErrorNode;
import com.sequence.editor.model.FragmentNode;
import com.sequence.editor.model.MessageNode;
import com.sequence.editor.model.NoteNode;

/**
 * Prints command results through the logger. Formatted diagrams are not
 * printed here; commands write them to their own output stream.
 */
public class DiagramResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(DiagramResultsPrinter.class);

    public void printErrors(Path input, DiagramDocument document) {
        for (ErrorNode error : document.getErrors()) {
            log.error("{}:{}: {}", input, error.getSourceLineStart(), error.getMessage());
        }
    }

    public void printSummary(Path input, DiagramDocument document, LayoutResult layout) {
        log.info("=================================================");
        log.info("Diagram: {}", input.toAbsolutePath());
        log.info("=================================================");
        log.info("Participants: {}", layout.getParticipantLayout().size());
        log.info("Messages: {}", document.nodesOfType(MessageNode.class).size());
        log.info("Fragments: {}", document.nodesOfType(FragmentNode.class).size());
        log.info("Notes: {}", document.nodesOfType(NoteNode.class).size());
        log.info("Activation Bars: {}", layout.getActivationBars().size());
        log.info("Total Height: {}", layout.getTotalHeight());
        log.info("Errors: {}", document.getErrors().size());
        log.info("=================================================");
    }

    public void printLayout(LayoutResult layout) {
        layout.getParticipantLayout().values().forEach(p -> log.info("  {}", p));
        for (Map.Entry<String, NodeGeometry> entry : layout.getLayout().entrySet()) {
            log.info("  {} -> {}", entry.getKey(), entry.getValue());
        }
    }

    public void printFormatted(Path input, Path target) {
        log.info("Formatted {} -> {}", input, target);
    }
}
