package com.sequence.editor.parser;

/**
 * Raised by the line grammars when a line was recognized by its keyword but
 * its payload is malformed. The parser turns it into an error node.
 */
public class DiagramSyntaxException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public DiagramSyntaxException(String message) {
        super(message);
    }

    public DiagramSyntaxException(String message, Throwable cause) {
        super(message, cause);
    }
}
