package com.sequence.editor.model;

public enum ErrorKind {
    UNRECOGNIZED_SYNTAX,
    UNTERMINATED_BLOCK,
    UNEXPECTED_TERMINATOR
}
