package com.sequence.editor.model;

/**
 * Variant tag of a {@link DiagramNode}.
 */
public enum NodeType {
    PARTICIPANT,
    MESSAGE,
    FRAGMENT,
    PARTICIPANT_GROUP,
    NOTE,
    DIVIDER,
    COMMENT,
    BLANKLINE,
    DIRECTIVE,
    ERROR
}
