package com.sequence.editor.parser;

import java.util.concurrent.atomic.AtomicLong;

import com.sequence.editor.model.NodeType;

/**
 * Hands out node ids of the form {@code <prefix>_<n>}. One generator is owned
 * by each {@link DiagramParser}; ids are never reused by the same generator.
 */
public class NodeIdGenerator {
    private final AtomicLong counter = new AtomicLong();

    public String next(NodeType type) {
        return prefix(type) + "_" + counter.incrementAndGet();
    }

    static String prefix(NodeType type) {
        return switch (type) {
            case PARTICIPANT -> "p";
            case MESSAGE -> "m";
            case FRAGMENT -> "f";
            case PARTICIPANT_GROUP -> "pg";
            case NOTE -> "n";
            case DIVIDER -> "div";
            case COMMENT -> "c";
            case BLANKLINE -> "bl";
            case DIRECTIVE -> "d";
            case ERROR -> "e";
        };
    }
}
