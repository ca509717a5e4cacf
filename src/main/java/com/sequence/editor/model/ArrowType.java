package com.sequence.editor.model;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Closed catalogue of message arrows.
 *
 * When a message carries an inline style the literal is split into a prefix
 * and a suffix around the bracketed style, e.g. {@code A-[#red]->B} or
 * {@code A<-[#red]-B}. The split point is fixed per arrow kind.
 */
public enum ArrowType {
    SYNC("->", "-", "->"),
    ASYNC("->>", "-", "->>"),
    DASHED("-->", "-", "-->"),
    DASHED_ASYNC("-->>", "-", "-->>"),
    REVERSE("<-", "<-", "-"),
    REVERSE_DASHED("<--", "<-", "--"),
    BIDIRECTIONAL("<->", "<-", "->"),
    BIDIRECTIONAL_ASYNC("<->>", "<-", "->>"),
    BIDIRECTIONAL_DASHED_ASYNC("<-->>", "<-", "-->>"),
    LOST("-x", "-", "-x"),
    DASHED_LOST("--x", "-", "--x");

    private static final List<ArrowType> BY_LITERAL_LENGTH = Arrays.stream(values())
            .sorted(Comparator.comparingInt((ArrowType a) -> a.literal.length()).reversed())
            .toList();

    private static final List<ArrowType> BY_SUFFIX_LENGTH = Arrays.stream(values())
            .sorted(Comparator.comparingInt((ArrowType a) -> a.styleSuffix.length()).reversed())
            .toList();

    private final String literal;
    private final String stylePrefix;
    private final String styleSuffix;

    ArrowType(String literal, String stylePrefix, String styleSuffix) {
        this.literal = literal;
        this.stylePrefix = stylePrefix;
        this.styleSuffix = styleSuffix;
    }

    public String literal() {
        return literal;
    }

    public String stylePrefix() {
        return stylePrefix;
    }

    public String styleSuffix() {
        return styleSuffix;
    }

    /**
     * Rebuilds the arrow with an inline style between prefix and suffix.
     */
    public String styledLiteral(String styleSpec) {
        return stylePrefix + "[" + styleSpec + "]" + styleSuffix;
    }

    public boolean isDashed() {
        return literal.contains("--");
    }

    public boolean isReversed() {
        return this == REVERSE || this == REVERSE_DASHED;
    }

    public boolean isBidirectional() {
        return literal.startsWith("<") && literal.endsWith(">");
    }

    public boolean isLost() {
        return literal.endsWith("x");
    }

    public static Optional<ArrowType> fromLiteral(String literal) {
        return Arrays.stream(values()).filter(a -> a.literal.equals(literal)).findFirst();
    }

    /**
     * Arrows ordered longest literal first, so {@code -->>} is tried before {@code -->}.
     */
    public static List<ArrowType> byLiteralLength() {
        return BY_LITERAL_LENGTH;
    }

    /**
     * Arrows ordered longest style suffix first.
     */
    public static List<ArrowType> byStyleSuffixLength() {
        return BY_SUFFIX_LENGTH;
    }
}
