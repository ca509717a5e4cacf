package com.sequence.editor.parser;

import lombok.Value;

/**
 * One input line with its 1-based line number.
 */
@Value
public class SourceLine {
    int number;
    String raw;
    String trimmed;

    public static SourceLine of(int number, String raw) {
        String line = raw.endsWith("\r") ? raw.substring(0, raw.length() - 1) : raw;
        return new SourceLine(number, line, line.trim());
    }

    public boolean isBlank() {
        return trimmed.isEmpty();
    }

    public boolean isBlockEnd() {
        return trimmed.equals("end");
    }

    public boolean isElse() {
        return trimmed.equals("else") || (trimmed.startsWith("else") && Character.isWhitespace(trimmed.charAt(4)));
    }
}
