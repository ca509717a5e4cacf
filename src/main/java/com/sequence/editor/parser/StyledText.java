package com.sequence.editor.parser;

/**
 * Leading style text of a line and the free text that follows it.
 */
public record StyledText(String style, String text) {

    public boolean hasStyle() {
        return !style.isEmpty();
    }
}
