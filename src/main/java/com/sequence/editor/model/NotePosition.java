package com.sequence.editor.model;

import java.util.Arrays;
import java.util.Optional;

public enum NotePosition {
    OVER("over"),
    LEFT_OF("left of"),
    RIGHT_OF("right of");

    private final String keyword;

    NotePosition(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static Optional<NotePosition> fromKeyword(String keyword) {
        return Arrays.stream(values()).filter(p -> p.keyword.equals(keyword)).findFirst();
    }
}
