package com.sequence.editor.model;

import java.util.Arrays;
import java.util.Optional;

public enum NoteType {
    NOTE("note", StyleTarget.NOTE),
    BOX("box", StyleTarget.BOX),
    ABOX("abox", StyleTarget.ABOX),
    RBOX("rbox", StyleTarget.RBOX),
    REF("ref", StyleTarget.REF),
    STATE("state", StyleTarget.STATE);

    private final String keyword;
    private final StyleTarget styleTarget;

    NoteType(String keyword, StyleTarget styleTarget) {
        this.keyword = keyword;
        this.styleTarget = styleTarget;
    }

    public String keyword() {
        return keyword;
    }

    public StyleTarget styleTarget() {
        return styleTarget;
    }

    public static Optional<NoteType> fromKeyword(String keyword) {
        return Arrays.stream(values()).filter(t -> t.keyword.equals(keyword)).findFirst();
    }
}
