package com.sequence.editor.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Participant shapes. Icon kinds carry an icon code, {@link #IMAGE} carries image data.
 */
public enum ParticipantType {
    PARTICIPANT("participant"),
    RPARTICIPANT("rparticipant"),
    ACTOR("actor"),
    DATABASE("database"),
    BOUNDARY("boundary"),
    CONTROL("control"),
    ENTITY("entity"),
    FONTAWESOME6SOLID("fontawesome6solid"),
    FONTAWESOME6REGULAR("fontawesome6regular"),
    FONTAWESOME6BRANDS("fontawesome6brands"),
    MDI("mdi"),
    IMAGE("image");

    private final String keyword;

    ParticipantType(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public boolean isIcon() {
        return this == FONTAWESOME6SOLID || this == FONTAWESOME6REGULAR
                || this == FONTAWESOME6BRANDS || this == MDI;
    }

    public static Optional<ParticipantType> fromKeyword(String keyword) {
        return Arrays.stream(values()).filter(t -> t.keyword.equals(keyword)).findFirst();
    }
}
