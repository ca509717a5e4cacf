package com.sequence.editor.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of document directives. {@link #TYPE_STYLE} has no single keyword;
 * its keyword comes from the {@link StyleTarget} it defines.
 */
public enum DirectiveType {
    TITLE("title"),
    ENTRY_SPACING("entryspacing"),
    AUTONUMBER("autonumber"),
    SPACE("space"),
    PARTICIPANT_SPACING("participantspacing"),
    LIFELINE_STYLE("lifelinestyle"),
    LINEAR("linear"),
    PARALLEL("parallel"),
    BOTTOM_PARTICIPANTS("bottomparticipants"),
    FONT_FAMILY("fontfamily"),
    FRAME("frame"),
    DESTROY("destroy"),
    DESTROY_AFTER("destroyafter"),
    DESTROY_SILENT("destroysilent"),
    ACTIVATE("activate"),
    DEACTIVATE("deactivate"),
    DEACTIVATE_AFTER("deactivateafter"),
    AUTO_ACTIVATION("autoactivation"),
    ACTIVE_COLOR("activecolor"),
    NAMED_STYLE("style"),
    TYPE_STYLE(null);

    private final String keyword;

    DirectiveType(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public boolean isLifecycle() {
        return this == DESTROY || this == DESTROY_AFTER || this == DESTROY_SILENT;
    }

    public boolean isActivation() {
        return this == ACTIVATE || this == DEACTIVATE || this == DEACTIVATE_AFTER;
    }

    public static Optional<DirectiveType> fromKeyword(String keyword) {
        return Arrays.stream(values())
                .filter(t -> t.keyword != null && t.keyword.equals(keyword))
                .findFirst();
    }
}
