package com.sequence.editor.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Node kinds that accept a type style definition ({@code participantstyle}, {@code notestyle}, ...).
 */
public enum StyleTarget {
    PARTICIPANT("participantstyle"),
    MESSAGE("messagestyle"),
    NOTE("notestyle"),
    DIVIDER("dividerstyle"),
    BOX("boxstyle"),
    ABOX("aboxstyle"),
    ABOX_LEFT("aboxleftstyle"),
    ABOX_RIGHT("aboxrightstyle"),
    RBOX("rboxstyle"),
    REF("refstyle"),
    STATE("statestyle"),
    FRAGMENT("fragmentstyle");

    private final String keyword;

    StyleTarget(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static Optional<StyleTarget> fromKeyword(String keyword) {
        return Arrays.stream(values()).filter(t -> t.keyword.equals(keyword)).findFirst();
    }
}
