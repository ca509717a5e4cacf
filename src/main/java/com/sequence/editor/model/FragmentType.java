package com.sequence.editor.model;

import java.util.Arrays;
import java.util.Optional;

public enum FragmentType {
    ALT("alt"),
    LOOP("loop"),
    OPT("opt"),
    PAR("par"),
    BREAK("break"),
    CRITICAL("critical"),
    REF("ref"),
    SEQ("seq"),
    STRICT("strict"),
    NEG("neg"),
    IGNORE("ignore"),
    CONSIDER("consider"),
    ASSERT("assert"),
    REGION("region"),
    GROUP("group"),
    EXPANDABLE("expandable");

    private final String keyword;

    FragmentType(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static Optional<FragmentType> fromKeyword(String keyword) {
        return Arrays.stream(values()).filter(t -> t.keyword.equals(keyword)).findFirst();
    }
}
