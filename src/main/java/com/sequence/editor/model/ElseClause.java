package com.sequence.editor.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * An {@code else} section of a fragment. Entries are ids of nodes in the document.
 */
@Value
@Builder
public class ElseClause {
    String condition;
    Style style;
    @Singular
    List<String> entries;

    public String getCondition() {
        return condition != null ? condition : "";
    }

    public Style getStyle() {
        return Style.orEmpty(style);
    }
}
