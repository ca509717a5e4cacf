package com.sequence.editor.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A combined fragment ({@code alt}, {@code loop}, ...). Children are referenced by id.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class FragmentNode extends DiagramNode {
    private final FragmentType fragmentType;
    private final String condition;
    private final Style style;
    private final List<String> entries;
    private final List<ElseClause> elseClauses;
    /** Only set for {@link FragmentType#EXPANDABLE}. */
    private final Boolean collapsed;

    @Builder
    public FragmentNode(String id, int sourceLineStart, int sourceLineEnd,
                        FragmentType fragmentType, String condition, Style style,
                        List<String> entries, List<ElseClause> elseClauses, Boolean collapsed) {
        super(id, sourceLineStart, sourceLineEnd);
        this.fragmentType = fragmentType;
        this.condition = condition != null ? condition : "";
        this.style = Style.orEmpty(style);
        this.entries = entries != null ? List.copyOf(entries) : List.of();
        this.elseClauses = elseClauses != null ? List.copyOf(elseClauses) : List.of();
        this.collapsed = fragmentType == FragmentType.EXPANDABLE
                ? Boolean.valueOf(collapsed != null && collapsed)
                : null;
    }

    public boolean isCollapsed() {
        return Boolean.TRUE.equals(collapsed);
    }

    /**
     * All entry ids, main section first, then each else clause in order.
     */
    public List<String> getAllEntries() {
        List<String> all = new ArrayList<>(entries);
        for (ElseClause clause : elseClauses) {
            all.addAll(clause.getEntries());
        }
        return all;
    }

    /**
     * Structural copy with a different collapsed state. Other fragment kinds are returned unchanged.
     */
    public FragmentNode withCollapsed(boolean newCollapsed) {
        if (fragmentType != FragmentType.EXPANDABLE) {
            return this;
        }
        return FragmentNode.builder()
                .id(id)
                .sourceLineStart(sourceLineStart)
                .sourceLineEnd(sourceLineEnd)
                .fragmentType(fragmentType)
                .condition(condition)
                .style(style)
                .entries(entries)
                .elseClauses(elseClauses)
                .collapsed(newCollapsed)
                .build();
    }

    @Override
    public NodeType getType() {
        return NodeType.FRAGMENT;
    }

    @Override
    public <R> R accept(DiagramNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
