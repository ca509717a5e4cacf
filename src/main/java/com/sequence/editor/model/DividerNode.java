package com.sequence.editor.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class DividerNode extends DiagramNode {
    private final String text;
    private final Style style;

    @Builder
    public DividerNode(String id, int sourceLineStart, int sourceLineEnd, String text, Style style) {
        super(id, sourceLineStart, sourceLineEnd);
        this.text = text != null ? text : "";
        this.style = Style.orEmpty(style);
    }

    @Override
    public NodeType getType() {
        return NodeType.DIVIDER;
    }

    @Override
    public <R> R accept(DiagramNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
