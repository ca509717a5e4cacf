package com.sequence.editor.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A comment line. {@code text} is the trimmed line including its {@code //} or {@code #} marker.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class CommentNode extends DiagramNode {
    private final String text;

    @Builder
    public CommentNode(String id, int sourceLineStart, int sourceLineEnd, String text) {
        super(id, sourceLineStart, sourceLineEnd);
        this.text = text != null ? text : "";
    }

    @Override
    public NodeType getType() {
        return NodeType.COMMENT;
    }

    @Override
    public <R> R accept(DiagramNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
