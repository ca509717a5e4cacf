package com.sequence.editor.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class BlanklineNode extends DiagramNode {

    @Builder
    public BlanklineNode(String id, int sourceLineStart, int sourceLineEnd) {
        super(id, sourceLineStart, sourceLineEnd);
    }

    @Override
    public NodeType getType() {
        return NodeType.BLANKLINE;
    }

    @Override
    public <R> R accept(DiagramNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
