package com.sequence.editor.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Structural error: a line no grammar accepted, a block without {@code end},
 * or a stray {@code else}/{@code end}.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class ErrorNode extends DiagramNode {
    private final String text;
    private final String message;
    private final ErrorKind errorKind;

    @Builder
    public ErrorNode(String id, int sourceLineStart, int sourceLineEnd,
                     String text, String message, ErrorKind errorKind) {
        super(id, sourceLineStart, sourceLineEnd);
        this.text = text != null ? text : "";
        this.message = message;
        this.errorKind = errorKind != null ? errorKind : ErrorKind.UNRECOGNIZED_SYNTAX;
    }

    @Override
    public NodeType getType() {
        return NodeType.ERROR;
    }

    @Override
    public <R> R accept(DiagramNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
