package com.sequence.editor.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A message between two participants, e.g. {@code A->(2)B:label}.
 * {@code from} may be {@code [} and {@code to} may be {@code ]} for messages
 * entering or leaving the diagram boundary.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class MessageNode extends DiagramNode {
    public static final String LEFT_BOUNDARY = "[";
    public static final String RIGHT_BOUNDARY = "]";

    private final String from;
    private final String to;
    private final ArrowType arrowType;
    private final Integer delay;
    private final boolean create;
    private final Style style;
    private final String label;

    @Builder
    public MessageNode(String id, int sourceLineStart, int sourceLineEnd,
                       String from, String to, ArrowType arrowType, Integer delay,
                       boolean create, Style style, String label) {
        super(id, sourceLineStart, sourceLineEnd);
        this.from = from;
        this.to = to;
        this.arrowType = arrowType != null ? arrowType : ArrowType.SYNC;
        this.delay = delay;
        this.create = create;
        this.style = Style.orEmpty(style);
        this.label = label != null ? label : "";
    }

    public boolean isBoundary() {
        return LEFT_BOUNDARY.equals(from) || RIGHT_BOUNDARY.equals(to);
    }

    public boolean isSelf() {
        return from != null && from.equals(to);
    }

    public int delayOrZero() {
        return delay != null ? delay : 0;
    }

    @Override
    public NodeType getType() {
        return NodeType.MESSAGE;
    }

    @Override
    public <R> R accept(DiagramNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
