package com.sequence.editor.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A participant declaration such as {@code actor "End User" as User #lightblue}.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class ParticipantNode extends DiagramNode {
    private final ParticipantType participantType;
    private final String alias;
    private final String displayName;
    private final String iconCode;
    @ToString.Exclude
    private final String imageData;
    private final Style style;

    @Builder
    public ParticipantNode(String id, int sourceLineStart, int sourceLineEnd,
                           ParticipantType participantType, String alias, String displayName,
                           String iconCode, String imageData, Style style) {
        super(id, sourceLineStart, sourceLineEnd);
        this.participantType = participantType != null ? participantType : ParticipantType.PARTICIPANT;
        this.alias = alias;
        this.displayName = displayName != null ? displayName : alias;
        this.iconCode = iconCode;
        this.imageData = imageData;
        this.style = Style.orEmpty(style);
    }

    public boolean hasDistinctDisplayName() {
        return !displayName.equals(alias);
    }

    @Override
    public NodeType getType() {
        return NodeType.PARTICIPANT;
    }

    @Override
    public <R> R accept(DiagramNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
