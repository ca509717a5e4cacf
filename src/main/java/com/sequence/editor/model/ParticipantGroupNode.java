package com.sequence.editor.model;

import java.util.List;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A {@code participantgroup} box around participants. Members are aliases,
 * nested groups are node ids.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class ParticipantGroupNode extends DiagramNode {
    private final String color;
    private final String label;
    private final List<String> participants;
    private final List<String> nestedGroups;

    @Builder
    public ParticipantGroupNode(String id, int sourceLineStart, int sourceLineEnd,
                                String color, String label,
                                List<String> participants, List<String> nestedGroups) {
        super(id, sourceLineStart, sourceLineEnd);
        this.color = color;
        this.label = label != null ? label : "";
        this.participants = participants != null ? List.copyOf(participants) : List.of();
        this.nestedGroups = nestedGroups != null ? List.copyOf(nestedGroups) : List.of();
    }

    @Override
    public NodeType getType() {
        return NodeType.PARTICIPANT_GROUP;
    }

    @Override
    public <R> R accept(DiagramNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
