package com.sequence.editor.model;

import java.util.List;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class NoteNode extends DiagramNode {
    private final NoteType noteType;
    private final NotePosition position;
    private final List<String> participants;
    private final String text;
    private final Style style;

    @Builder
    public NoteNode(String id, int sourceLineStart, int sourceLineEnd,
                    NoteType noteType, NotePosition position, List<String> participants,
                    String text, Style style) {
        super(id, sourceLineStart, sourceLineEnd);
        this.noteType = noteType != null ? noteType : NoteType.NOTE;
        this.position = position != null ? position : NotePosition.OVER;
        this.participants = participants != null ? List.copyOf(participants) : List.of();
        this.text = text != null ? text : "";
        this.style = Style.orEmpty(style);
    }

    /**
     * Type style that applies to this note. An {@code abox} picks the left or
     * right variant when placed beside a participant.
     */
    public StyleTarget styleTarget() {
        if (noteType == NoteType.ABOX && position == NotePosition.LEFT_OF) {
            return StyleTarget.ABOX_LEFT;
        }
        if (noteType == NoteType.ABOX && position == NotePosition.RIGHT_OF) {
            return StyleTarget.ABOX_RIGHT;
        }
        return noteType.styleTarget();
    }

    @Override
    public NodeType getType() {
        return NodeType.NOTE;
    }

    @Override
    public <R> R accept(DiagramNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
