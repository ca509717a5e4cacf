package com.sequence.editor.serializer;

import com.sequence.editor.model.BlanklineNode;
import com.sequence.editor.model.CommentNode;
import com.sequence.editor.model.DiagramDocument;
import com.sequence.editor.model.DiagramNode;
import com.sequence.editor.model.DirectiveNode;
import com.sequence.editor.model.DividerNode;
import com.sequence.editor.model.ElseClause;
import com.sequence.editor.model.ErrorNode;
import com.sequence.editor.model.FragmentNode;
import com.sequence.editor.model.MessageNode;
import com.sequence.editor.model.NoteNode;
import com.sequence.editor.model.ParticipantGroupNode;
import com.sequence.editor.model.ParticipantNode;

/**
 * Calculates a structural signature for a diagram. Two documents with the same
 * nodes, fields and nesting have the same signature regardless of node ids and
 * source line numbers. Error nodes are left out.
 */
public class StructuralSignatureCalculator {

    public static String calculateSignature(DiagramDocument document) {
        StringBuilder sb = new StringBuilder();
        for (DiagramNode node : document.topLevelNodes()) {
            appendNodeSignature(sb, document, node, "");
        }
        return sb.toString();
    }

    private static void appendNodeSignature(StringBuilder sb, DiagramDocument document, DiagramNode node, String indent) {
        if (node instanceof ErrorNode) {
            return;
        }
        if (node instanceof FragmentNode fragment) {
            sb.append(indent).append("FRAGMENT:").append(fragment.getFragmentType())
                    .append(":COND=").append(fragment.getCondition())
                    .append(":STYLE=").append(fragment.getStyle())
                    .append(":COLLAPSED=").append(fragment.getCollapsed())
                    .append('\n');
            appendEntries(sb, document, fragment.getEntries(), indent + "  ");
            for (ElseClause clause : fragment.getElseClauses()) {
                sb.append(indent).append("ELSE:").append(clause.getCondition())
                        .append(":STYLE=").append(clause.getStyle())
                        .append('\n');
                appendEntries(sb, document, clause.getEntries(), indent + "  ");
            }
        } else if (node instanceof ParticipantGroupNode group) {
            sb.append(indent).append("GROUP:").append(group.getLabel())
                    .append(":COLOR=").append(group.getColor())
                    .append(":MEMBERS=").append(group.getParticipants())
                    .append('\n');
            appendEntries(sb, document, group.getNestedGroups(), indent + "  ");
        } else if (node instanceof ParticipantNode participant) {
            sb.append(indent).append("PARTICIPANT:").append(participant.getParticipantType())
                    .append(':').append(participant.getAlias())
                    .append(":NAME=").append(participant.getDisplayName())
                    .append(":ICON=").append(participant.getIconCode())
                    .append(":IMAGE=").append(participant.getImageData())
                    .append(":STYLE=").append(participant.getStyle())
                    .append('\n');
        } else if (node instanceof MessageNode message) {
            sb.append(indent).append("MESSAGE:").append(message.getFrom())
                    .append(':').append(message.getArrowType())
                    .append(':').append(message.getTo())
                    .append(":DELAY=").append(message.getDelay())
                    .append(":CREATE=").append(message.isCreate())
                    .append(":STYLE=").append(message.getStyle())
                    .append(":LABEL=").append(message.getLabel())
                    .append('\n');
        } else if (node instanceof NoteNode note) {
            sb.append(indent).append("NOTE:").append(note.getNoteType())
                    .append(':').append(note.getPosition())
                    .append(':').append(note.getParticipants())
                    .append(":STYLE=").append(note.getStyle())
                    .append(":TEXT=").append(note.getText())
                    .append('\n');
        } else if (node instanceof DividerNode divider) {
            sb.append(indent).append("DIVIDER:").append(divider.getText())
                    .append(":STYLE=").append(divider.getStyle())
                    .append('\n');
        } else if (node instanceof DirectiveNode directive) {
            sb.append(indent).append("DIRECTIVE:").append(directive.keyword())
                    .append(":TEXT=").append(directive.getText())
                    .append(":NUMBER=").append(directive.getNumber())
                    .append(":ENABLED=").append(directive.getEnabled())
                    .append(":PARTICIPANT=").append(directive.getParticipant())
                    .append(":COLOR=").append(directive.getColor())
                    .append(":STYLE=").append(directive.getStyle())
                    .append(":LIFELINE=").append(directive.getLifelineStyle())
                    .append(":NAME=").append(directive.getStyleName())
                    .append('\n');
        } else if (node instanceof CommentNode comment) {
            sb.append(indent).append("COMMENT:").append(comment.getText()).append('\n');
        } else if (node instanceof BlanklineNode) {
            sb.append(indent).append("BLANK").append('\n');
        }
    }

    private static void appendEntries(StringBuilder sb, DiagramDocument document, Iterable<String> ids, String indent) {
        for (String id : ids) {
            document.findById(id).ifPresent(child -> appendNodeSignature(sb, document, child, indent));
        }
    }
}
