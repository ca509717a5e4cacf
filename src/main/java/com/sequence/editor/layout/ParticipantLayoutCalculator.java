package com.sequence.editor.layout;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.sequence.editor.model.DiagramDocument;
import com.sequence.editor.model.DirectiveNode;
import com.sequence.editor.model.DirectiveType;
import com.sequence.editor.model.MessageNode;
import com.sequence.editor.model.NotePosition;
import com.sequence.editor.model.NoteNode;
import com.sequence.editor.model.ParticipantNode;

/**
 * Places the participant row.
 *
 * Widths follow the longest display name line. The gap before each
 * participant is the largest of the configured spacing, the room needed by
 * left/right notes and message labels between it and its neighbour, and the
 * previous participant's width plus a small gap. With
 * {@code participantspacing equal} every gap takes the largest of these.
 */
class ParticipantLayoutCalculator {

    private final LayoutConfig config;

    ParticipantLayoutCalculator(LayoutConfig config) {
        this.config = config;
    }

    Map<String, ParticipantGeometry> calculate(DiagramDocument document, double titleOffset) {
        List<ParticipantNode> participants = new ArrayList<>(document.participantsByAlias().values());
        List<String> order = participants.stream().map(ParticipantNode::getAlias).toList();

        Map<Integer, Double> extraSpacing = new HashMap<>();
        collectNoteSpacing(document, order, extraSpacing);
        collectLabelSpacing(document, order, extraSpacing);

        boolean equalSpacing = false;
        double baseSpacing = config.getParticipantSpacing();
        DirectiveNode spacingDirective = document.findDirective(DirectiveType.PARTICIPANT_SPACING).orElse(null);
        if (spacingDirective != null) {
            if (DirectiveNode.EQUAL_SPACING.equals(spacingDirective.getText())) {
                equalSpacing = true;
            } else if (spacingDirective.getNumber() != null) {
                baseSpacing = spacingDirective.getNumber();
            }
        }

        double[] widths = new double[participants.size()];
        for (int i = 0; i < participants.size(); i++) {
            widths[i] = width(participants.get(i));
        }

        double[] gaps = new double[participants.size()];
        double widestGap = 0;
        for (int i = 1; i < participants.size(); i++) {
            double requested = Math.max(baseSpacing, extraSpacing.getOrDefault(i, 0.0));
            gaps[i] = Math.max(requested, widths[i - 1] + config.getParticipantGap());
            widestGap = Math.max(widestGap, gaps[i]);
        }

        Map<String, ParticipantGeometry> layout = new LinkedHashMap<>();
        double x = config.getParticipantStartX();
        double y = config.getParticipantStartY() + titleOffset;
        for (int i = 0; i < participants.size(); i++) {
            if (i > 0) {
                x += equalSpacing ? widestGap : gaps[i];
            }
            String alias = participants.get(i).getAlias();
            layout.put(alias, new ParticipantGeometry(alias, x, y, widths[i], config.getParticipantHeight()));
        }
        return layout;
    }

    double width(ParticipantNode participant) {
        int longest = TextMetrics.longestDisplayNameLine(participant.getDisplayName());
        double textWidth = longest * config.getParticipantCharWidth() + config.getParticipantPadding();
        return Math.max(config.getParticipantMinWidth(), textWidth);
    }

    private void collectNoteSpacing(DiagramDocument document, List<String> order, Map<Integer, Double> extra) {
        for (NoteNode note : document.nodesOfType(NoteNode.class)) {
            if (note.getParticipants().isEmpty() || note.getPosition() == NotePosition.OVER) {
                continue;
            }
            int index = order.indexOf(note.getParticipants().get(0));
            if (index < 0) {
                continue;
            }
            double needed = noteWidth(note.getText()) + config.getNoteConnectorGap() * 2;
            if (note.getPosition() == NotePosition.LEFT_OF && index > 0) {
                extra.merge(index, needed, Math::max);
            } else if (note.getPosition() == NotePosition.RIGHT_OF && index < order.size() - 1) {
                extra.merge(index + 1, needed, Math::max);
            }
        }
    }

    private void collectLabelSpacing(DiagramDocument document, List<String> order, Map<Integer, Double> extra) {
        for (MessageNode message : document.nodesOfType(MessageNode.class)) {
            int fromIndex = order.indexOf(message.getFrom());
            int toIndex = order.indexOf(message.getTo());
            if (fromIndex < 0 || toIndex < 0) {
                continue;
            }
            double labelWidth = TextMetrics.longestLabelLine(message.getLabel()) * config.getCharWidth();
            if (fromIndex == toIndex) {
                if (fromIndex < order.size() - 1) {
                    double needed = config.getSelfMessageWidth() + config.getSelfMessageLabelGap() + labelWidth + 10;
                    extra.merge(fromIndex + 1, needed, Math::max);
                }
            } else if (Math.abs(fromIndex - toIndex) == 1) {
                extra.merge(Math.max(fromIndex, toIndex), labelWidth + config.getMessageLabelPadding(), Math::max);
            }
        }
    }

    double noteWidth(String text) {
        double textWidth = TextMetrics.longestNoteLine(text) * config.getCharWidth() + config.getNotePaddingH() * 2;
        return Math.max(config.getNoteMinWidth(), textWidth);
    }
}
