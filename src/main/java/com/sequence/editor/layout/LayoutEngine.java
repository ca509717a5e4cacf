package com.sequence.editor.layout;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sequence.editor.model.BlanklineNode;
import com.sequence.editor.model.CommentNode;
import com.sequence.editor.model.DiagramDocument;
import com.sequence.editor.model.DiagramNode;
import com.sequence.editor.model.DiagramNodeVisitor;
import com.sequence.editor.model.DirectiveNode;
import com.sequence.editor.model.DirectiveType;
import com.sequence.editor.model.DividerNode;
import com.sequence.editor.model.ElseClause;
import com.sequence.editor.model.ErrorNode;
import com.sequence.editor.model.FragmentNode;
import com.sequence.editor.model.MessageNode;
import com.sequence.editor.model.NoteNode;
import com.sequence.editor.model.ParticipantGroupNode;
import com.sequence.editor.model.ParticipantNode;

/**
 * Computes coordinates for a parsed diagram.
 *
 * <p>The engine makes one forward pass over the top-level nodes. Fragments lay
 * out their entries recursively at the point they appear. The pass threads a
 * vertical cursor, the autonumber counter, the linear/parallel packing state and
 * the activation stacks. Participant groups and the {@code frame} box depend on
 * the final cursor and are placed once the pass is done.</p>
 *
 * <p>Never throws for a document produced by the parser; references to unknown
 * participants fall back to the middle of the diagram.</p>
 */
public class LayoutEngine {
    private static final Logger log = LoggerFactory.getLogger(LayoutEngine.class);

    private final LayoutConfig config;
    private final ParticipantLayoutCalculator participantCalculator;

    public LayoutEngine() {
        this(LayoutConfig.defaults());
    }

    public LayoutEngine(LayoutConfig config) {
        this.config = config;
        this.participantCalculator = new ParticipantLayoutCalculator(config);
    }

    public LayoutResult calculateLayout(DiagramDocument document) {
        LayoutResult result = new LayoutPass(document).run();
        log.debug("Laid out {} nodes and {} participants, total height {}",
                result.getLayout().size(), result.getParticipantLayout().size(), result.getTotalHeight());
        return result;
    }

    private final class LayoutPass implements DiagramNodeVisitor<Void> {
        private final DiagramDocument document;
        private final Map<String, ParticipantGeometry> participants;
        private final Map<String, NodeGeometry> layout = new LinkedHashMap<>();
        private final Map<String, Double> creationY = new LinkedHashMap<>();
        private final List<ParticipantGroupNode> groups = new ArrayList<>();
        private final ActivationTracker activations = new ActivationTracker();
        private final LinearPacker packer = new LinearPacker();
        private final LayoutCursor cursor;
        private final double leftEdge;
        private final double rightEdge;
        private DirectiveNode frame;

        LayoutPass(DiagramDocument document) {
            this.document = document;
            double titleOffset = document.findDirective(DirectiveType.TITLE).isPresent() ? config.getTitleHeight() : 0;
            this.participants = participantCalculator.calculate(document, titleOffset);
            double entrySpacing = document.findDirective(DirectiveType.ENTRY_SPACING)
                    .map(d -> d.numberOr(1))
                    .orElse(1.0);
            this.cursor = new LayoutCursor(config.getMessageStartY() + titleOffset,
                    config.getMessageSpacing() * entrySpacing);

            Collection<ParticipantGeometry> columns = participants.values();
            this.leftEdge = columns.stream()
                    .mapToDouble(ParticipantGeometry::getX)
                    .min()
                    .orElse(config.getParticipantStartX());
            this.rightEdge = columns.stream()
                    .mapToDouble(ParticipantGeometry::getRight)
                    .max()
                    .orElse(config.getParticipantStartX() + config.getParticipantDefaultWidth());
        }

        LayoutResult run() {
            Set<String> owned = document.ownedNodeIds();
            for (DiagramNode node : document.getNodes()) {
                if (!owned.contains(node.getId())) {
                    node.accept(this);
                }
            }
            packer.close(cursor);
            double finalY = cursor.getY();

            List<ActivationBar> bars = activations.finish(finalY);
            for (ParticipantGroupNode group : groups) {
                layoutGroup(group, finalY);
            }
            if (frame != null) {
                double x = leftEdge - config.getFramePadding();
                double width = rightEdge - leftEdge + config.getFramePadding() * 2;
                double height = finalY + config.getMargin() - config.getFrameTop();
                layout.put(frame.getId(), new BoxGeometry(x, config.getFrameTop(), width, height));
            }

            double bottomParticipants = document.findDirective(DirectiveType.BOTTOM_PARTICIPANTS).isPresent()
                    ? config.getBottomParticipantsHeight()
                    : 0;
            return LayoutResult.builder()
                    .layout(Collections.unmodifiableMap(layout))
                    .participantLayout(Collections.unmodifiableMap(participants))
                    .activationBars(bars)
                    .creationY(Collections.unmodifiableMap(creationY))
                    .totalHeight(finalY + config.getMargin() + bottomParticipants)
                    .build();
        }

        @Override
        public Void visit(ParticipantNode participant) {
            return null;
        }

        @Override
        public Void visit(MessageNode message) {
            double fromX = endpointX(message.getFrom());
            double toX = endpointX(message.getTo());
            double labelExtra = (TextMetrics.labelLineCount(message.getLabel()) - 1) * config.getLineHeight();
            double delayHeight = message.delayOrZero() * config.getDelayUnit();
            double height = cursor.getMessageSpacing() + delayHeight + labelExtra;

            double top;
            if (cursor.isCompacting()) {
                double start = Math.min(fromX, toX);
                double end = message.isSelf() ? fromX + config.getSelfMessageWidth() : Math.max(fromX, toX);
                top = packer.place(cursor, start, end, height);
            } else {
                top = cursor.getY();
                cursor.advance(height);
            }
            double y = top + labelExtra;

            layout.put(message.getId(), MessageGeometry.builder()
                    .y(y)
                    .endY(y + delayHeight)
                    .fromX(fromX)
                    .toX(toX)
                    .height(height)
                    .delay(message.delayOrZero())
                    .number(cursor.takeNumber())
                    .boundary(message.isBoundary())
                    .unknownFrom(unknownAlias(message.getFrom()))
                    .unknownTo(unknownAlias(message.getTo()))
                    .build());
            if (message.isCreate()) {
                creationY.putIfAbsent(message.getTo(), y);
            }
            activations.onMessage(message, y);
            return null;
        }

        @Override
        public Void visit(FragmentNode fragment) {
            packer.close(cursor);
            double top = cursor.getY();
            cursor.advance(config.getFragmentHeaderHeight());

            List<Double> dividers = new ArrayList<>();
            if (fragment.isCollapsed()) {
                cursor.advance(config.getCollapsedContentHeight());
            } else {
                layoutEntries(fragment.getEntries());
                for (ElseClause clause : fragment.getElseClauses()) {
                    packer.close(cursor);
                    dividers.add(cursor.getY());
                    cursor.advance(config.getElseLabelHeight());
                    layoutEntries(clause.getEntries());
                }
                packer.close(cursor);
            }
            cursor.advance(config.getFragmentPadding());

            Span span = new Span();
            collectFragmentSpan(fragment, span);
            if (span.isEmpty()) {
                span.include(leftEdge, rightEdge);
            }
            double x = span.left - config.getFragmentSidePadding();
            double width = span.right - span.left + config.getFragmentSidePadding() * 2;
            layout.put(fragment.getId(), FragmentGeometry.builder()
                    .x(x)
                    .y(top)
                    .width(width)
                    .height(cursor.getY() - top)
                    .elseDividerYs(dividers)
                    .collapsed(fragment.isCollapsed())
                    .build());
            cursor.advance(config.getFragmentMargin());
            return null;
        }

        @Override
        public Void visit(ParticipantGroupNode group) {
            groups.add(group);
            return null;
        }

        @Override
        public Void visit(NoteNode note) {
            packer.close(cursor);
            NoteGeometry geometry = noteGeometry(note, cursor.getY());
            layout.put(note.getId(), geometry);
            cursor.advance(geometry.getHeight() + config.getNoteMargin());
            return null;
        }

        @Override
        public Void visit(DividerNode divider) {
            packer.close(cursor);
            double overhang = config.getDividerOverhang();
            layout.put(divider.getId(), new BoxGeometry(leftEdge - overhang, cursor.getY(),
                    rightEdge - leftEdge + overhang * 2, config.getDividerHeight()));
            cursor.advance(config.getDividerHeight() + config.getNoteMargin());
            return null;
        }

        @Override
        public Void visit(CommentNode comment) {
            return null;
        }

        @Override
        public Void visit(BlanklineNode blankline) {
            packer.close(cursor);
            cursor.advance(config.getBlanklineSpacing());
            return null;
        }

        @Override
        public Void visit(DirectiveNode directive) {
            switch (directive.getDirectiveType()) {
                case SPACE -> {
                    packer.close(cursor);
                    cursor.advance(directive.numberOr(1) * config.getSpaceUnit());
                }
                case LINEAR -> {
                    cursor.setLinear(directive.isEnabled());
                    closeWhenNotCompacting();
                }
                case PARALLEL -> {
                    cursor.setParallel(directive.isEnabled());
                    closeWhenNotCompacting();
                }
                case AUTONUMBER -> cursor.setNextNumber(
                        directive.getNumber() != null ? directive.getNumber().intValue() : null);
                case DESTROY, DESTROY_SILENT -> marker(directive);
                case DESTROY_AFTER -> {
                    marker(directive);
                    cursor.advance(cursor.getMessageSpacing());
                }
                case ACTIVATE -> activations.activate(directive.getParticipant(), directive.getColor(), marker(directive));
                case DEACTIVATE -> activations.deactivate(directive.getParticipant(), marker(directive));
                case DEACTIVATE_AFTER -> {
                    activations.deactivate(directive.getParticipant(), marker(directive));
                    cursor.advance(cursor.getMessageSpacing());
                }
                case AUTO_ACTIVATION -> activations.setAutoActivation(directive.isEnabled());
                case ACTIVE_COLOR -> activations.setActiveColor(directive.getParticipant(), directive.getColor());
                case FRAME -> frame = directive;
                case TITLE, ENTRY_SPACING, PARTICIPANT_SPACING, LIFELINE_STYLE, BOTTOM_PARTICIPANTS,
                        FONT_FAMILY, NAMED_STYLE, TYPE_STYLE -> {
                    // document-wide settings, read up front or by the renderer
                }
            }
            return null;
        }

        @Override
        public Void visit(ErrorNode error) {
            packer.close(cursor);
            double margin = config.getErrorMargin();
            layout.put(error.getId(), new BoxGeometry(leftEdge - margin, cursor.getY(),
                    rightEdge - leftEdge + margin * 2, config.getErrorHeight()));
            cursor.advance(config.getErrorHeight() + margin);
            return null;
        }

        private void layoutEntries(List<String> ids) {
            for (String id : ids) {
                document.findById(id).ifPresent(node -> node.accept(this));
            }
        }

        private void closeWhenNotCompacting() {
            if (!cursor.isCompacting()) {
                packer.close(cursor);
            }
        }

        private double marker(DirectiveNode directive) {
            packer.close(cursor);
            double y = cursor.getY();
            layout.put(directive.getId(), new MarkerGeometry(y, directive.getDirectiveType(), directive.getParticipant()));
            return y;
        }

        private double endpointX(String alias) {
            if (MessageNode.LEFT_BOUNDARY.equals(alias)) {
                return leftEdge - config.getBoundaryOffset();
            }
            if (MessageNode.RIGHT_BOUNDARY.equals(alias)) {
                return rightEdge + config.getBoundaryOffset();
            }
            ParticipantGeometry column = participants.get(alias);
            return column != null ? column.getCenterX() : (leftEdge + rightEdge) / 2;
        }

        private String unknownAlias(String alias) {
            if (MessageNode.LEFT_BOUNDARY.equals(alias) || MessageNode.RIGHT_BOUNDARY.equals(alias)
                    || participants.containsKey(alias)) {
                return null;
            }
            log.debug("Message references undeclared participant '{}'", alias);
            return alias;
        }

        private void collectFragmentSpan(FragmentNode fragment, Span span) {
            for (String id : fragment.getAllEntries()) {
                DiagramNode entry = document.findById(id).orElse(null);
                if (entry instanceof MessageNode message) {
                    includeParticipant(message.getFrom(), span);
                    includeParticipant(message.getTo(), span);
                } else if (entry instanceof FragmentNode nested) {
                    NodeGeometry geometry = layout.get(nested.getId());
                    if (geometry instanceof FragmentGeometry box) {
                        span.include(box.getX(), box.getX() + box.getWidth());
                    } else {
                        collectFragmentSpan(nested, span);
                    }
                }
            }
        }

        private void includeParticipant(String alias, Span span) {
            ParticipantGeometry column = participants.get(alias);
            if (column != null) {
                span.include(column.getX(), column.getRight());
            }
        }

        private NoteGeometry noteGeometry(NoteNode note, double y) {
            double width = participantCalculator.noteWidth(note.getText());
            double textHeight = TextMetrics.labelLineCount(note.getText()) * config.getLineHeight()
                    + config.getNotePaddingV() * 2;
            double height = Math.max(config.getNoteMinHeight(), textHeight);

            List<ParticipantGeometry> targets = new ArrayList<>();
            for (String alias : note.getParticipants()) {
                ParticipantGeometry column = participants.get(alias);
                if (column != null) {
                    targets.add(column);
                }
            }
            NoteGeometry.NoteGeometryBuilder builder = NoteGeometry.builder().y(y).height(height);
            if (targets.isEmpty()) {
                return builder.x(config.getParticipantStartX()).width(width).build();
            }

            double lifeline = targets.get(0).getCenterX();
            switch (note.getPosition()) {
                case LEFT_OF -> builder.x(lifeline - width - config.getNoteConnectorGap())
                        .width(width)
                        .connectorX(lifeline);
                case RIGHT_OF -> builder.x(lifeline + config.getNoteConnectorGap())
                        .width(width)
                        .connectorX(lifeline);
                case OVER -> {
                    if (targets.size() == 1) {
                        builder.x(lifeline - width / 2).width(width);
                    } else {
                        double first = targets.stream().mapToDouble(ParticipantGeometry::getCenterX).min().orElse(lifeline);
                        double last = targets.stream().mapToDouble(ParticipantGeometry::getCenterX).max().orElse(lifeline);
                        builder.x(first - width / 4).width(Math.max(width, last - first + width / 2));
                    }
                }
            }
            return builder.build();
        }

        private BoxGeometry layoutGroup(ParticipantGroupNode group, double finalY) {
            Span span = new Span();
            double top = participants.values().stream()
                    .mapToDouble(ParticipantGeometry::getY)
                    .min()
                    .orElse(config.getParticipantStartY());
            double bottom = finalY;
            for (String alias : group.getParticipants()) {
                includeParticipant(alias, span);
            }
            for (String nestedId : group.getNestedGroups()) {
                ParticipantGroupNode nested = document.findById(nestedId, ParticipantGroupNode.class).orElse(null);
                if (nested == null) {
                    continue;
                }
                BoxGeometry inner = layoutGroup(nested, finalY);
                if (inner != null) {
                    span.include(inner.getX(), inner.getRight());
                    top = Math.min(top, inner.getY());
                    bottom = Math.max(bottom, inner.getBottom());
                }
            }
            if (span.isEmpty()) {
                log.debug("Participant group {} has no placed members", group.getId());
                return null;
            }
            double padding = config.getGroupPadding();
            double y = top - config.getGroupLabelHeight() - padding;
            BoxGeometry box = new BoxGeometry(span.left - padding, y,
                    span.right - span.left + padding * 2, bottom + padding - y);
            layout.put(group.getId(), box);
            return box;
        }
    }

    private static final class Span {
        private double left = Double.POSITIVE_INFINITY;
        private double right = Double.NEGATIVE_INFINITY;

        void include(double from, double to) {
            left = Math.min(left, from);
            right = Math.max(right, to);
        }

        boolean isEmpty() {
            return left > right;
        }
    }
}
