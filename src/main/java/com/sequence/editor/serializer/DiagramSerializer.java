package com.sequence.editor.serializer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sequence.editor.model.BlanklineNode;
import com.sequence.editor.model.CommentNode;
import com.sequence.editor.model.DiagramDocument;
import com.sequence.editor.model.DiagramNode;
import com.sequence.editor.model.DiagramNodeVisitor;
import com.sequence.editor.model.DirectiveNode;
import com.sequence.editor.model.DividerNode;
import com.sequence.editor.model.ElseClause;
import com.sequence.editor.model.ErrorKind;
import com.sequence.editor.model.ErrorNode;
import com.sequence.editor.model.FragmentNode;
import com.sequence.editor.model.FragmentType;
import com.sequence.editor.model.MessageNode;
import com.sequence.editor.model.NoteNode;
import com.sequence.editor.model.ParticipantGroupNode;
import com.sequence.editor.model.ParticipantNode;
import com.sequence.editor.model.Style;

/**
 * Writes a {@link DiagramDocument} back to its one canonical text form.
 *
 * Nodes owned by a fragment, an else clause or a participant group are
 * skipped at top level and written by their owner, indented two spaces per
 * nesting level. Error nodes are written as comments; the error for an
 * unclosed block is dropped since its block is written with an {@code end}.
 */
public class DiagramSerializer {
    private static final Logger log = LoggerFactory.getLogger(DiagramSerializer.class);

    private static final String INDENT = "  ";

    public String serialize(DiagramDocument document) {
        Set<String> ownedIds = document.ownedNodeIds();
        Set<String> groupedAliases = document.groupedParticipantAliases();
        Map<String, List<DiagramNode>> hosted = new HashMap<>();
        List<DiagramNode> topLevel = new ArrayList<>();

        for (DiagramNode node : document.getNodes()) {
            if (ownedIds.contains(node.getId())) {
                continue;
            }
            if (node instanceof ParticipantNode participant && groupedAliases.contains(participant.getAlias())) {
                continue;
            }
            Optional<ParticipantGroupNode> host = node instanceof ParticipantGroupNode
                    ? Optional.empty()
                    : innermostGroupAround(document, node);
            if (host.isPresent()) {
                hosted.computeIfAbsent(host.get().getId(), id -> new ArrayList<>()).add(node);
            } else {
                topLevel.add(node);
            }
        }

        LineWriter writer = new LineWriter(document, hosted);
        for (DiagramNode node : topLevel) {
            writer.write(node, 0);
        }

        log.debug("Serialized {} nodes into {} lines", document.getNodes().size(), writer.lines.size());
        return String.join("\n", writer.lines);
    }

    /**
     * The innermost participant group whose body spans the node's first line.
     * Non-participant lines of a group body are parsed at the enclosing level
     * and are written back inside that body.
     */
    private static Optional<ParticipantGroupNode> innermostGroupAround(DiagramDocument document, DiagramNode node) {
        int line = node.getSourceLineStart();
        return document.nodesOfType(ParticipantGroupNode.class).stream()
                .filter(group -> group.getSourceLineStart() < line && line <= group.getSourceLineEnd())
                .max(Comparator.comparingInt(ParticipantGroupNode::getSourceLineStart));
    }

    /**
     * Appends the lines of one node at the current depth. Containers recurse through {@link #write}.
     */
    private static final class LineWriter implements DiagramNodeVisitor<Void> {
        private final DiagramDocument document;
        private final Map<String, List<DiagramNode>> hosted;
        private final List<String> lines = new ArrayList<>();
        private int depth;

        LineWriter(DiagramDocument document, Map<String, List<DiagramNode>> hosted) {
            this.document = document;
            this.hosted = hosted;
        }

        void write(DiagramNode node, int atDepth) {
            int saved = depth;
            depth = atDepth;
            node.accept(this);
            depth = saved;
        }

        private void line(String text) {
            lines.add(INDENT.repeat(depth) + text);
        }

        @Override
        public Void visit(ParticipantNode participant) {
            StringBuilder sb = new StringBuilder(participant.getParticipantType().keyword());
            if (participant.getIconCode() != null) {
                sb.append(' ').append(participant.getIconCode());
            }
            if (participant.getImageData() != null) {
                sb.append(' ').append(participant.getImageData());
            }
            if (participant.hasDistinctDisplayName()) {
                sb.append(" \"").append(escape(participant.getDisplayName())).append("\" as ")
                        .append(participant.getAlias());
            } else {
                sb.append(' ').append(participant.getAlias());
            }
            appendStyle(sb, participant.getStyle());
            line(sb.toString());
            return null;
        }

        @Override
        public Void visit(MessageNode message) {
            StringBuilder sb = new StringBuilder(message.getFrom());
            String styleSpec = StyleFormatter.formatMessageStyle(message.getStyle());
            sb.append(styleSpec.isEmpty()
                    ? message.getArrowType().literal()
                    : message.getArrowType().styledLiteral(styleSpec));
            if (message.getDelay() != null) {
                sb.append('(').append(message.getDelay()).append(')');
            }
            if (message.isCreate()) {
                sb.append('*');
            }
            sb.append(message.getTo()).append(':').append(message.getLabel());
            line(sb.toString());
            return null;
        }

        @Override
        public Void visit(FragmentNode fragment) {
            StringBuilder opening = new StringBuilder(fragment.getFragmentType().keyword());
            if (fragment.getFragmentType() == FragmentType.EXPANDABLE) {
                opening.append(fragment.isCollapsed() ? '-' : '+');
            }
            Style style = fragment.getStyle();
            if (style.getOperatorColor() != null) {
                opening.append(style.getOperatorColor());
            }
            appendStyle(opening, style);
            if (!fragment.getCondition().isEmpty()) {
                opening.append(' ').append(fragment.getCondition());
            }
            line(opening.toString());

            writeEntries(fragment.getEntries());
            for (ElseClause clause : fragment.getElseClauses()) {
                StringBuilder elseLine = new StringBuilder("else");
                appendStyle(elseLine, clause.getStyle());
                if (!clause.getCondition().isEmpty()) {
                    elseLine.append(' ').append(clause.getCondition());
                }
                line(elseLine.toString());
                writeEntries(clause.getEntries());
            }
            line("end");
            return null;
        }

        @Override
        public Void visit(ParticipantGroupNode group) {
            StringBuilder opening = new StringBuilder("participantgroup");
            if (group.getColor() != null) {
                opening.append(' ').append(group.getColor());
            }
            if (!group.getLabel().isEmpty()) {
                opening.append(' ').append(group.getLabel());
            }
            line(opening.toString());

            List<DiagramNode> members = new ArrayList<>();
            for (String alias : group.getParticipants()) {
                findMember(group, alias).ifPresent(members::add);
            }
            for (String nestedId : group.getNestedGroups()) {
                document.findById(nestedId).ifPresent(members::add);
            }
            members.addAll(hosted.getOrDefault(group.getId(), List.of()));
            members.sort(Comparator.comparingInt(DiagramNode::getSourceLineStart));
            for (DiagramNode member : members) {
                write(member, depth + 1);
            }
            line("end");
            return null;
        }

        @Override
        public Void visit(NoteNode note) {
            StringBuilder sb = new StringBuilder(note.getNoteType().keyword())
                    .append(' ').append(note.getPosition().keyword())
                    .append(' ').append(String.join(",", note.getParticipants()));
            appendStyle(sb, note.getStyle());
            sb.append(':').append(note.getText());
            line(sb.toString());
            return null;
        }

        @Override
        public Void visit(DividerNode divider) {
            StringBuilder sb = new StringBuilder("==").append(divider.getText()).append("==");
            appendStyle(sb, divider.getStyle());
            line(sb.toString());
            return null;
        }

        @Override
        public Void visit(CommentNode comment) {
            line(comment.getText());
            return null;
        }

        @Override
        public Void visit(BlanklineNode blankline) {
            lines.add("");
            return null;
        }

        @Override
        public Void visit(DirectiveNode directive) {
            line(DirectiveFormatter.format(directive));
            return null;
        }

        @Override
        public Void visit(ErrorNode error) {
            if (error.getErrorKind() != ErrorKind.UNTERMINATED_BLOCK) {
                line("// " + error.getText());
            }
            return null;
        }

        private void writeEntries(List<String> entryIds) {
            for (String entryId : entryIds) {
                document.findById(entryId).ifPresent(entry -> write(entry, depth + 1));
            }
        }

        /**
         * The declaration inside the group's line range, or the first declaration of the alias.
         */
        private Optional<DiagramNode> findMember(ParticipantGroupNode group, String alias) {
            List<ParticipantNode> candidates = document.nodesOfType(ParticipantNode.class).stream()
                    .filter(p -> p.getAlias().equals(alias))
                    .toList();
            Optional<ParticipantNode> inside = candidates.stream()
                    .filter(p -> p.getSourceLineStart() > group.getSourceLineStart()
                            && p.getSourceLineStart() <= group.getSourceLineEnd())
                    .findFirst();
            return inside.or(() -> candidates.stream().findFirst()).map(DiagramNode.class::cast);
        }

        private static void appendStyle(StringBuilder sb, Style style) {
            String formatted = StyleFormatter.formatShape(style);
            if (!formatted.isEmpty()) {
                sb.append(' ').append(formatted);
            }
        }

        private static String escape(String text) {
            return text.replace("\\", "\\\\")
                    .replace("\"", "\\\"")
                    .replace("\n", "\\n");
        }
    }
}
