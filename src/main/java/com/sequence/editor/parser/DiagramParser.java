package com.sequence.editor.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sequence.editor.model.BlanklineNode;
import com.sequence.editor.model.CommentNode;
import com.sequence.editor.model.DiagramDocument;
import com.sequence.editor.model.DiagramNode;
import com.sequence.editor.model.DividerNode;
import com.sequence.editor.model.ElseClause;
import com.sequence.editor.model.ErrorKind;
import com.sequence.editor.model.ErrorNode;
import com.sequence.editor.model.FragmentNode;
import com.sequence.editor.model.FragmentType;
import com.sequence.editor.model.NodeType;
import com.sequence.editor.model.ParticipantGroupNode;
import com.sequence.editor.model.ParticipantNode;
import com.sequence.editor.model.Style;

/**
 * Line-oriented recursive-descent parser for the sequence diagram DSL.
 *
 * Each line is offered to an ordered list of line handlers and the first one
 * that accepts it wins. Fragments and participant groups consume lines until
 * their {@code end}, recursing into nested blocks.
 *
 * Parsing never fails: lines no grammar accepts, blocks that are never closed
 * and stray {@code else}/{@code end} lines become {@link ErrorNode}s.
 */
public class DiagramParser {
    private static final Logger log = LoggerFactory.getLogger(DiagramParser.class);

    private static final Pattern FRAGMENT_START = Pattern.compile(
            "^(alt|loop|opt|par|break|critical|ref|seq|strict|neg|ignore|consider|assert|region|group|expandable)"
                    + "([+-])?(#[^\\s#;]+)?(?=\\s|$)(.*)$");
    private static final Pattern GROUP_START = Pattern.compile("^participantgroup(?=\\s|$)(.*)$");
    private static final Pattern DIVIDER = Pattern.compile("^==(.*)==\\s*((?:#|;).*)?$");

    private final NodeIdGenerator idGenerator;
    private final DirectiveParser directiveParser;
    private final NoteParser noteParser;
    private final ParticipantParser participantParser;
    private final MessageParser messageParser;
    private final List<LineHandler> handlers;

    public DiagramParser() {
        this(new NodeIdGenerator());
    }

    public DiagramParser(NodeIdGenerator idGenerator) {
        this.idGenerator = idGenerator;
        this.directiveParser = new DirectiveParser(idGenerator);
        this.noteParser = new NoteParser(idGenerator);
        this.participantParser = new ParticipantParser(idGenerator);
        this.messageParser = new MessageParser(idGenerator);
        this.handlers = List.of(
                this::handleBlank,
                this::handleComment,
                this::handleDirective,
                this::handleDivider,
                this::handleNote,
                this::handleFragment,
                this::handleParticipantGroup,
                this::handleParticipant,
                this::handleMessage,
                this::handleStrayTerminator,
                this::handleUnrecognized);
    }

    public DiagramDocument parse(String text) {
        ParseSession session = new ParseSession(text == null ? "" : text);
        EntrySink topLevel = node -> { };

        while (session.hasNext()) {
            dispatch(session, session.next(), topLevel);
        }

        DiagramDocument document = session.toDocument();
        log.debug("Parsed {} lines into {} nodes ({} errors)",
                session.lineCount(), document.getNodes().size(), document.getErrors().size());
        return document;
    }

    private void dispatch(ParseSession session, SourceLine line, EntrySink sink) {
        try {
            for (LineHandler handler : handlers) {
                if (handler.handle(session, line, sink)) {
                    return;
                }
            }
        } catch (RuntimeException e) {
            String message = e instanceof DiagramSyntaxException
                    ? e.getMessage()
                    : "Unrecognized syntax: " + line.getTrimmed();
            log.debug("Line {}: {}", line.getNumber(), message);
            sink.accept(session.add(error(line, message, ErrorKind.UNRECOGNIZED_SYNTAX)));
        }
    }

    // ---- line handlers, in classification order ----

    private boolean handleBlank(ParseSession session, SourceLine line, EntrySink sink) {
        if (!line.isBlank()) {
            return false;
        }
        sink.accept(session.add(BlanklineNode.builder()
                .id(idGenerator.next(NodeType.BLANKLINE))
                .sourceLineStart(line.getNumber())
                .sourceLineEnd(line.getNumber())
                .build()));
        return true;
    }

    private boolean handleComment(ParseSession session, SourceLine line, EntrySink sink) {
        String trimmed = line.getTrimmed();
        if (!trimmed.startsWith("//") && !trimmed.startsWith("#")) {
            return false;
        }
        sink.accept(session.add(CommentNode.builder()
                .id(idGenerator.next(NodeType.COMMENT))
                .sourceLineStart(line.getNumber())
                .sourceLineEnd(line.getNumber())
                .text(trimmed)
                .build()));
        return true;
    }

    private boolean handleDirective(ParseSession session, SourceLine line, EntrySink sink) {
        return directiveParser.parse(line)
                .map(directive -> {
                    sink.accept(session.add(directive));
                    return true;
                })
                .orElse(false);
    }

    private boolean handleDivider(ParseSession session, SourceLine line, EntrySink sink) {
        Matcher m = DIVIDER.matcher(line.getTrimmed());
        if (!m.matches()) {
            return false;
        }
        sink.accept(session.add(DividerNode.builder()
                .id(idGenerator.next(NodeType.DIVIDER))
                .sourceLineStart(line.getNumber())
                .sourceLineEnd(line.getNumber())
                .text(m.group(1))
                .style(StyleSpecParser.parseShape(m.group(2)))
                .build()));
        return true;
    }

    private boolean handleNote(ParseSession session, SourceLine line, EntrySink sink) {
        return noteParser.parse(line)
                .map(note -> {
                    sink.accept(session.add(note));
                    return true;
                })
                .orElse(false);
    }

    private boolean handleFragment(ParseSession session, SourceLine line, EntrySink sink) {
        Matcher m = FRAGMENT_START.matcher(line.getTrimmed());
        if (!m.matches()) {
            return false;
        }
        FragmentType fragmentType = FragmentType.fromKeyword(m.group(1)).orElseThrow();
        String sign = m.group(2);
        if (sign != null && fragmentType != FragmentType.EXPANDABLE) {
            return false;
        }

        StyledText header = StyleSpecParser.splitLeadingStyle(m.group(4));
        Style style = StyleSpecParser.parseShape(header.style());
        if (m.group(3) != null) {
            style = style.toBuilder().operatorColor(m.group(3)).build();
        }

        String id = idGenerator.next(NodeType.FRAGMENT);
        int slot = session.reserveSlot();
        log.debug("Line {}: {} fragment {}", line.getNumber(), fragmentType.keyword(), id);

        List<String> entries = new ArrayList<>();
        List<ElseDraft> elseClauses = new ArrayList<>();
        EntrySink childSink = node -> {
            if (elseClauses.isEmpty()) {
                entries.add(node.getId());
            } else {
                elseClauses.get(elseClauses.size() - 1).entries.add(node.getId());
            }
        };

        SourceLine last = line;
        boolean closed = false;
        FragmentNode fragment;
        try {
            while (session.hasNext()) {
                SourceLine next = session.next();
                last = next;
                if (next.isBlockEnd()) {
                    closed = true;
                    break;
                }
                if (next.isElse()) {
                    openElseClause(session, next, elseClauses, childSink);
                    continue;
                }
                dispatch(session, next, childSink);
            }
        } finally {
            fragment = FragmentNode.builder()
                    .id(id)
                    .sourceLineStart(line.getNumber())
                    .sourceLineEnd(last.getNumber())
                    .fragmentType(fragmentType)
                    .condition(header.text())
                    .style(style)
                    .entries(entries)
                    .elseClauses(elseClauses.stream().map(ElseDraft::build).toList())
                    .collapsed("-".equals(sign))
                    .build();
            session.fill(slot, fragment);
        }
        sink.accept(fragment);

        if (!closed) {
            reportUnterminated(session, line, last, fragmentType.keyword());
        }
        return true;
    }

    /**
     * Starts a new else section. A header whose style does not parse still
     * opens the section, unstyled, and is reported as an error inside it.
     */
    private void openElseClause(ParseSession session, SourceLine line, List<ElseDraft> elseClauses,
                                EntrySink childSink) {
        StyledText elseHeader = StyleSpecParser.splitLeadingStyle(line.getTrimmed().substring(4));
        try {
            elseClauses.add(new ElseDraft(elseHeader.text(), StyleSpecParser.parseShape(elseHeader.style())));
        } catch (DiagramSyntaxException e) {
            log.debug("Line {}: {}", line.getNumber(), e.getMessage());
            elseClauses.add(new ElseDraft(elseHeader.text(), Style.EMPTY));
            childSink.accept(session.add(error(line, e.getMessage(), ErrorKind.UNRECOGNIZED_SYNTAX)));
        }
    }

    private boolean handleParticipantGroup(ParseSession session, SourceLine line, EntrySink sink) {
        Matcher m = GROUP_START.matcher(line.getTrimmed());
        if (!m.matches()) {
            return false;
        }
        String rest = m.group(1).trim();
        String color = null;
        if (rest.startsWith("#")) {
            int space = rest.indexOf(' ');
            color = space < 0 ? rest : rest.substring(0, space);
            rest = space < 0 ? "" : rest.substring(space).trim();
        }

        String id = idGenerator.next(NodeType.PARTICIPANT_GROUP);
        int slot = session.reserveSlot();

        List<String> participants = new ArrayList<>();
        List<String> nestedGroups = new ArrayList<>();
        EntrySink memberSink = node -> {
            if (node instanceof ParticipantNode participant) {
                participants.add(participant.getAlias());
            } else if (node instanceof ParticipantGroupNode group) {
                nestedGroups.add(group.getId());
            } else {
                sink.accept(node);
            }
        };

        SourceLine last = line;
        boolean closed = false;
        ParticipantGroupNode group;
        try {
            while (session.hasNext()) {
                SourceLine next = session.next();
                last = next;
                if (next.isBlockEnd()) {
                    closed = true;
                    break;
                }
                dispatch(session, next, memberSink);
            }
        } finally {
            group = ParticipantGroupNode.builder()
                    .id(id)
                    .sourceLineStart(line.getNumber())
                    .sourceLineEnd(last.getNumber())
                    .color(color)
                    .label(rest)
                    .participants(participants)
                    .nestedGroups(nestedGroups)
                    .build();
            session.fill(slot, group);
        }
        sink.accept(group);

        if (!closed) {
            reportUnterminated(session, line, last, "participantgroup");
        }
        return true;
    }

    private boolean handleParticipant(ParseSession session, SourceLine line, EntrySink sink) {
        Optional<ParticipantNode> participant = participantParser.parse(line);
        participant.ifPresent(p -> sink.accept(session.add(p)));
        return participant.isPresent();
    }

    private boolean handleMessage(ParseSession session, SourceLine line, EntrySink sink) {
        return messageParser.parse(line)
                .map(message -> {
                    sink.accept(session.add(message));
                    return true;
                })
                .orElse(false);
    }

    private boolean handleStrayTerminator(ParseSession session, SourceLine line, EntrySink sink) {
        if (!line.isBlockEnd() && !line.isElse()) {
            return false;
        }
        String keyword = line.isBlockEnd() ? "end" : "else";
        log.debug("Line {}: '{}' outside of a block", line.getNumber(), keyword);
        sink.accept(session.add(error(line, "Unexpected '" + keyword + "' outside of a block",
                ErrorKind.UNEXPECTED_TERMINATOR)));
        return true;
    }

    private boolean handleUnrecognized(ParseSession session, SourceLine line, EntrySink sink) {
        log.debug("Line {}: unrecognized syntax: {}", line.getNumber(), line.getTrimmed());
        sink.accept(session.add(error(line, "Unrecognized syntax: " + line.getTrimmed(),
                ErrorKind.UNRECOGNIZED_SYNTAX)));
        return true;
    }

    // ---- helpers ----

    private void reportUnterminated(ParseSession session, SourceLine start, SourceLine last, String keyword) {
        log.warn("Unterminated '{}' block starting at line {}", keyword, start.getNumber());
        session.add(ErrorNode.builder()
                .id(idGenerator.next(NodeType.ERROR))
                .sourceLineStart(start.getNumber())
                .sourceLineEnd(last.getNumber())
                .text(start.getTrimmed())
                .message("Unterminated '" + keyword + "' block: missing 'end'")
                .errorKind(ErrorKind.UNTERMINATED_BLOCK)
                .build());
    }

    private ErrorNode error(SourceLine line, String message, ErrorKind kind) {
        return ErrorNode.builder()
                .id(idGenerator.next(NodeType.ERROR))
                .sourceLineStart(line.getNumber())
                .sourceLineEnd(line.getNumber())
                .text(line.getTrimmed())
                .message(message)
                .errorKind(kind)
                .build();
    }

    @FunctionalInterface
    private interface LineHandler {
        boolean handle(ParseSession session, SourceLine line, EntrySink sink);
    }

    /**
     * Receives every node parsed at one nesting level.
     */
    @FunctionalInterface
    private interface EntrySink {
        void accept(DiagramNode node);
    }

    private static final class ElseDraft {
        private final String condition;
        private final Style style;
        private final List<String> entries = new ArrayList<>();

        ElseDraft(String condition, Style style) {
            this.condition = condition;
            this.style = style;
        }

        ElseClause build() {
            return ElseClause.builder()
                    .condition(condition)
                    .style(style)
                    .entries(entries)
                    .build();
        }
    }

    /**
     * Per-invocation state: the input lines, the read position and the node arena.
     */
    private static final class ParseSession {
        private final List<SourceLine> lines = new ArrayList<>();
        private final List<DiagramNode> arena = new ArrayList<>();
        private int pos = 0;

        ParseSession(String text) {
            String[] raw = text.isEmpty() ? new String[0] : text.split("\n", -1);
            for (int i = 0; i < raw.length; i++) {
                lines.add(SourceLine.of(i + 1, raw[i]));
            }
        }

        boolean hasNext() {
            return pos < lines.size();
        }

        SourceLine next() {
            return lines.get(pos++);
        }

        int lineCount() {
            return lines.size();
        }

        <T extends DiagramNode> T add(T node) {
            arena.add(node);
            return node;
        }

        int reserveSlot() {
            arena.add(null);
            return arena.size() - 1;
        }

        void fill(int slot, DiagramNode node) {
            arena.set(slot, node);
        }

        DiagramDocument toDocument() {
            return new DiagramDocument(arena);
        }
    }
}
