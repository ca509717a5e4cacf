package com.sequence.editor.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.sequence.editor.model.NodeType;
import com.sequence.editor.model.NotePosition;
import com.sequence.editor.model.NoteNode;
import com.sequence.editor.model.NoteType;

/**
 * Parses {@code note|box|abox|rbox|ref|state over|left of|right of A[,B] [style][:text]}.
 */
public class NoteParser {

    private static final Pattern NOTE = Pattern.compile(
            "^(note|box|abox|rbox|ref|state)\\s+(over|left of|right of)\\s+([^:]*)(?::(.*))?$");

    private final NodeIdGenerator idGenerator;

    public NoteParser(NodeIdGenerator idGenerator) {
        this.idGenerator = idGenerator;
    }

    public Optional<NoteNode> parse(SourceLine line) {
        Matcher m = NOTE.matcher(line.getTrimmed());
        if (!m.matches()) {
            return Optional.empty();
        }

        String head = m.group(3).trim();
        int styleStart = indexOfStyle(head);
        String participantPart = styleStart < 0 ? head : head.substring(0, styleStart);
        String stylePart = styleStart < 0 ? "" : head.substring(styleStart);

        List<String> participants = new ArrayList<>();
        for (String alias : participantPart.split(",")) {
            if (!alias.isBlank()) {
                participants.add(alias.trim());
            }
        }
        if (participants.isEmpty()) {
            throw new DiagramSyntaxException("Note needs at least one participant: " + line.getTrimmed());
        }

        return Optional.of(NoteNode.builder()
                .id(idGenerator.next(NodeType.NOTE))
                .sourceLineStart(line.getNumber())
                .sourceLineEnd(line.getNumber())
                .noteType(NoteType.fromKeyword(m.group(1)).orElse(NoteType.NOTE))
                .position(NotePosition.fromKeyword(m.group(2)).orElse(NotePosition.OVER))
                .participants(participants)
                .style(StyleSpecParser.parseShape(stylePart))
                .text(m.group(4) != null ? m.group(4) : "")
                .build());
    }

    private static int indexOfStyle(String head) {
        int hash = head.indexOf('#');
        int semicolon = head.indexOf(';');
        if (hash < 0) {
            return semicolon;
        }
        return semicolon < 0 ? hash : Math.min(hash, semicolon);
    }
}
