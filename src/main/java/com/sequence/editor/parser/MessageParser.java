package com.sequence.editor.parser;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.sequence.editor.model.ArrowType;
import com.sequence.editor.model.MessageNode;
import com.sequence.editor.model.NodeType;
import com.sequence.editor.model.Style;

/**
 * Parses message lines: {@code From<arrow>[(delay)][*]To[:label]}.
 *
 * An inline style splits the arrow, {@code A-[#red;3]->B} or {@code A<-[##warn]-B}.
 * The pair of arrow halves around the brackets must match one arrow kind.
 */
public class MessageParser {

    static final String CREATE_MARKER = "<<create>>";

    private static final String PLAIN_ARROW = ArrowType.byLiteralLength().stream()
            .map(a -> Pattern.quote(a.literal()))
            .collect(Collectors.joining("|"));

    private static final String STYLE_SUFFIX = ArrowType.byStyleSuffixLength().stream()
            .map(a -> Pattern.quote(a.styleSuffix()))
            .distinct()
            .collect(Collectors.joining("|"));

    private static final Pattern MESSAGE = Pattern.compile(
            "^(?<from>\\[|[^\\s\\-<\\[\\]:]+)\\s*"
                    + "(?:(?<sprefix><-|-)\\[(?<spec>[^\\]]*)\\](?<ssuffix>" + STYLE_SUFFIX + ")|(?<arrow>" + PLAIN_ARROW + "))"
                    + "\\s*(?:\\((?<delay>\\d+)\\))?\\s*(?<create>\\*)?\\s*"
                    + "(?<to>\\]|[^\\s:\\[\\]]+)\\s*"
                    + "(?::(?<label>.*))?$");

    private final NodeIdGenerator idGenerator;

    public MessageParser(NodeIdGenerator idGenerator) {
        this.idGenerator = idGenerator;
    }

    public Optional<MessageNode> parse(SourceLine line) {
        Matcher m = MESSAGE.matcher(line.getTrimmed());
        if (!m.matches()) {
            return Optional.empty();
        }

        ArrowType arrowType;
        Style style = Style.EMPTY;
        if (m.group("arrow") != null) {
            arrowType = ArrowType.fromLiteral(m.group("arrow")).orElse(null);
        } else {
            arrowType = resolveStyledArrow(m.group("sprefix"), m.group("ssuffix"));
            style = StyleSpecParser.parseMessageStyle(m.group("spec"));
        }
        if (arrowType == null) {
            return Optional.empty();
        }

        Integer delay = null;
        if (m.group("delay") != null) {
            int value = StyleSpecParser.parseInt("delay", m.group("delay"));
            delay = value > 0 ? value : null;
        }

        String label = m.group("label") != null ? m.group("label") : "";
        boolean create = m.group("create") != null || label.contains(CREATE_MARKER);

        return Optional.of(MessageNode.builder()
                .id(idGenerator.next(NodeType.MESSAGE))
                .sourceLineStart(line.getNumber())
                .sourceLineEnd(line.getNumber())
                .from(m.group("from"))
                .to(m.group("to"))
                .arrowType(arrowType)
                .delay(delay)
                .create(create)
                .style(style)
                .label(label)
                .build());
    }

    private static ArrowType resolveStyledArrow(String prefix, String suffix) {
        for (ArrowType type : ArrowType.values()) {
            if (type.stylePrefix().equals(prefix) && type.styleSuffix().equals(suffix)) {
                return type;
            }
        }
        return null;
    }
}
