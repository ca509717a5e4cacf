package com.sequence.editor.parser;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.sequence.editor.model.NodeType;
import com.sequence.editor.model.ParticipantNode;
import com.sequence.editor.model.ParticipantType;
import com.sequence.editor.model.Style;

/**
 * Parses participant declarations:
 * <pre>
 *   participant Alias [style]
 *   actor "Display\nName" as Alias [style]
 *   fontawesome6solid f233 Server [style]
 *   image data:image/png;base64,... Logo [style]
 * </pre>
 */
public class ParticipantParser {

    private static final Pattern DECLARATION = Pattern.compile("^([a-z0-9]+)\\s+(.+)$");
    private static final Pattern QUOTED = Pattern.compile("^\"((?:[^\"\\\\]|\\\\.)*)\"\\s+as\\s+([^\\s#;]+)(.*)$");
    private static final Pattern PLAIN = Pattern.compile("^([^\\s#;\"]+)(.*)$");

    private final NodeIdGenerator idGenerator;

    public ParticipantParser(NodeIdGenerator idGenerator) {
        this.idGenerator = idGenerator;
    }

    public Optional<ParticipantNode> parse(SourceLine line) {
        Matcher declaration = DECLARATION.matcher(line.getTrimmed());
        if (!declaration.matches()) {
            return Optional.empty();
        }
        Optional<ParticipantType> type = ParticipantType.fromKeyword(declaration.group(1));
        if (type.isEmpty()) {
            return Optional.empty();
        }

        String rest = declaration.group(2).trim();
        String iconCode = null;
        String imageData = null;
        if (type.get().isIcon() || type.get() == ParticipantType.IMAGE) {
            String[] split = rest.split("\\s+", 2);
            if (split.length < 2) {
                return Optional.empty();
            }
            if (type.get() == ParticipantType.IMAGE) {
                imageData = split[0];
            } else {
                iconCode = split[0];
            }
            rest = split[1].trim();
        }

        String alias;
        String displayName;
        String styleText;
        Matcher quoted = QUOTED.matcher(rest);
        Matcher plain = PLAIN.matcher(rest);
        if (quoted.matches()) {
            displayName = unescape(quoted.group(1));
            alias = quoted.group(2);
            styleText = quoted.group(3).trim();
        } else if (plain.matches()) {
            alias = plain.group(1);
            displayName = alias;
            styleText = plain.group(2).trim();
        } else {
            return Optional.empty();
        }

        if (!styleText.isEmpty() && !StyleSpecParser.isStyleToken(styleText)) {
            return Optional.empty();
        }
        Style style = StyleSpecParser.parseShape(styleText);

        return Optional.of(ParticipantNode.builder()
                .id(idGenerator.next(NodeType.PARTICIPANT))
                .sourceLineStart(line.getNumber())
                .sourceLineEnd(line.getNumber())
                .participantType(type.get())
                .alias(alias)
                .displayName(displayName)
                .iconCode(iconCode)
                .imageData(imageData)
                .style(style)
                .build());
    }

    static String unescape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length()) {
                char next = text.charAt(++i);
                switch (next) {
                    case 'n' -> sb.append('\n');
                    case '"' -> sb.append('"');
                    case '\\' -> sb.append('\\');
                    default -> sb.append('\\').append(next);
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
