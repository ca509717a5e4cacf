package com.sequence.editor.parser;

import java.util.Optional;
import java.util.regex.Pattern;

import com.sequence.editor.model.DirectiveNode;
import com.sequence.editor.model.DirectiveType;
import com.sequence.editor.model.NodeType;
import com.sequence.editor.model.Style;
import com.sequence.editor.model.StyleTarget;

/**
 * Parses directive lines. A directive is recognized by its first token; a
 * recognized keyword with a malformed payload raises {@link DiagramSyntaxException}.
 */
public class DirectiveParser {

    private static final Pattern DECIMAL = Pattern.compile("-?\\d+(\\.\\d+)?");
    private static final Pattern INTEGER = Pattern.compile("-?\\d+");
    private static final Pattern COLOR = Pattern.compile("#[^\\s#;]+");

    private final NodeIdGenerator idGenerator;

    public DirectiveParser(NodeIdGenerator idGenerator) {
        this.idGenerator = idGenerator;
    }

    public Optional<DirectiveNode> parse(SourceLine line) {
        String trimmed = line.getTrimmed();
        int space = indexOfWhitespace(trimmed);
        String keyword = space < 0 ? trimmed : trimmed.substring(0, space);
        String args = space < 0 ? "" : trimmed.substring(space).trim();

        if (keyword.startsWith("frame#")) {
            return Optional.of(frame(line, keyword.substring("frame".length()), args));
        }

        Optional<StyleTarget> styleTarget = StyleTarget.fromKeyword(keyword);
        if (styleTarget.isPresent()) {
            return Optional.of(base(line, DirectiveType.TYPE_STYLE)
                    .styleTarget(styleTarget.get())
                    .style(StyleSpecParser.parseDefinition(args))
                    .build());
        }

        Optional<DirectiveType> type = DirectiveType.fromKeyword(keyword);
        if (type.isEmpty()) {
            return Optional.empty();
        }

        if (type.get() == DirectiveType.FRAME) {
            return Optional.of(frame(line, "", args));
        }

        DirectiveNode.DirectiveNodeBuilder builder = base(line, type.get());
        return Optional.of(switch (type.get()) {
            case TITLE -> builder.text(args).build();
            case ENTRY_SPACING -> builder.number(decimal(keyword, args)).build();
            case AUTONUMBER -> builder.number("off".equals(args) ? null : integer(keyword, args)).build();
            case SPACE -> builder.number(args.isEmpty() ? 1.0 : integer(keyword, args)).build();
            case PARTICIPANT_SPACING -> DirectiveNode.EQUAL_SPACING.equals(args)
                    ? builder.text(DirectiveNode.EQUAL_SPACING).build()
                    : builder.number(integer(keyword, args)).build();
            case LIFELINE_STYLE -> lifelineStyle(builder, args);
            case LINEAR, PARALLEL, AUTO_ACTIVATION -> builder.enabled(onOff(keyword, args)).build();
            case BOTTOM_PARTICIPANTS -> {
                requireNoArgs(keyword, args);
                yield builder.build();
            }
            case FONT_FAMILY -> builder.text(unquote(requireArgs(keyword, args))).build();
            case DESTROY, DESTROY_AFTER, DESTROY_SILENT, DEACTIVATE, DEACTIVATE_AFTER ->
                    builder.participant(singleToken(keyword, args)).build();
            case ACTIVATE -> activate(builder, keyword, args);
            case ACTIVE_COLOR -> activeColor(builder, args);
            case NAMED_STYLE -> namedStyle(builder, args);
            case FRAME, TYPE_STYLE -> throw new DiagramSyntaxException("Unexpected keyword: " + keyword);
        });
    }

    private DirectiveNode.DirectiveNodeBuilder base(SourceLine line, DirectiveType type) {
        return DirectiveNode.builder()
                .id(idGenerator.next(NodeType.DIRECTIVE))
                .sourceLineStart(line.getNumber())
                .sourceLineEnd(line.getNumber())
                .directiveType(type);
    }

    private DirectiveNode frame(SourceLine line, String operatorColor, String args) {
        StyledText split = StyleSpecParser.splitLeadingStyle(args);
        Style style = StyleSpecParser.parseShape(split.style());
        if (!operatorColor.isEmpty()) {
            style = style.toBuilder().operatorColor(operatorColor).build();
        }
        return base(line, DirectiveType.FRAME)
                .style(style)
                .text(split.text())
                .build();
    }

    private DirectiveNode lifelineStyle(DirectiveNode.DirectiveNodeBuilder builder, String args) {
        String spec = args;
        if (!args.isEmpty() && !StyleSpecParser.isStyleToken(args)) {
            int space = indexOfWhitespace(args);
            builder.participant(space < 0 ? args : args.substring(0, space));
            spec = space < 0 ? "" : args.substring(space).trim();
        }
        return builder.lifelineStyle(StyleSpecParser.parseLifeline(spec)).build();
    }

    private DirectiveNode activate(DirectiveNode.DirectiveNodeBuilder builder, String keyword, String args) {
        String[] parts = requireArgs(keyword, args).split("\\s+");
        if (parts.length > 2 || (parts.length == 2 && !COLOR.matcher(parts[1]).matches())) {
            throw new DiagramSyntaxException("Invalid activate directive: " + args);
        }
        return builder.participant(parts[0])
                .color(parts.length == 2 ? parts[1] : null)
                .build();
    }

    private DirectiveNode activeColor(DirectiveNode.DirectiveNodeBuilder builder, String args) {
        String[] parts = requireArgs("activecolor", args).split("\\s+");
        if (parts.length == 1 && COLOR.matcher(parts[0]).matches()) {
            return builder.color(parts[0]).build();
        }
        if (parts.length == 2 && COLOR.matcher(parts[1]).matches()) {
            return builder.participant(parts[0]).color(parts[1]).build();
        }
        throw new DiagramSyntaxException("Invalid activecolor directive: " + args);
    }

    private DirectiveNode namedStyle(DirectiveNode.DirectiveNodeBuilder builder, String args) {
        String body = requireArgs("style", args);
        int space = indexOfWhitespace(body);
        if (space < 0) {
            throw new DiagramSyntaxException("Style definition needs a name and a style: " + args);
        }
        return builder.styleName(body.substring(0, space))
                .style(StyleSpecParser.parseDefinition(body.substring(space).trim()))
                .build();
    }

    private static Double decimal(String keyword, String args) {
        if (!DECIMAL.matcher(args).matches()) {
            throw new DiagramSyntaxException("Invalid " + keyword + " value: " + args);
        }
        return Double.valueOf(args);
    }

    private static Double integer(String keyword, String args) {
        if (!INTEGER.matcher(args).matches()) {
            throw new DiagramSyntaxException("Invalid " + keyword + " value: " + args);
        }
        return (double) StyleSpecParser.parseInt(keyword + " value", args);
    }

    private static Boolean onOff(String keyword, String args) {
        return switch (args) {
            case "", "on" -> Boolean.TRUE;
            case "off" -> Boolean.FALSE;
            default -> throw new DiagramSyntaxException("Expected 'on' or 'off' after " + keyword + ": " + args);
        };
    }

    private static String singleToken(String keyword, String args) {
        String value = requireArgs(keyword, args);
        if (indexOfWhitespace(value) >= 0) {
            throw new DiagramSyntaxException(keyword + " takes a single participant: " + args);
        }
        return value;
    }

    private static String requireArgs(String keyword, String args) {
        if (args.isEmpty()) {
            throw new DiagramSyntaxException("Missing argument for " + keyword);
        }
        return args;
    }

    private static void requireNoArgs(String keyword, String args) {
        if (!args.isEmpty()) {
            throw new DiagramSyntaxException(keyword + " takes no arguments: " + args);
        }
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    private static int indexOfWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
