package com.sequence.editor.serializer;

import com.sequence.editor.model.DirectiveNode;
import com.sequence.editor.model.Style;

import lombok.experimental.UtilityClass;

/**
 * Canonical text for directive lines. Default values use the short form
 * ({@code space}, {@code linear}).
 */
@UtilityClass
public class DirectiveFormatter {

    public static String format(DirectiveNode directive) {
        String keyword = directive.keyword();
        return switch (directive.getDirectiveType()) {
            case TITLE -> withArgument(keyword, directive.getText());
            case ENTRY_SPACING -> keyword + " " + formatNumber(directive.numberOr(1));
            case AUTONUMBER -> directive.getNumber() == null
                    ? keyword + " off"
                    : keyword + " " + formatNumber(directive.getNumber());
            case SPACE -> directive.getNumber() == null || directive.getNumber() == 1.0
                    ? keyword
                    : keyword + " " + formatNumber(directive.getNumber());
            case PARTICIPANT_SPACING -> DirectiveNode.EQUAL_SPACING.equals(directive.getText())
                    ? keyword + " " + DirectiveNode.EQUAL_SPACING
                    : keyword + " " + formatNumber(directive.numberOr(0));
            case LIFELINE_STYLE -> withArgument(withArgument(keyword, directive.getParticipant()),
                    directive.getLifelineStyle() != null ? StyleFormatter.formatLifeline(directive.getLifelineStyle()) : null);
            case LINEAR, PARALLEL -> directive.isEnabled() ? keyword : keyword + " off";
            case AUTO_ACTIVATION -> keyword + (directive.isEnabled() ? " on" : " off");
            case BOTTOM_PARTICIPANTS -> keyword;
            case FONT_FAMILY -> withArgument(keyword, quoteIfSpaced(directive.getText()));
            case FRAME -> formatFrame(directive);
            case DESTROY, DESTROY_AFTER, DESTROY_SILENT, DEACTIVATE, DEACTIVATE_AFTER ->
                    withArgument(keyword, directive.getParticipant());
            case ACTIVATE, ACTIVE_COLOR -> withArgument(withArgument(keyword, directive.getParticipant()),
                    directive.getColor());
            case NAMED_STYLE -> withArgument(keyword + " " + directive.getStyleName(),
                    StyleFormatter.formatDefinition(directive.getStyle()));
            case TYPE_STYLE -> withArgument(keyword, StyleFormatter.formatDefinition(directive.getStyle()));
        };
    }

    /**
     * Whole numbers print without a fractional part.
     */
    public static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }

    private static String formatFrame(DirectiveNode directive) {
        StringBuilder sb = new StringBuilder("frame");
        Style style = Style.orEmpty(directive.getStyle());
        if (style.getOperatorColor() != null) {
            sb.append(style.getOperatorColor());
        }
        String shape = StyleFormatter.formatShape(style);
        if (!shape.isEmpty()) {
            sb.append(' ').append(shape);
        }
        if (directive.getText() != null && !directive.getText().isEmpty()) {
            sb.append(' ').append(directive.getText());
        }
        return sb.toString();
    }

    private static String withArgument(String head, String argument) {
        if (argument == null || argument.isEmpty()) {
            return head;
        }
        return head + " " + argument;
    }

    private static String quoteIfSpaced(String value) {
        if (value != null && value.chars().anyMatch(Character::isWhitespace)) {
            return "\"" + value + "\"";
        }
        return value;
    }
}
