package com.sequence.editor.serializer;

import com.sequence.editor.model.LifelineStyle;
import com.sequence.editor.model.Style;

import lombok.experimental.UtilityClass;

/**
 * Canonical text for style values. Parts always come out in the order
 * {@code ##name, fill, border[;width][;style]}.
 */
@UtilityClass
public class StyleFormatter {

    public static String formatShape(Style style) {
        if (style == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        if (style.getStyleName() != null) {
            sb.append("##").append(style.getStyleName());
        }
        if (style.getFill() != null) {
            appendSpaced(sb, style.getFill());
        }
        String border = formatBorder(style);
        if (!border.isEmpty()) {
            if (style.getFill() != null && border.startsWith(";")) {
                sb.append(border);
            } else {
                appendSpaced(sb, border);
            }
        }
        return sb.toString();
    }

    public static String formatMessageStyle(Style style) {
        StringBuilder sb = new StringBuilder();
        if (style.getStyleName() != null) {
            sb.append("##").append(style.getStyleName());
        }
        String border = formatBorder(style);
        if (!border.isEmpty()) {
            appendSpaced(sb, border);
        }
        return sb.toString();
    }

    /**
     * Body of a named or type style definition, {@code [shape][,textMarkup]}.
     */
    public static String formatDefinition(Style style) {
        if (style == null) {
            return "";
        }
        String shape = formatShape(style.toBuilder().styleName(null).build());
        String markup = style.getTextMarkup();
        if (markup == null) {
            return shape;
        }
        if (shape.isEmpty()) {
            boolean ambiguous = markup.startsWith("#") || markup.startsWith(";") || markup.startsWith(",");
            return ambiguous ? "," + markup : markup;
        }
        return shape + "," + markup;
    }

    public static String formatLifeline(LifelineStyle style) {
        StringBuilder sb = new StringBuilder();
        if (style.getColor() != null) {
            sb.append(style.getColor());
        }
        if (style.getWidth() != null || style.getLineStyle() != null) {
            sb.append(';');
            if (style.getWidth() != null) {
                sb.append(style.getWidth());
            }
            if (style.getLineStyle() != null) {
                sb.append(';').append(style.getLineStyle());
            }
        }
        return sb.toString();
    }

    private static String formatBorder(Style style) {
        if (!style.hasBorderPart()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        if (style.getBorder() != null) {
            sb.append(style.getBorder());
        }
        if (style.getBorderWidth() != null || style.getBorderStyle() != null) {
            sb.append(';');
            if (style.getBorderWidth() != null) {
                sb.append(style.getBorderWidth());
            }
            if (style.getBorderStyle() != null) {
                sb.append(';').append(style.getBorderStyle());
            }
        }
        return sb.toString();
    }

    private static void appendSpaced(StringBuilder sb, String part) {
        if (sb.length() > 0) {
            sb.append(' ');
        }
        sb.append(part);
    }
}
