package com.sequence.editor.parser;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.sequence.editor.model.LifelineStyle;
import com.sequence.editor.model.Style;

import lombok.experimental.UtilityClass;

/**
 * Style micro-grammars shared by the line parsers.
 *
 * <ul>
 *   <li>shape: {@code [##name] [#fill] [#border][;width][;style]}</li>
 *   <li>message bracket: {@code [##name] [#color][;width][;style]}</li>
 *   <li>definition: {@code [shape][,textMarkup]}</li>
 *   <li>lifeline: {@code [#color][;width][;style]}</li>
 * </ul>
 *
 * The first bare color of a shape is the fill and the second the border.
 */
@UtilityClass
public class StyleSpecParser {

    private static final Pattern FILL = Pattern.compile("^(#[^\\s#;]+)");
    private static final Pattern BORDER = Pattern.compile(
            "^(#[^\\s;]+)?;?(\\d+)?;?(solid|dashed|dotted)?");
    private static final Pattern LIFELINE = Pattern.compile(
            "^(#[^\\s;]+)?(?:;(\\d+)?)?(?:;(solid|dashed|dotted))?$");

    public static Style parseShape(String spec) {
        if (spec == null || spec.isBlank()) {
            return Style.EMPTY;
        }
        Style.StyleBuilder builder = Style.builder();
        String rest = readStyleName(spec.trim(), builder);

        Matcher fill = FILL.matcher(rest);
        if (fill.find()) {
            builder.fill(fill.group(1));
            rest = rest.substring(fill.end()).trim();
        }
        readBorder(rest, builder);
        return builder.build();
    }

    public static Style parseMessageStyle(String spec) {
        if (spec == null || spec.isBlank()) {
            return Style.EMPTY;
        }
        Style.StyleBuilder builder = Style.builder();
        String rest = readStyleName(spec.trim(), builder);
        readBorder(rest, builder);
        return builder.build();
    }

    /**
     * Parses the body of {@code style name ...} and {@code <kind>style ...}.
     * Without a comma, text starting with {@code #} or {@code ;} is a shape and
     * anything else is text markup.
     */
    public static Style parseDefinition(String spec) {
        if (spec == null || spec.isBlank()) {
            return Style.EMPTY;
        }
        String trimmed = spec.trim();
        int comma = trimmed.indexOf(',');
        if (comma >= 0) {
            String shapePart = trimmed.substring(0, comma).trim();
            if (shapePart.isEmpty() || isStyleToken(shapePart)) {
                String markup = trimmed.substring(comma + 1);
                return parseShape(shapePart).toBuilder()
                        .textMarkup(markup.isEmpty() ? null : markup)
                        .build();
            }
            return Style.builder().textMarkup(trimmed).build();
        }
        if (isStyleToken(trimmed)) {
            return parseShape(trimmed);
        }
        return Style.builder().textMarkup(trimmed).build();
    }

    public static LifelineStyle parseLifeline(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new DiagramSyntaxException("Missing lifeline style");
        }
        Matcher m = LIFELINE.matcher(spec.trim());
        if (!m.matches()) {
            throw new DiagramSyntaxException("Invalid lifeline style: " + spec);
        }
        return LifelineStyle.builder()
                .color(m.group(1))
                .width(m.group(2) != null ? parseInt("lifeline width", m.group(2)) : null)
                .lineStyle(m.group(3))
                .build();
    }

    /**
     * Splits leading style tokens (those starting with {@code #} or {@code ;}) from the free text after them.
     */
    public static StyledText splitLeadingStyle(String text) {
        String rest = text == null ? "" : text.trim();
        StringBuilder style = new StringBuilder();
        while (!rest.isEmpty() && isStyleToken(rest)) {
            int space = indexOfWhitespace(rest);
            String token = space < 0 ? rest : rest.substring(0, space);
            if (style.length() > 0) {
                style.append(' ');
            }
            style.append(token);
            rest = space < 0 ? "" : rest.substring(space).trim();
        }
        return new StyledText(style.toString(), rest);
    }

    public static boolean isStyleToken(String text) {
        return text.startsWith("#") || text.startsWith(";");
    }

    private static String readStyleName(String spec, Style.StyleBuilder builder) {
        if (!spec.startsWith("##")) {
            return spec;
        }
        int space = indexOfWhitespace(spec);
        String name = space < 0 ? spec.substring(2) : spec.substring(2, space);
        if (!name.isEmpty()) {
            builder.styleName(name);
        }
        return space < 0 ? "" : spec.substring(space).trim();
    }

    private static void readBorder(String rest, Style.StyleBuilder builder) {
        if (rest.isEmpty()) {
            return;
        }
        Matcher border = BORDER.matcher(rest);
        if (border.find()) {
            builder.border(border.group(1));
            if (border.group(2) != null) {
                builder.borderWidth(parseInt("border width", border.group(2)));
            }
            builder.borderStyle(border.group(3));
        }
    }

    /**
     * Parses a run of digits matched by one of the grammars, rejecting values outside the {@code int} range.
     */
    static int parseInt(String what, String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new DiagramSyntaxException("Invalid " + what + ": " + digits, e);
        }
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
