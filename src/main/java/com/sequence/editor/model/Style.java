package com.sequence.editor.model;

import lombok.Builder;
import lombok.Value;

/**
 * Visual style attached to a node, a named style or a type style.
 *
 * A {@code null} field means the key was never specified. An explicit value,
 * including a border width of 0, is kept as written so the style cascade can
 * tell the two apart.
 */
@Value
@Builder(toBuilder = true)
public class Style {
    public static final Style EMPTY = Style.builder().build();

    String fill;
    String border;
    Integer borderWidth;
    String borderStyle;
    String operatorColor;
    String textMarkup;
    String styleName;

    public boolean isEmpty() {
        return fill == null && border == null && borderWidth == null && borderStyle == null
                && operatorColor == null && textMarkup == null && styleName == null;
    }

    public boolean hasBorderPart() {
        return border != null || borderWidth != null || borderStyle != null;
    }

    /**
     * Returns a style where every key set on this style wins and every
     * missing key is taken from {@code lower}.
     */
    public Style overlay(Style lower) {
        if (lower == null || lower.isEmpty()) {
            return this;
        }
        return Style.builder()
                .fill(fill != null ? fill : lower.fill)
                .border(border != null ? border : lower.border)
                .borderWidth(borderWidth != null ? borderWidth : lower.borderWidth)
                .borderStyle(borderStyle != null ? borderStyle : lower.borderStyle)
                .operatorColor(operatorColor != null ? operatorColor : lower.operatorColor)
                .textMarkup(textMarkup != null ? textMarkup : lower.textMarkup)
                .styleName(styleName != null ? styleName : lower.styleName)
                .build();
    }

    public Style withDefaults(Style defaults) {
        return overlay(defaults);
    }

    public static Style orEmpty(Style style) {
        return style != null ? style : EMPTY;
    }
}
