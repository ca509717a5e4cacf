package com.sequence.editor.style;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sequence.editor.model.DiagramDocument;
import com.sequence.editor.model.DirectiveNode;
import com.sequence.editor.model.DirectiveType;
import com.sequence.editor.model.Style;
import com.sequence.editor.model.StyleTarget;

/**
 * Resolves the style cascade for one document, key by key:
 * inline style, then the named style it references ({@code ##name}), then the
 * type style for the node kind. Hard defaults are left to the renderer
 * ({@link Style#withDefaults(Style)}).
 *
 * A reference to a named style that was never defined contributes nothing.
 */
public class StyleResolver {
    private static final Logger log = LoggerFactory.getLogger(StyleResolver.class);

    private final Map<String, Style> namedStyles;
    private final Map<StyleTarget, Style> typeStyles;

    public StyleResolver(Map<String, Style> namedStyles, Map<StyleTarget, Style> typeStyles) {
        this.namedStyles = Collections.unmodifiableMap(new HashMap<>(namedStyles));
        this.typeStyles = typeStyles.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(typeStyles));
    }

    /**
     * Collects every {@code style} and {@code <kind>style} definition. A later definition of the same name wins.
     */
    public static StyleResolver of(DiagramDocument document) {
        Map<String, Style> named = new HashMap<>();
        Map<StyleTarget, Style> typed = new EnumMap<>(StyleTarget.class);
        for (DirectiveNode directive : document.nodesOfType(DirectiveNode.class)) {
            if (directive.getDirectiveType() == DirectiveType.NAMED_STYLE && directive.getStyleName() != null) {
                named.put(directive.getStyleName(), Style.orEmpty(directive.getStyle()));
            } else if (directive.getDirectiveType() == DirectiveType.TYPE_STYLE && directive.getStyleTarget() != null) {
                typed.put(directive.getStyleTarget(), Style.orEmpty(directive.getStyle()));
            }
        }
        return new StyleResolver(named, typed);
    }

    public Optional<Style> namedStyle(String name) {
        return Optional.ofNullable(namedStyles.get(name));
    }

    public Optional<Style> typeStyle(StyleTarget target) {
        return Optional.ofNullable(typeStyles.get(target));
    }

    public Style resolve(StyleTarget target, Style inline) {
        Style own = Style.orEmpty(inline);
        Style named = Style.EMPTY;
        if (own.getStyleName() != null) {
            named = namedStyles.get(own.getStyleName());
            if (named == null) {
                log.debug("Named style '{}' is not defined, ignoring", own.getStyleName());
                named = Style.EMPTY;
            }
        }
        Style typed = target != null ? typeStyles.getOrDefault(target, Style.EMPTY) : Style.EMPTY;
        return own.toBuilder().styleName(null).build()
                .overlay(named)
                .overlay(typed);
    }
}
