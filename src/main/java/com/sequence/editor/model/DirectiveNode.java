package com.sequence.editor.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A document-level directive. Each {@link DirectiveType} uses its own subset of
 * the payload fields; unused fields stay {@code null}.
 *
 * <ul>
 *   <li>title, fontfamily: {@code text}</li>
 *   <li>entryspacing, space, autonumber: {@code number} ({@code null} for {@code autonumber off})</li>
 *   <li>participantspacing: {@code number}, or {@code text} "equal"</li>
 *   <li>linear, parallel, autoactivation: {@code enabled}</li>
 *   <li>lifelinestyle: optional {@code participant}, {@code lifelineStyle}</li>
 *   <li>destroy family, deactivate family: {@code participant}</li>
 *   <li>activate, activecolor: {@code participant} (optional for activecolor), {@code color}</li>
 *   <li>frame: {@code style}, {@code text}</li>
 *   <li>style: {@code styleName}, {@code style}; type styles: {@code styleTarget}, {@code style}</li>
 * </ul>
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class DirectiveNode extends DiagramNode {
    public static final String EQUAL_SPACING = "equal";

    private final DirectiveType directiveType;
    private final String text;
    private final Double number;
    private final Boolean enabled;
    private final String participant;
    private final String color;
    private final Style style;
    private final LifelineStyle lifelineStyle;
    private final String styleName;
    private final StyleTarget styleTarget;

    @Builder
    public DirectiveNode(String id, int sourceLineStart, int sourceLineEnd,
                         DirectiveType directiveType, String text, Double number, Boolean enabled,
                         String participant, String color, Style style, LifelineStyle lifelineStyle,
                         String styleName, StyleTarget styleTarget) {
        super(id, sourceLineStart, sourceLineEnd);
        this.directiveType = directiveType;
        this.text = text;
        this.number = number;
        this.enabled = enabled;
        this.participant = participant;
        this.color = color;
        this.style = style;
        this.lifelineStyle = lifelineStyle;
        this.styleName = styleName;
        this.styleTarget = styleTarget;
    }

    public boolean isEnabled() {
        return Boolean.TRUE.equals(enabled);
    }

    public double numberOr(double fallback) {
        return number != null ? number : fallback;
    }

    /**
     * Keyword as written in the DSL, including type style keywords.
     */
    public String keyword() {
        if (directiveType == DirectiveType.TYPE_STYLE && styleTarget != null) {
            return styleTarget.keyword();
        }
        return directiveType.keyword();
    }

    @Override
    public NodeType getType() {
        return NodeType.DIRECTIVE;
    }

    @Override
    public <R> R accept(DiagramNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
