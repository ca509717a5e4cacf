package com.sequence.editor.model;

import lombok.Builder;
import lombok.Value;

/**
 * Payload of a {@code lifelinestyle} directive. Absent parts are {@code null}.
 */
@Value
@Builder
public class LifelineStyle {
    String color;
    Integer width;
    String lineStyle;
}
