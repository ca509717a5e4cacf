package com.sequence.editor.layout;

import lombok.Builder;
import lombok.Value;

/**
 * Message arrow geometry. {@code endY} is below {@code y} only for delayed messages.
 * {@code unknownFrom}/{@code unknownTo} hold aliases that matched no participant.
 */
@Value
@Builder
public class MessageGeometry implements NodeGeometry {
    double y;
    double endY;
    double fromX;
    double toX;
    double height;
    int delay;
    Integer number;
    boolean boundary;
    String unknownFrom;
    String unknownTo;
}
