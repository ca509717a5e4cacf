package com.sequence.editor.layout;

import lombok.Builder;
import lombok.Value;

/**
 * Note box. {@code connectorX} is the lifeline a left/right note points at, {@code null} for notes placed over.
 */
@Value
@Builder
public class NoteGeometry implements NodeGeometry {
    double x;
    double y;
    double width;
    double height;
    Double connectorX;
}
