package com.sequence.editor.layout;

import lombok.Value;

/**
 * Axis-aligned box, used for errors, dividers, participant groups and the frame.
 */
@Value
public class BoxGeometry implements NodeGeometry {
    double x;
    double y;
    double width;
    double height;

    public double getRight() {
        return x + width;
    }

    public double getBottom() {
        return y + height;
    }
}
