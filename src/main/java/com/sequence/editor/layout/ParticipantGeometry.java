package com.sequence.editor.layout;

import lombok.Value;

@Value
public class ParticipantGeometry implements NodeGeometry {
    String alias;
    double x;
    double y;
    double width;
    double height;

    public double getCenterX() {
        return x + width / 2;
    }

    public double getRight() {
        return x + width;
    }
}
