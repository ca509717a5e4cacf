package com.sequence.editor.layout;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class FragmentGeometry implements NodeGeometry {
    double x;
    double y;
    double width;
    double height;
    @Singular("elseDividerY")
    List<Double> elseDividerYs;
    boolean collapsed;

    public double getBottom() {
        return y + height;
    }
}
