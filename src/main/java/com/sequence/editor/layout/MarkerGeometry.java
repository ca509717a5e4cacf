package com.sequence.editor.layout;

import com.sequence.editor.model.DirectiveType;

import lombok.Value;

/**
 * Vertical position of a lifecycle or activation directive on a participant's lifeline.
 */
@Value
public class MarkerGeometry implements NodeGeometry {
    double y;
    DirectiveType kind;
    String participant;
}
