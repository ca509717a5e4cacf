package com.sequence.editor.layout;

/**
 * Geometry computed for one node id. Every geometry has a vertical anchor.
 */
public interface NodeGeometry {
    double getY();
}
