package com.sequence.editor.layout;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A closed activation interval on a participant's lifeline.
 * {@code depth} is 0 for the outermost bar of a participant.
 */
@Value
@Builder
public class ActivationBar {
    @NonNull
    String participant;
    double startY;
    double endY;
    int depth;
    String color;
    boolean auto;

    public boolean contains(ActivationBar other) {
        return startY <= other.startY && other.endY <= endY;
    }
}
