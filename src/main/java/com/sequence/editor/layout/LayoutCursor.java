package com.sequence.editor.layout;

import lombok.Getter;
import lombok.Setter;

/**
 * Mutable state threaded through one layout pass.
 */
@Getter
@Setter
class LayoutCursor {
    private double y;
    private double messageSpacing;
    /** Next autonumber value, {@code null} while numbering is off. */
    private Integer nextNumber;
    private boolean linear;
    private boolean parallel;

    LayoutCursor(double startY, double messageSpacing) {
        this.y = startY;
        this.messageSpacing = messageSpacing;
    }

    void advance(double amount) {
        y += amount;
    }

    boolean isCompacting() {
        return linear || parallel;
    }

    Integer takeNumber() {
        if (nextNumber == null) {
            return null;
        }
        int number = nextNumber;
        nextNumber = number + 1;
        return number;
    }
}
