package com.sequence.editor.layout;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy packing of messages onto shared Y levels while {@code linear} or
 * {@code parallel} is on. Messages are placed in arrival order; a message
 * joins the open level unless its span overlaps one already claimed there.
 * Spans that only touch at an endpoint do not overlap.
 */
class LinearPacker {

    private final List<double[]> claimed = new ArrayList<>();
    private boolean open;
    private double levelY;
    private double levelHeight;

    boolean isOpen() {
        return open;
    }

    /**
     * Returns the Y of the level the span was placed on. When the span does
     * not fit, the open level is closed first and the cursor moves below it.
     */
    double place(LayoutCursor cursor, double start, double end, double height) {
        if (open && overlapsClaimed(start, end)) {
            close(cursor);
        }
        if (!open) {
            open = true;
            levelY = cursor.getY();
            levelHeight = 0;
        }
        claimed.add(new double[]{start, end});
        levelHeight = Math.max(levelHeight, height);
        return levelY;
    }

    /**
     * Moves the cursor below the tallest member of the open level. No-op when no level is open.
     */
    void close(LayoutCursor cursor) {
        if (!open) {
            return;
        }
        cursor.setY(levelY + levelHeight);
        claimed.clear();
        open = false;
    }

    private boolean overlapsClaimed(double start, double end) {
        for (double[] span : claimed) {
            if (Math.max(start, span[0]) < Math.min(end, span[1])) {
                return true;
            }
        }
        return false;
    }
}
