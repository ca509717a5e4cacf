package com.sequence.editor.layout;

import lombok.Builder;
import lombok.Value;

/**
 * Layout constants, in SVG user units.
 */
@Value
@Builder(toBuilder = true)
public class LayoutConfig {

    // Participants
    @Builder.Default double participantStartX = 50;
    @Builder.Default double participantStartY = 50;
    @Builder.Default double participantMinWidth = 80;
    @Builder.Default double participantDefaultWidth = 100;
    @Builder.Default double participantPadding = 20;
    @Builder.Default double participantCharWidth = 7.5;
    @Builder.Default double participantHeight = 60;
    @Builder.Default double participantSpacing = 150;
    @Builder.Default double participantGap = 20;
    @Builder.Default double titleHeight = 30;
    @Builder.Default double bottomParticipantsHeight = 70;

    // Messages
    @Builder.Default double messageStartY = 150;
    @Builder.Default double messageSpacing = 50;
    @Builder.Default double delayUnit = 10;
    @Builder.Default double lineHeight = 16;
    @Builder.Default double charWidth = 7;
    @Builder.Default double boundaryOffset = 30;
    @Builder.Default double selfMessageWidth = 40;
    @Builder.Default double selfMessageLabelGap = 5;
    @Builder.Default double messageLabelPadding = 20;

    // Vertical increments
    @Builder.Default double blanklineSpacing = 20;
    @Builder.Default double spaceUnit = 20;
    @Builder.Default double errorHeight = 40;
    @Builder.Default double errorMargin = 10;
    @Builder.Default double dividerHeight = 24;
    @Builder.Default double dividerOverhang = 20;

    // Fragments
    @Builder.Default double fragmentHeaderHeight = 45;
    @Builder.Default double fragmentPadding = 5;
    @Builder.Default double fragmentMargin = 20;
    @Builder.Default double fragmentSidePadding = 20;
    @Builder.Default double elseLabelHeight = 35;
    @Builder.Default double collapsedContentHeight = 10;

    // Notes
    @Builder.Default double noteMinWidth = 50;
    @Builder.Default double noteMinHeight = 28;
    @Builder.Default double notePaddingH = 8;
    @Builder.Default double notePaddingV = 6;
    @Builder.Default double noteMargin = 35;
    @Builder.Default double noteConnectorGap = 8;

    // Groups and frame
    @Builder.Default double groupPadding = 10;
    @Builder.Default double groupLabelHeight = 25;
    @Builder.Default double framePadding = 40;
    @Builder.Default double frameTop = 10;

    @Builder.Default double margin = 50;

    public static LayoutConfig defaults() {
        return LayoutConfig.builder().build();
    }
}
