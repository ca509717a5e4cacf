package com.sequence.editor.layout;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Builder;
import lombok.Value;

/**
 * Output of {@link LayoutEngine#calculateLayout}: geometry per node id,
 * participant columns per alias, activation bars and creation points.
 */
@Value
@Builder
public class LayoutResult {
    Map<String, NodeGeometry> layout;
    Map<String, ParticipantGeometry> participantLayout;
    List<ActivationBar> activationBars;
    Map<String, Double> creationY;
    double totalHeight;

    public <T extends NodeGeometry> Optional<T> geometry(String nodeId, Class<T> type) {
        NodeGeometry geometry = layout.get(nodeId);
        return type.isInstance(geometry) ? Optional.of(type.cast(geometry)) : Optional.empty();
    }

    public List<ActivationBar> barsFor(String participant) {
        return activationBars.stream()
                .filter(bar -> bar.getParticipant().equals(participant))
                .toList();
    }
}
