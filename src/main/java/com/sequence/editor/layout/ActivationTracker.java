package com.sequence.editor.layout;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sequence.editor.model.MessageNode;

/**
 * Per-participant activation stacks. Bars are emitted when an entry is popped,
 * so nested bars come out before the bars that enclose them.
 */
class ActivationTracker {
    private static final Logger log = LoggerFactory.getLogger(ActivationTracker.class);

    private final Map<String, Deque<OpenActivation>> stacks = new LinkedHashMap<>();
    private final Map<String, String> participantColors = new HashMap<>();
    private final List<ActivationBar> bars = new ArrayList<>();
    private String globalColor;
    private boolean autoActivation;

    void setAutoActivation(boolean enabled) {
        this.autoActivation = enabled;
    }

    /**
     * Sets the default bar colour, for one participant when {@code participant} is given.
     */
    void setActiveColor(String participant, String color) {
        if (participant == null) {
            globalColor = color;
        } else {
            participantColors.put(participant, color);
        }
    }

    void activate(String participant, String color, double y) {
        push(participant, new OpenActivation(y, resolveColor(participant, color), false, null));
    }

    void deactivate(String participant, double y) {
        Deque<OpenActivation> stack = stacks.get(participant);
        if (stack == null || stack.isEmpty()) {
            log.debug("Ignoring deactivate of '{}': no open activation", participant);
            return;
        }
        pop(participant, stack, y);
    }

    /**
     * Applies implicit activation for a message placed at {@code y}. A message
     * back to the caller closes the callee's automatic bar; a call to a
     * participant with no open bar opens one.
     */
    void onMessage(MessageNode message, double y) {
        if (!autoActivation || message.isBoundary() || message.isSelf()) {
            return;
        }
        boolean reversed = message.getArrowType().isReversed();
        String source = reversed ? message.getTo() : message.getFrom();
        String target = reversed ? message.getFrom() : message.getTo();
        Deque<OpenActivation> sourceStack = stacks.get(source);
        if (sourceStack != null && !sourceStack.isEmpty()) {
            OpenActivation top = sourceStack.peek();
            if (top.auto() && target.equals(top.caller())) {
                pop(source, sourceStack, y);
                return;
            }
        }
        if (message.getArrowType().isDashed()) {
            return;
        }
        Deque<OpenActivation> targetStack = stacks.get(target);
        if (targetStack == null || targetStack.isEmpty()) {
            push(target, new OpenActivation(y, resolveColor(target, null), true, source));
        }
    }

    /**
     * Closes every bar still open at {@code y} and returns all bars in the order they were closed.
     */
    List<ActivationBar> finish(double y) {
        for (Map.Entry<String, Deque<OpenActivation>> entry : stacks.entrySet()) {
            Deque<OpenActivation> stack = entry.getValue();
            while (!stack.isEmpty()) {
                pop(entry.getKey(), stack, y);
            }
        }
        return List.copyOf(bars);
    }

    private void push(String participant, OpenActivation activation) {
        stacks.computeIfAbsent(participant, p -> new ArrayDeque<>()).push(activation);
    }

    private void pop(String participant, Deque<OpenActivation> stack, double y) {
        OpenActivation activation = stack.pop();
        bars.add(ActivationBar.builder()
                .participant(participant)
                .startY(activation.startY())
                .endY(Math.max(y, activation.startY()))
                .depth(stack.size())
                .color(activation.color())
                .auto(activation.auto())
                .build());
    }

    private String resolveColor(String participant, String explicit) {
        if (explicit != null) {
            return explicit;
        }
        String perParticipant = participantColors.get(participant);
        return perParticipant != null ? perParticipant : globalColor;
    }

    private record OpenActivation(double startY, String color, boolean auto, String caller) {
    }
}
