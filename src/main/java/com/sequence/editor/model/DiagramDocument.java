package com.sequence.editor.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A parsed diagram: the ordered node arena plus an id index.
 *
 * Containers precede their children in {@link #getNodes()}. A node owned by
 * a fragment, an else clause or a parent group is not a top-level entry.
 */
@Getter
@ToString(onlyExplicitlyIncluded = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class DiagramDocument {
    @ToString.Include
    @EqualsAndHashCode.Include
    private final List<DiagramNode> nodes;

    private final Map<String, DiagramNode> nodesById;

    public DiagramDocument(List<? extends DiagramNode> nodes) {
        this.nodes = List.copyOf(nodes);
        Map<String, DiagramNode> index = new LinkedHashMap<>();
        for (DiagramNode node : this.nodes) {
            index.put(node.getId(), node);
        }
        this.nodesById = Collections.unmodifiableMap(index);
    }

    public static DiagramDocument empty() {
        return new DiagramDocument(List.of());
    }

    public Optional<DiagramNode> findById(String id) {
        return Optional.ofNullable(nodesById.get(id));
    }

    public <T extends DiagramNode> Optional<T> findById(String id, Class<T> type) {
        DiagramNode node = nodesById.get(id);
        return type.isInstance(node) ? Optional.of(type.cast(node)) : Optional.empty();
    }

    public <T extends DiagramNode> List<T> nodesOfType(Class<T> type) {
        List<T> result = new ArrayList<>();
        for (DiagramNode node : nodes) {
            if (type.isInstance(node)) {
                result.add(type.cast(node));
            }
        }
        return result;
    }

    public List<ErrorNode> getErrors() {
        return nodesOfType(ErrorNode.class);
    }

    public boolean hasErrors() {
        return nodes.stream().anyMatch(n -> n instanceof ErrorNode);
    }

    /**
     * Participants keyed by alias in declaration order. The first declaration of an alias wins.
     */
    public Map<String, ParticipantNode> participantsByAlias() {
        Map<String, ParticipantNode> byAlias = new LinkedHashMap<>();
        for (ParticipantNode participant : nodesOfType(ParticipantNode.class)) {
            byAlias.putIfAbsent(participant.getAlias(), participant);
        }
        return byAlias;
    }

    /**
     * Ids referenced by a fragment, an else clause or a parent participant group.
     */
    public Set<String> ownedNodeIds() {
        Set<String> owned = new HashSet<>();
        for (DiagramNode node : nodes) {
            if (node instanceof FragmentNode fragment) {
                owned.addAll(fragment.getAllEntries());
            } else if (node instanceof ParticipantGroupNode group) {
                owned.addAll(group.getNestedGroups());
            }
        }
        return owned;
    }

    /**
     * Aliases listed by any participant group, nested groups included.
     */
    public Set<String> groupedParticipantAliases() {
        Set<String> aliases = new LinkedHashSet<>();
        for (ParticipantGroupNode group : nodesOfType(ParticipantGroupNode.class)) {
            aliases.addAll(group.getParticipants());
        }
        return aliases;
    }

    /**
     * Nodes that are not owned by any container, in document order.
     */
    public List<DiagramNode> topLevelNodes() {
        Set<String> owned = ownedNodeIds();
        List<DiagramNode> result = new ArrayList<>();
        for (DiagramNode node : nodes) {
            if (!owned.contains(node.getId())) {
                result.add(node);
            }
        }
        return result;
    }

    public Optional<DirectiveNode> findDirective(DirectiveType type) {
        return nodesOfType(DirectiveNode.class).stream()
                .filter(d -> d.getDirectiveType() == type)
                .findFirst();
    }

    /**
     * Returns a new document where the node with the same id is replaced. Other nodes are shared.
     */
    public DiagramDocument withNode(DiagramNode replacement) {
        List<DiagramNode> copy = new ArrayList<>(nodes.size());
        for (DiagramNode node : nodes) {
            copy.add(node.getId().equals(replacement.getId()) ? replacement : node);
        }
        return new DiagramDocument(copy);
    }
}
