package com.sequence.editor.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * Base class for all diagram AST nodes.
 *
 * Nodes are immutable once built by the parser. Containers (fragments and
 * participant groups) reference their children by id; the children live in
 * the flat node list of the owning {@link DiagramDocument}.
 */
@Getter
@ToString
@EqualsAndHashCode
public abstract class DiagramNode {
    protected final String id;
    protected final int sourceLineStart;
    protected final int sourceLineEnd;

    protected DiagramNode(@NonNull String id, int sourceLineStart, int sourceLineEnd) {
        this.id = id;
        this.sourceLineStart = sourceLineStart;
        this.sourceLineEnd = sourceLineEnd >= sourceLineStart ? sourceLineEnd : sourceLineStart;
    }

    public abstract NodeType getType();

    public abstract <R> R accept(DiagramNodeVisitor<R> visitor);
}
