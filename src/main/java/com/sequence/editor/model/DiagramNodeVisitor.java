package com.sequence.editor.model;

/**
 * Visitor pattern interface for traversing the diagram AST.
 */
public interface DiagramNodeVisitor<R> {
    R visit(ParticipantNode participant);
    R visit(MessageNode message);
    R visit(FragmentNode fragment);
    R visit(ParticipantGroupNode group);
    R visit(NoteNode note);
    R visit(DividerNode divider);
    R visit(CommentNode comment);
    R visit(BlanklineNode blankline);
    R visit(DirectiveNode directive);
    R visit(ErrorNode error);
}
