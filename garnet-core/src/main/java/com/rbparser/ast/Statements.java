package com.rbparser.ast;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * A sequence of statements. Own-line comments that fall inside the bounds of the
 * list become part of {@code body} when the list is bound.
 */
public record Statements(
    List<Node> body,
    Location location,
    List<Comment> comments
) implements Node {

    public Statements(List<Node> body, Location location) {
        this(body, location, new ArrayList<>());
    }

    public boolean isEmpty() {
        return body.stream().allMatch(node -> node instanceof VoidStmt);
    }

    /**
     * Fixes the bounds of this list once the parent knows them, moves a leading
     * void statement to the start and splices in the pending own-line comments
     * that fall inside the new bounds.
     */
    public Statements bind(SourceContext context, int startChar, int endChar) {
        Location bound = context.range(startChar, endChar);
        List<Node> nodes = new ArrayList<>(body);
        if (!nodes.isEmpty() && nodes.get(0) instanceof VoidStmt) {
            nodes.set(0, new VoidStmt(Location.fixed(bound.startLine(), startChar)));
        }
        attachComments(context, nodes, startChar, endChar);
        return new Statements(nodes, bound, comments);
    }

    private static void attachComments(SourceContext context, List<Node> nodes, int startChar, int endChar) {
        Iterator<Comment> pending = context.pendingComments().iterator();
        int index = 0;
        while (pending.hasNext()) {
            Comment comment = pending.next();
            Location location = comment.location();
            if (comment.inline() || comment.ignore()
                    || location.startChar() < startChar || location.endChar() > endChar) {
                continue;
            }
            while (index < nodes.size()
                    && (nodes.get(index) instanceof VoidStmt
                        || nodes.get(index).location().startChar() < location.startChar())) {
                index++;
            }
            if (index > 0) {
                Location previous = nodes.get(index - 1).location();
                if (previous.startChar() < location.startChar() && previous.endChar() > location.startChar()) {
                    // attached later to a node inside the enclosing statement
                    continue;
                }
            }
            pending.remove();
            nodes.add(index, comment);
        }
    }

    @Override
    public NodeType type() {
        return NodeType.STATEMENTS;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(body);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitStatements(this);
    }
}
