package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Rightward assignment and single-line pattern matching: {@code expr => pattern} and {@code expr in pattern}.
 */
public record RAssign(
    Node value,
    Node operator,
    Node pattern,
    Location location,
    List<Comment> comments
) implements Node {

    public RAssign(Node value, Node operator, Node pattern, Location location) {
        this(value, operator, pattern, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.RASSIGN;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(value, operator, pattern);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitRAssign(this);
    }
}
