package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Adjacent string literals, optionally joined by a line continuation.
 */
public record StringConcat(
    Node left,
    Node right,
    Location location,
    List<Comment> comments
) implements Node {

    public StringConcat(Node left, Node right, Location location) {
        this(left, right, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.STRING_CONCAT;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(left, right);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitStringConcat(this);
    }
}
