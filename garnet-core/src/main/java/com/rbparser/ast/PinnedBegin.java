package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A pinned expression in a pattern: {@code ^(expr)}.
 */
public record PinnedBegin(
    Node statement,
    Location location,
    List<Comment> comments
) implements Node {

    public PinnedBegin(Node statement, Location location) {
        this(statement, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.PINNED_BEGIN;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(statement);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitPinnedBegin(this);
    }
}
