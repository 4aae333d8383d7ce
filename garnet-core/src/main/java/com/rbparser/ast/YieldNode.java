package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record YieldNode(
    Node arguments,
    Location location,
    List<Comment> comments
) implements Node {

    public YieldNode(Node arguments, Location location) {
        this(arguments, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.YIELD_NODE;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(arguments);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitYieldNode(this);
    }
}
