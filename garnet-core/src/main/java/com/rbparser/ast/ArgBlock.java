package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record ArgBlock(
    Node value,
    Location location,
    List<Comment> comments
) implements Node {

    public ArgBlock(Node value, Location location) {
        this(value, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.ARG_BLOCK;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(value);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitArgBlock(this);
    }
}
