package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record Args(
    List<Node> parts,
    Location location,
    List<Comment> comments
) implements Node {

    public Args(List<Node> parts, Location location) {
        this(parts, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.ARGS;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(parts);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitArgs(this);
    }
}
