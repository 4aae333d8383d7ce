package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record Assign(
    Node target,
    Node value,
    Location location,
    List<Comment> comments
) implements Node {

    public Assign(Node target, Node value, Location location) {
        this(target, value, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.ASSIGN;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(target, value);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitAssign(this);
    }
}
