package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record Super(
    Node arguments,
    Location location,
    List<Comment> comments
) implements Node {

    public Super(Node arguments, Location location) {
        this(arguments, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.SUPER;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(arguments);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitSuper(this);
    }
}
