package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record Next(
    Args arguments,
    Location location,
    List<Comment> comments
) implements Node {

    public Next(Args arguments, Location location) {
        this(arguments, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.NEXT;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(arguments);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitNext(this);
    }
}
