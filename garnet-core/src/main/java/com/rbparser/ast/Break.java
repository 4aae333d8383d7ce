package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record Break(
    Args arguments,
    Location location,
    List<Comment> comments
) implements Node {

    public Break(Args arguments, Location location) {
        this(arguments, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.BREAK;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(arguments);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitBreak(this);
    }
}
