package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record RescueMod(
    Node statement,
    Node value,
    Location location,
    List<Comment> comments
) implements Node {

    public RescueMod(Node statement, Node value, Location location) {
        this(statement, value, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.RESCUE_MOD;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(statement, value);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitRescueMod(this);
    }
}
