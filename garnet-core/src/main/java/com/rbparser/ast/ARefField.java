package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record ARefField(
    Node collection,
    Args index,
    Location location,
    List<Comment> comments
) implements Node {

    public ARefField(Node collection, Args index, Location location) {
        this(collection, index, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.AREF_FIELD;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(collection, index);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitARefField(this);
    }
}
