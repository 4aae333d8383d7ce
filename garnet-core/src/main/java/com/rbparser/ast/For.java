package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record For(
    Node index,
    Node collection,
    Statements statements,
    Location location,
    List<Comment> comments
) implements Node {

    public For(Node index, Node collection, Statements statements, Location location) {
        this(index, collection, statements, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.FOR;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(index, collection, statements);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitFor(this);
    }
}
