package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record Not(
    Node statement,
    boolean parentheses,
    Location location,
    List<Comment> comments
) implements Node {

    public Not(Node statement, boolean parentheses, Location location) {
        this(statement, parentheses, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.NOT;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(statement);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitNot(this);
    }
}
