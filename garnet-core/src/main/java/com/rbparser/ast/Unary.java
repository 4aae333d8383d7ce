package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record Unary(
    String operator,
    Node statement,
    Location location,
    List<Comment> comments
) implements Node {

    public Unary(String operator, Node statement, Location location) {
        this(operator, statement, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.UNARY;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(statement);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitUnary(this);
    }
}
