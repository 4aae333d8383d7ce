package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record Lambda(
    Node params,
    Node statements,
    Location location,
    List<Comment> comments
) implements Node {

    public Lambda(Node params, Node statements, Location location) {
        this(params, statements, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.LAMBDA;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(params, statements);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitLambda(this);
    }
}
