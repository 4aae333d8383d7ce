package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record OpAssign(
    Node target,
    Op operator,
    Node value,
    Location location,
    List<Comment> comments
) implements Node {

    public OpAssign(Node target, Op operator, Node value, Location location) {
        this(target, operator, value, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.OP_ASSIGN;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(target, operator, value);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitOpAssign(this);
    }
}
