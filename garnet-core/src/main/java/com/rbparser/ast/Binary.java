package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record Binary(
    Node left,
    String operator,
    Node right,
    Location location,
    List<Comment> comments
) implements Node {

    public Binary(Node left, String operator, Node right, Location location) {
        this(left, operator, right, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.BINARY;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(left, right);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitBinary(this);
    }
}
