package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record RangeNode(
    Node left,
    Op operator,
    Node right,
    Location location,
    List<Comment> comments
) implements Node {

    public RangeNode(Node left, Op operator, Node right, Location location) {
        this(left, operator, right, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.RANGE_NODE;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(left, operator, right);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitRangeNode(this);
    }
}
