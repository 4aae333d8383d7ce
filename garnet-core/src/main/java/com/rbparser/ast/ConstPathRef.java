package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record ConstPathRef(
    Node parent,
    Const constant,
    Location location,
    List<Comment> comments
) implements Node {

    public ConstPathRef(Node parent, Const constant, Location location) {
        this(parent, constant, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.CONST_PATH_REF;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(parent, constant);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitConstPathRef(this);
    }
}
