package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record MAssign(
    MLHS target,
    Node value,
    Location location,
    List<Comment> comments
) implements Node {

    public MAssign(MLHS target, Node value, Location location) {
        this(target, value, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.MASSIGN;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(target, value);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitMAssign(this);
    }
}
