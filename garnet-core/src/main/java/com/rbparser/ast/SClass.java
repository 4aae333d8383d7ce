package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record SClass(
    Node target,
    BodyStmt bodystmt,
    Location location,
    List<Comment> comments
) implements Node {

    public SClass(Node target, BodyStmt bodystmt, Location location) {
        this(target, bodystmt, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.SCLASS;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(target, bodystmt);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitSClass(this);
    }
}
