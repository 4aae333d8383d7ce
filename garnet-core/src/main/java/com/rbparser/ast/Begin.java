package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record Begin(
    BodyStmt bodystmt,
    Location location,
    List<Comment> comments
) implements Node {

    public Begin(BodyStmt bodystmt, Location location) {
        this(bodystmt, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.BEGIN;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(bodystmt);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitBegin(this);
    }
}
