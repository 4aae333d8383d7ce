package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record CVar(
    String value,
    Location location,
    List<Comment> comments
) implements Node {

    public CVar(String value, Location location) {
        this(value, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.CVAR;
    }

    @Override
    public List<Node> childNodes() {
        return List.of();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitCVar(this);
    }
}
