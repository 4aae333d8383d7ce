package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record Backtick(
    String value,
    Location location,
    List<Comment> comments
) implements Node {

    public Backtick(String value, Location location) {
        this(value, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.BACKTICK;
    }

    @Override
    public List<Node> childNodes() {
        return List.of();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitBacktick(this);
    }
}
