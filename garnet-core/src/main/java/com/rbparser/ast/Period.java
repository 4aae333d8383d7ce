package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A call operator: {@code .}, {@code &.} or {@code ::}.
 */
public record Period(
    String value,
    Location location,
    List<Comment> comments
) implements Node {

    public Period(String value, Location location) {
        this(value, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.PERIOD;
    }

    @Override
    public List<Node> childNodes() {
        return List.of();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitPeriod(this);
    }
}
