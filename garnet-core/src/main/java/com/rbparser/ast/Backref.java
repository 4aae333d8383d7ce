package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A regular expression back reference such as {@code $1} or {@code $&}.
 */
public record Backref(
    String value,
    Location location,
    List<Comment> comments
) implements Node {

    public Backref(String value, Location location) {
        this(value, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.BACKREF;
    }

    @Override
    public List<Node> childNodes() {
        return List.of();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitBackref(this);
    }
}
