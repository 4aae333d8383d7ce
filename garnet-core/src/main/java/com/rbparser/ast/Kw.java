package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A keyword, kept as a node wherever the keyword itself can carry comments.
 */
public record Kw(
    String value,
    Location location,
    List<Comment> comments
) implements Node {

    public Kw(String value, Location location) {
        this(value, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.KW;
    }

    @Override
    public List<Node> childNodes() {
        return List.of();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitKw(this);
    }
}
