package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A hash key or keyword argument label, including the trailing colon.
 */
public record Label(
    String value,
    Location location,
    List<Comment> comments
) implements Node {

    public Label(String value, Location location) {
        this(value, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.LABEL;
    }

    @Override
    public List<Node> childNodes() {
        return List.of();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitLabel(this);
    }
}
