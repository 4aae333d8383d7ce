package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A bare {@code super} that forwards the current arguments.
 */
public record ZSuper(
    Location location,
    List<Comment> comments
) implements Node {

    public ZSuper(Location location) {
        this(location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.ZSUPER;
    }

    @Override
    public List<Node> childNodes() {
        return List.of();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitZSuper(this);
    }
}
