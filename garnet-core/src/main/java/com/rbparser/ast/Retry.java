package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record Retry(
    Location location,
    List<Comment> comments
) implements Node {

    public Retry(Location location) {
        this(location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.RETRY;
    }

    @Override
    public List<Node> childNodes() {
        return List.of();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitRetry(this);
    }
}
