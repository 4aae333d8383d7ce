package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record Redo(
    Location location,
    List<Comment> comments
) implements Node {

    public Redo(Location location) {
        this(location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.REDO;
    }

    @Override
    public List<Node> childNodes() {
        return List.of();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitRedo(this);
    }
}
