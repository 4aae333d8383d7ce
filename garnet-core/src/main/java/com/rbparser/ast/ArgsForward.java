package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * The {@code ...} argument forwarding marker, in parameters and arguments.
 */
public record ArgsForward(
    Location location,
    List<Comment> comments
) implements Node {

    public ArgsForward(Location location) {
        this(location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.ARGS_FORWARD;
    }

    @Override
    public List<Node> childNodes() {
        return List.of();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitArgsForward(this);
    }
}
