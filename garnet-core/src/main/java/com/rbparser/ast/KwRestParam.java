package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A double splat parameter; the name is an {@link Ident}, the {@code nil} keyword for {@code **nil}, or null.
 */
public record KwRestParam(
    Node name,
    Location location,
    List<Comment> comments
) implements Node {

    public KwRestParam(Node name, Location location) {
        this(name, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.KWREST_PARAM;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(name);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitKwRestParam(this);
    }
}
