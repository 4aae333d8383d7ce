package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A key/value pair. The value is null for the shorthand form {@code {x:}}.
 */
public record Assoc(
    Node key,
    Node value,
    Location location,
    List<Comment> comments
) implements Node {

    public Assoc(Node key, Node value, Location location) {
        this(key, value, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.ASSOC;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(key, value);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitAssoc(this);
    }
}
