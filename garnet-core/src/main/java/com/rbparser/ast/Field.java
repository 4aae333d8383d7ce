package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * An attribute assignment target: {@code foo.bar = value}.
 */
public record Field(
    Node parent,
    Node operator,
    Node name,
    Location location,
    List<Comment> comments
) implements Node {

    public Field(Node parent, Node operator, Node name, Location location) {
        this(parent, operator, name, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.FIELD;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(parent, operator, name);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitField(this);
    }
}
