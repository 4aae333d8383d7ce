package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * An identifier that is not a known local variable, so a method call without receiver or arguments.
 */
public record VCall(
    Ident value,
    Location location,
    List<Comment> comments
) implements Node {

    public VCall(Ident value, Location location) {
        this(value, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.VCALL;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(value);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitVCall(this);
    }
}
