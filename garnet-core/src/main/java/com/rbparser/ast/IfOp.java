package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * The ternary operator.
 */
public record IfOp(
    Node predicate,
    Node truthy,
    Node falsy,
    Location location,
    List<Comment> comments
) implements Node {

    public IfOp(Node predicate, Node truthy, Node falsy, Location location) {
        this(predicate, truthy, falsy, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.IFOP;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(predicate, truthy, falsy);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitIfOp(this);
    }
}
