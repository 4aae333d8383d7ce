package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * The exception list and binding of a rescue clause.
 */
public record RescueEx(
    Node exceptions,
    Node variable,
    Location location,
    List<Comment> comments
) implements Node {

    public RescueEx(Node exceptions, Node variable, Location location) {
        this(exceptions, variable, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.RESCUE_EX;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(exceptions, variable);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitRescueEx(this);
    }
}
