package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record StringDVar(
    Node variable,
    Location location,
    List<Comment> comments
) implements Node {

    public StringDVar(Node variable, Location location) {
        this(variable, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.STRING_DVAR;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(variable);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitStringDVar(this);
    }
}
