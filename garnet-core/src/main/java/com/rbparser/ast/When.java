package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record When(
    Args arguments,
    Statements statements,
    Node consequent,
    Location location,
    List<Comment> comments
) implements Node {

    public When(Args arguments, Statements statements, Node consequent, Location location) {
        this(arguments, statements, consequent, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.WHEN;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(arguments, statements, consequent);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitWhen(this);
    }
}
