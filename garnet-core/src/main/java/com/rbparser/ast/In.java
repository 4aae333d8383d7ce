package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record In(
    Node pattern,
    Statements statements,
    Node consequent,
    Location location,
    List<Comment> comments
) implements Node {

    public In(Node pattern, Statements statements, Node consequent, Location location) {
        this(pattern, statements, consequent, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.IN;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(pattern, statements, consequent);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitIn(this);
    }
}
