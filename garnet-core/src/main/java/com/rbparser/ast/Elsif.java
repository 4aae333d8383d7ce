package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record Elsif(
    Node predicate,
    Statements statements,
    Node consequent,
    Location location,
    List<Comment> comments
) implements Node {

    public Elsif(Node predicate, Statements statements, Node consequent, Location location) {
        this(predicate, statements, consequent, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.ELSIF;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(predicate, statements, consequent);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitElsif(this);
    }
}
