package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record UnlessNode(
    Node predicate,
    Statements statements,
    Node consequent,
    Location location,
    List<Comment> comments
) implements Node {

    public UnlessNode(Node predicate, Statements statements, Node consequent, Location location) {
        this(predicate, statements, consequent, location, new ArrayList<>());
    }

    public boolean modifier() {
        return statements.location().startChar() < predicate.location().startChar();
    }

    @Override
    public NodeType type() {
        return NodeType.UNLESS_NODE;
    }

    @Override
    public List<Node> childNodes() {
        return modifier() ? Nodes.of(statements, predicate) : Nodes.of(predicate, statements, consequent);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitUnlessNode(this);
    }
}
