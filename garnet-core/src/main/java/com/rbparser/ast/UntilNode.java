package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record UntilNode(
    Node predicate,
    Statements statements,
    Location location,
    List<Comment> comments
) implements Node {

    public UntilNode(Node predicate, Statements statements, Location location) {
        this(predicate, statements, location, new ArrayList<>());
    }

    public boolean modifier() {
        return statements.location().startChar() < predicate.location().startChar();
    }

    @Override
    public NodeType type() {
        return NodeType.UNTIL_NODE;
    }

    @Override
    public List<Node> childNodes() {
        return modifier() ? Nodes.of(statements, predicate) : Nodes.of(predicate, statements);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitUntilNode(this);
    }
}
