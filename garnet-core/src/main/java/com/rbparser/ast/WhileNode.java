package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record WhileNode(
    Node predicate,
    Statements statements,
    Location location,
    List<Comment> comments
) implements Node {

    public WhileNode(Node predicate, Statements statements, Location location) {
        this(predicate, statements, location, new ArrayList<>());
    }

    /**
     * True for the trailing form, {@code statement while predicate}.
     */
    public boolean modifier() {
        return statements.location().startChar() < predicate.location().startChar();
    }

    @Override
    public NodeType type() {
        return NodeType.WHILE_NODE;
    }

    @Override
    public List<Node> childNodes() {
        return modifier() ? Nodes.of(statements, predicate) : Nodes.of(predicate, statements);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitWhileNode(this);
    }
}
