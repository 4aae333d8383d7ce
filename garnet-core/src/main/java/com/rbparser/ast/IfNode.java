package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record IfNode(
    Node predicate,
    Statements statements,
    Node consequent,
    Location location,
    List<Comment> comments
) implements Node {

    public IfNode(Node predicate, Statements statements, Node consequent, Location location) {
        this(predicate, statements, consequent, location, new ArrayList<>());
    }

    /**
     * True for the trailing form, {@code statement if predicate}.
     */
    public boolean modifier() {
        return statements.location().startChar() < predicate.location().startChar();
    }

    @Override
    public NodeType type() {
        return NodeType.IF_NODE;
    }

    @Override
    public List<Node> childNodes() {
        return modifier() ? Nodes.of(statements, predicate) : Nodes.of(predicate, statements, consequent);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitIfNode(this);
    }
}
