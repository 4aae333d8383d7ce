package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Parenthesized call arguments. The arguments are null for {@code foo()}.
 */
public record ArgParen(
    Node arguments,
    Location location,
    List<Comment> comments
) implements Node {

    public ArgParen(Node arguments, Location location) {
        this(arguments, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.ARG_PAREN;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(arguments);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitArgParen(this);
    }
}
