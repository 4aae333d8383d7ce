package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record Else(
    Kw keyword,
    Statements statements,
    Location location,
    List<Comment> comments
) implements Node {

    public Else(Kw keyword, Statements statements, Location location) {
        this(keyword, statements, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.ELSE;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(keyword, statements);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitElse(this);
    }
}
