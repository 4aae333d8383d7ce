package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record StringEmbExpr(
    Statements statements,
    Location location,
    List<Comment> comments
) implements Node {

    public StringEmbExpr(Statements statements, Location location) {
        this(statements, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.STRING_EMBEXPR;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(statements);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitStringEmbExpr(this);
    }
}
