package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record Undef(
    List<Node> symbols,
    Location location,
    List<Comment> comments
) implements Node {

    public Undef(List<Node> symbols, Location location) {
        this(symbols, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.UNDEF;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(symbols);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitUndef(this);
    }
}
