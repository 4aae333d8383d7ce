package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record DynaSymbol(
    List<Node> parts,
    String quote,
    Location location,
    List<Comment> comments
) implements Node {

    public DynaSymbol(List<Node> parts, String quote, Location location) {
        this(parts, quote, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.DYNA_SYMBOL;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(parts);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitDynaSymbol(this);
    }
}
