package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record SymbolLiteral(
    Node value,
    Location location,
    List<Comment> comments
) implements Node {

    public SymbolLiteral(Node value, Location location) {
        this(value, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.SYMBOL_LITERAL;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(value);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitSymbolLiteral(this);
    }
}
