package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record Symbols(
    String opening,
    List<Word> elements,
    Location location,
    List<Comment> comments
) implements Node {

    public Symbols(String opening, List<Word> elements, Location location) {
        this(opening, elements, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.SYMBOLS;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(elements);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitSymbols(this);
    }
}
