package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record QSymbols(
    String opening,
    List<TStringContent> elements,
    Location location,
    List<Comment> comments
) implements Node {

    public QSymbols(String opening, List<TStringContent> elements, Location location) {
        this(opening, elements, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.QSYMBOLS;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(elements);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitQSymbols(this);
    }
}
