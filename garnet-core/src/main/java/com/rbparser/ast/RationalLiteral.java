package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record RationalLiteral(
    String value,
    Location location,
    List<Comment> comments
) implements Node {

    public RationalLiteral(String value, Location location) {
        this(value, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.RATIONAL_LITERAL;
    }

    @Override
    public List<Node> childNodes() {
        return List.of();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitRationalLiteral(this);
    }
}
